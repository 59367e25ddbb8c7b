package io.hhplus.eventledger.application.usecase.projection;

import io.hhplus.eventledger.common.exception.ErrorCode;

/**
 * @param eventId 해석에 실패한 경우 null
 * @param errorCode DROPPED/RETRY일 때만 존재
 */
public record ProjectionResult(
    ProjectionOutcome outcome,
    String eventId,
    ErrorCode errorCode
) {

    public static ProjectionResult applied(String eventId) {
        return new ProjectionResult(ProjectionOutcome.APPLIED, eventId, null);
    }

    public static ProjectionResult alreadyApplied(String eventId) {
        return new ProjectionResult(ProjectionOutcome.ALREADY_APPLIED, eventId, null);
    }

    public static ProjectionResult dropped(String eventId, ErrorCode errorCode) {
        return new ProjectionResult(ProjectionOutcome.DROPPED, eventId, errorCode);
    }

    public static ProjectionResult retry(String eventId, ErrorCode errorCode) {
        return new ProjectionResult(ProjectionOutcome.RETRY, eventId, errorCode);
    }

    /**
     * RETRY만 재전달, 나머지는 모두 확인 응답
     */
    public Delivery delivery() {
        return outcome == ProjectionOutcome.RETRY ? Delivery.REDELIVER : Delivery.ACK;
    }

    public enum Delivery {
        ACK,
        REDELIVER
    }
}
