package io.hhplus.eventledger.application.usecase.event;

import io.hhplus.eventledger.common.exception.ErrorCode;

public record RepublishResult(
    RepublishOutcome outcome,
    String eventId,
    ErrorCode errorCode,
    String message
) {

    public static RepublishResult published(String eventId) {
        return new RepublishResult(RepublishOutcome.PUBLISHED, eventId, null, null);
    }

    public static RepublishResult notFound(String eventId) {
        return new RepublishResult(
            RepublishOutcome.NOT_FOUND, eventId,
            ErrorCode.EVENT_NOT_FOUND, ErrorCode.EVENT_NOT_FOUND.getMessage() + ". eventId: " + eventId
        );
    }

    public static RepublishResult failed(RepublishOutcome outcome, String eventId, ErrorCode errorCode, String message) {
        return new RepublishResult(outcome, eventId, errorCode, message);
    }

    public boolean isPublished() {
        return outcome == RepublishOutcome.PUBLISHED;
    }
}
