package io.hhplus.eventledger.application.usecase.order;

import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.order.Order;

/**
 * 주문 생성 결과
 *
 * @param order VALIDATION_FAILED가 아니면 존재
 * @param eventId 원장에 기록된 이벤트 ID (CREATED, STORED_NOT_PUBLISHED)
 * @param errorCode 실패 결과일 때 존재
 */
public record CreateOrderResult(
    CreateOrderOutcome outcome,
    Order order,
    String eventId,
    ErrorCode errorCode,
    String message
) {

    public static CreateOrderResult created(Order order, String eventId) {
        return new CreateOrderResult(CreateOrderOutcome.CREATED, order, eventId, null, null);
    }

    public static CreateOrderResult alreadyExists(Order order) {
        return new CreateOrderResult(
            CreateOrderOutcome.ALREADY_EXISTS, order, null,
            ErrorCode.ORDER_ALREADY_EXISTS, ErrorCode.ORDER_ALREADY_EXISTS.getMessage()
        );
    }

    public static CreateOrderResult validationFailed(ErrorCode errorCode, String message) {
        return new CreateOrderResult(CreateOrderOutcome.VALIDATION_FAILED, null, null, errorCode, message);
    }

    public static CreateOrderResult storeUnavailable(Order order, ErrorCode errorCode, String message) {
        return new CreateOrderResult(CreateOrderOutcome.STORE_UNAVAILABLE, order, null, errorCode, message);
    }

    public static CreateOrderResult storedNotPublished(Order order, String eventId, ErrorCode errorCode, String message) {
        return new CreateOrderResult(CreateOrderOutcome.STORED_NOT_PUBLISHED, order, eventId, errorCode, message);
    }

    public static CreateOrderResult eventBuildFailed(Order order, ErrorCode errorCode, String message) {
        return new CreateOrderResult(CreateOrderOutcome.EVENT_BUILD_FAILED, order, null, errorCode, message);
    }

    public boolean isRetriable() {
        return outcome.isRetriable();
    }
}
