package io.hhplus.eventledger.application.usecase.order;

import io.hhplus.eventledger.application.usecase.UseCase;
import io.hhplus.eventledger.application.usecase.event.PublicationFailureRecorder;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.common.exception.FailureKind;
import io.hhplus.eventledger.domain.event.AppendOutcome;
import io.hhplus.eventledger.domain.event.EventBuilder;
import io.hhplus.eventledger.domain.event.EventLedger;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import io.hhplus.eventledger.domain.order.Order;
import io.hhplus.eventledger.domain.order.OrderFactory;
import io.hhplus.eventledger.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 주문 생성 UseCase
 * <p>
 * 흐름: 검증 → 이벤트 생성 → 원장 기록 → 발행
 * <p>
 * 멱등성:
 * - 원장의 조건부 insert가 유일한 중복 판정 지점이다
 * - CONFLICT는 ALREADY_EXISTS로 돌려준다 (발행하지 않음)
 * <p>
 * 발행 실패:
 * - 원장 기록은 되돌리지 않는다
 * - STORED_NOT_PUBLISHED + eventId를 돌려주고 재발행 대기열에 올린다
 * - 같은 이벤트에 대해 append를 다시 호출하지 않는다
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateOrderUseCase {

    private final OrderFactory orderFactory;
    private final EventBuilder eventBuilder;
    private final EventLedger eventLedger;
    private final EventPublisher eventPublisher;
    private final PublicationFailureRecorder publicationFailureRecorder;
    private final ErrorClassifier errorClassifier;
    private final MetricsCollector metricsCollector;

    public CreateOrderResult execute(CreateOrderCommand command) {
        long startTime = System.currentTimeMillis();
        CreateOrderResult result = handle(command);
        metricsCollector.recordCommand(result.outcome().name(), result.errorCode(), startTime);
        return result;
    }

    private CreateOrderResult handle(CreateOrderCommand command) {
        // 1. 검증
        Order order;
        try {
            order = orderFactory.create(command.orderId(), command.customerId(), command.totalCents());
        } catch (BusinessException e) {
            log.warn("Order validation failed: code={}, message={}", e.getCode(), e.getMessage());
            return CreateOrderResult.validationFailed(e.getErrorCode(), e.getMessage());
        }

        // 2. 이벤트 생성
        OrderCreatedEvent event;
        try {
            event = eventBuilder.build(order, command.correlationId());
        } catch (RuntimeException e) {
            BusinessException classified = errorClassifier.toBusinessException(e, ErrorCode.INTERNAL_SERVER_ERROR);
            log.error("Failed to build event: orderId={}, code={}", order.getOrderId(), classified.getCode(), e);
            return CreateOrderResult.eventBuildFailed(order, classified.getErrorCode(), classified.getMessage());
        }

        // 3. 원장 기록
        AppendOutcome appendOutcome;
        try {
            appendOutcome = eventLedger.append(event);
        } catch (RuntimeException e) {
            BusinessException classified = errorClassifier.toBusinessException(e, ErrorCode.EVENT_STORE_UNAVAILABLE);
            if (classified.getKind() == FailureKind.VALIDATION) {
                log.warn("Event rejected by store constraints: orderId={}, message={}",
                    order.getOrderId(), classified.getMessage());
                return CreateOrderResult.validationFailed(classified.getErrorCode(), classified.getMessage());
            }
            log.error("Event store unavailable: orderId={}, code={}", order.getOrderId(), classified.getCode());
            return CreateOrderResult.storeUnavailable(order, classified.getErrorCode(), classified.getMessage());
        }

        if (appendOutcome == AppendOutcome.CONFLICT) {
            log.info("Order already exists: orderId={}, idempotencyKey={}", order.getOrderId(), event.getIdempotencyKey());
            return CreateOrderResult.alreadyExists(order);
        }

        // 4. 발행
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            BusinessException classified = errorClassifier.toBusinessException(e, ErrorCode.EVENT_PUBLISH_FAILED);
            log.error("Event stored but not published: eventId={}, orderId={}", event.getEventId(), order.getOrderId());
            publicationFailureRecorder.record(event, classified.getMessage());
            return CreateOrderResult.storedNotPublished(
                order, event.getEventId(), classified.getErrorCode(), classified.getMessage()
            );
        }

        log.info("Order created: orderId={}, eventId={}", order.getOrderId(), event.getEventId());
        return CreateOrderResult.created(order, event.getEventId());
    }
}
