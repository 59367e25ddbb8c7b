package io.hhplus.eventledger.application.usecase.projection;

import io.hhplus.eventledger.application.usecase.UseCase;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.Disposition;
import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.event.EventEnvelopeCodec;
import io.hhplus.eventledger.domain.event.OrderCreatedEnvelope;
import io.hhplus.eventledger.domain.event.ProcessedEventLedger;
import io.hhplus.eventledger.domain.order.Order;
import io.hhplus.eventledger.domain.order.OrderReadModelRepository;
import io.hhplus.eventledger.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * OrderCreated 이벤트 → 주문 읽기 모델 프로젝션
 * <p>
 * 처리 순서:
 * 1. envelope 해석 (실패 시 DROPPED)
 * 2. 처리 완료 여부 확인 (이미 처리됨 → ALREADY_APPLIED)
 * 3. 필드 해석 및 주문 검증 (실패 시 DROPPED)
 * 4. 읽기 모델 upsert
 * 5. 처리 완료 기록
 * <p>
 * upsert가 기록보다 먼저다. 4와 5 사이에서 죽으면 재전달 시 다시 upsert하고 기록한다.
 * 해석/검증 실패는 처리 완료로 기록하지 않는다.
 * 저장소가 값 자체를 거부한 경우(제약조건 위반)도 재시도로 고쳐지지 않으므로 DROPPED.
 * 저장소 장애(2, 4, 5)는 RETRY로 돌려서 재전달을 받는다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class ApplyOrderCreatedUseCase {

    private final EventEnvelopeCodec codec;
    private final ProcessedEventLedger processedEventLedger;
    private final OrderReadModelRepository orderReadModelRepository;
    private final ErrorClassifier errorClassifier;
    private final MetricsCollector metricsCollector;

    public ProjectionResult apply(String rawEnvelope) {
        long startTime = System.currentTimeMillis();
        ProjectionResult result = doApply(rawEnvelope);
        metricsCollector.recordProjection(result.outcome().name(), result.errorCode(), startTime);
        return result;
    }

    private ProjectionResult doApply(String rawEnvelope) {
        OrderCreatedEnvelope envelope;
        try {
            envelope = codec.decode(rawEnvelope);
        } catch (BusinessException e) {
            log.warn("Dropping undecodable event: error={}", e.getMessage());
            return ProjectionResult.dropped(null, e.getErrorCode());
        }

        String eventId = envelope.eventId();

        try {
            if (processedEventLedger.isProcessed(eventId)) {
                log.info("Event already applied, skipping: eventId={}", eventId);
                return ProjectionResult.alreadyApplied(eventId);
            }

            Order order = toOrder(envelope);
            orderReadModelRepository.upsert(order);
            processedEventLedger.markProcessed(eventId);

            log.info("Event applied: eventId={}, orderId={}", eventId, order.getOrderId());
            return ProjectionResult.applied(eventId);
        } catch (BusinessException e) {
            return onFailure(eventId, e);
        } catch (RuntimeException e) {
            return onFailure(eventId, errorClassifier.toBusinessException(e, ErrorCode.INTERNAL_SERVER_ERROR));
        }
    }

    private Order toOrder(OrderCreatedEnvelope envelope) {
        codec.requireSupportedVersion(envelope.version());
        Instant createdAt = codec.parseCreatedAt(envelope.createdAt());
        long totalCents = envelope.totalCents() == null ? 0L : envelope.totalCents();

        return Order.create(envelope.orderId(), envelope.customerId(), totalCents, createdAt);
    }

    private ProjectionResult onFailure(String eventId, BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        Disposition disposition = errorClassifier.dispositionOf(e.getKind());

        if (disposition == Disposition.RETRY) {
            log.error("Projection failed, awaiting redelivery: eventId={}, code={}, error={}",
                eventId, errorCode.getCode(), e.getMessage(), e);
            return ProjectionResult.retry(eventId, errorCode);
        }

        log.warn("Dropping event: eventId={}, code={}, error={}", eventId, errorCode.getCode(), e.getMessage());
        return ProjectionResult.dropped(eventId, errorCode);
    }
}
