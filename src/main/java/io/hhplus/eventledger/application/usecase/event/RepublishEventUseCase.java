package io.hhplus.eventledger.application.usecase.event;

import io.hhplus.eventledger.application.usecase.UseCase;
import io.hhplus.eventledger.application.usecase.order.EventPublisher;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.event.EventBuilder;
import io.hhplus.eventledger.domain.event.EventLedger;
import io.hhplus.eventledger.domain.event.EventRecord;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 원장에 기록된 이벤트 재발행
 * <p>
 * STORED_NOT_PUBLISHED 이후 발행만 다시 한다. 원장에는 쓰지 않는다.
 * 저장된 envelope를 그대로 싣기 때문에 eventId가 바뀌지 않고,
 * 중복 발행이 되더라도 프로젝션 쪽 처리 완료 원장이 걸러낸다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class RepublishEventUseCase {

    private final EventLedger eventLedger;
    private final EventBuilder eventBuilder;
    private final EventPublisher eventPublisher;
    private final ErrorClassifier errorClassifier;

    public RepublishResult execute(String eventId) {
        Optional<EventRecord> record;
        try {
            record = eventLedger.findByEventId(eventId);
        } catch (RuntimeException e) {
            BusinessException classified = errorClassifier.toBusinessException(e, ErrorCode.EVENT_STORE_UNAVAILABLE);
            log.error("Event store unavailable during republish: eventId={}", eventId);
            return RepublishResult.failed(
                RepublishOutcome.STORE_UNAVAILABLE, eventId, classified.getErrorCode(), classified.getMessage()
            );
        }

        if (record.isEmpty()) {
            log.warn("Republish requested for unknown event: eventId={}", eventId);
            return RepublishResult.notFound(eventId);
        }

        try {
            OrderCreatedEvent event = eventBuilder.restore(record.get());
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            BusinessException classified = errorClassifier.toBusinessException(e, ErrorCode.EVENT_PUBLISH_FAILED);
            log.error("Republish failed: eventId={}, code={}", eventId, classified.getCode());
            return RepublishResult.failed(
                RepublishOutcome.PUBLISH_FAILED, eventId, classified.getErrorCode(), classified.getMessage()
            );
        }

        log.info("Event republished: eventId={}", eventId);
        return RepublishResult.published(eventId);
    }
}
