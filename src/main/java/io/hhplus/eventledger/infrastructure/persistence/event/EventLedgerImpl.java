package io.hhplus.eventledger.infrastructure.persistence.event;

import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.event.AppendOutcome;
import io.hhplus.eventledger.domain.event.EventLedger;
import io.hhplus.eventledger.domain.event.EventRecord;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA 기반 이벤트 원장
 * <p>
 * append()는 바깥 트랜잭션 없이 saveAndFlush 한 번으로 끝난다.
 * 제약조건 위반이 리포지토리 트랜잭션 안에서 번역되어 올라오므로
 * 여기서 잡아도 다른 작업이 rollback-only로 오염되지 않는다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventLedgerImpl implements EventLedger {

    private final JpaEventRecordRepository jpaRepository;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    @Override
    public AppendOutcome append(OrderCreatedEvent event) {
        try {
            jpaRepository.saveAndFlush(EventRecord.from(event, Instant.now(clock)));
            log.info("Event appended: eventId={}, idempotencyKey={}", event.getEventId(), event.getIdempotencyKey());
            return AppendOutcome.APPENDED;
        } catch (RuntimeException e) {
            if (errorClassifier.isConflict(e)) {
                log.info("Event already recorded: eventId={}, idempotencyKey={}",
                    event.getEventId(), event.getIdempotencyKey());
                return AppendOutcome.CONFLICT;
            }
            log.error("Failed to append event: eventId={}, error={}", event.getEventId(), e.getMessage(), e);
            throw errorClassifier.toBusinessException(e, ErrorCode.EVENT_STORE_UNAVAILABLE);
        }
    }

    @Override
    public List<EventRecord> eventsForOrder(String orderId) {
        try {
            return jpaRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
        } catch (RuntimeException e) {
            throw errorClassifier.toBusinessException(e, ErrorCode.EVENT_STORE_UNAVAILABLE);
        }
    }

    @Override
    public Optional<EventRecord> findByEventId(String eventId) {
        try {
            return jpaRepository.findById(eventId);
        } catch (RuntimeException e) {
            throw errorClassifier.toBusinessException(e, ErrorCode.EVENT_STORE_UNAVAILABLE);
        }
    }
}
