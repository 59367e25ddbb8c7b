package io.hhplus.eventledger.application.usecase.event;

import io.hhplus.eventledger.domain.event.FailedPublication;
import io.hhplus.eventledger.domain.event.FailedPublicationRepository;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 발행 실패 이벤트를 재발행 대기열(failed_publications)에 올린다.
 * <p>
 * 대기열 저장까지 실패하면 로그만 남긴다.
 * 호출자는 eventId를 받았으므로 수동 재발행(POST /api/events/{eventId}/publish)이 가능하다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublicationFailureRecorder {

    private final FailedPublicationRepository failedPublicationRepository;
    private final Clock clock;

    public void record(OrderCreatedEvent event, String errorMessage) {
        try {
            if (failedPublicationRepository.findByEventId(event.getEventId()).isPresent()) {
                return;
            }
            failedPublicationRepository.save(FailedPublication.create(
                event.getEventId(),
                event.getOrderId(),
                errorMessage,
                LocalDateTime.now(clock)
            ));
            log.info("Publication re-drive scheduled: eventId={}", event.getEventId());
        } catch (RuntimeException e) {
            log.error("Failed to schedule publication re-drive: eventId={}, error={}",
                event.getEventId(), e.getMessage(), e);
        }
    }
}
