package io.hhplus.eventledger.infrastructure.batch;

import io.hhplus.eventledger.application.usecase.event.RepublishEventUseCase;
import io.hhplus.eventledger.application.usecase.event.RepublishOutcome;
import io.hhplus.eventledger.application.usecase.event.RepublishResult;
import io.hhplus.eventledger.config.OrderLedgerProperties;
import io.hhplus.eventledger.domain.event.FailedPublication;
import io.hhplus.eventledger.domain.event.FailedPublicationRepository;
import io.hhplus.eventledger.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 발행 실패 이벤트 재발행 스케줄러
 * <p>
 * nextRetryAt이 지난 PENDING 건을 batch-size만큼 가져와 다시 발행한다.
 * 한 건의 실패가 나머지 처리를 막지 않는다.
 * 결과는 발행 후 한 번만 저장한다. 저장에 실패하면 행은 PENDING 그대로 남는다.
 * 매 주기 끝에 PENDING 건수를 failed_publications_pending 게이지로 내보낸다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublicationRetryScheduler {

    private final FailedPublicationRepository failedPublicationRepository;
    private final RepublishEventUseCase republishEventUseCase;
    private final OrderLedgerProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    @Scheduled(fixedRateString = "${order-ledger.publish-retry.rate:60000}")
    public void retryFailedPublications() {
        LocalDateTime now = LocalDateTime.now(clock);
        int batchSize = properties.getPublishRetry().getBatchSize();

        List<FailedPublication> due;
        try {
            due = failedPublicationRepository.findRetryable(now, batchSize);
        } catch (RuntimeException e) {
            log.error("Failed to load pending publications", e);
            return;
        }

        if (!due.isEmpty()) {
            log.info("Re-driving {} pending publications", due.size());
        }
        for (FailedPublication publication : due) {
            try {
                retry(publication, now);
            } catch (RuntimeException e) {
                log.error("Error during publication re-drive: eventId={}", publication.getEventId(), e);
            }
        }

        refreshPendingGauge();
    }

    private void refreshPendingGauge() {
        try {
            metricsCollector.updatePendingPublications(
                failedPublicationRepository.countByStatus(FailedPublication.Status.PENDING)
            );
        } catch (RuntimeException e) {
            log.warn("Failed to count pending publications: error={}", e.getMessage());
        }
    }

    private void retry(FailedPublication publication, LocalDateTime now) {
        int maxAttempts = properties.getPublishRetry().getMaxAttempts();
        if (!publication.canRetry(maxAttempts, now)) {
            return;
        }

        publication.startRetry(now);

        RepublishResult result = republishEventUseCase.execute(publication.getEventId());

        if (result.isPublished()) {
            publication.markSuccess(now);
            metricsCollector.recordPublicationRetry("success");
            log.info("Publication re-drive succeeded: eventId={}, attempt={}",
                publication.getEventId(), publication.getAttemptCount());
        } else if (result.outcome() == RepublishOutcome.NOT_FOUND) {
            publication.abandon(result.message(), now);
            metricsCollector.recordPublicationRetry("abandoned");
            log.warn("Publication re-drive abandoned, event missing: eventId={}", publication.getEventId());
        } else {
            publication.markRetryFailed(result.message(), maxAttempts, now);
            boolean exhausted = publication.getStatus() == FailedPublication.Status.FAILED;
            metricsCollector.recordPublicationRetry(exhausted ? "exhausted" : "failure");
            log.warn("Publication re-drive failed: eventId={}, attempt={}, nextRetryAt={}",
                publication.getEventId(), publication.getAttemptCount(), publication.getNextRetryAt());
        }

        failedPublicationRepository.save(publication);
    }
}
