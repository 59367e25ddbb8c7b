package io.hhplus.eventledger.domain.event;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 발행 실패 이벤트 저장소
 */
public interface FailedPublicationRepository {

    FailedPublication save(FailedPublication failedPublication);

    Optional<FailedPublication> findByEventId(String eventId);

    /**
     * 재발행 대상 조회
     * <p>
     * 조건: status = PENDING, nextRetryAt <= now (nextRetryAt 오름차순)
     */
    List<FailedPublication> findRetryable(LocalDateTime now, int limit);

    long countByStatus(FailedPublication.Status status);
}
