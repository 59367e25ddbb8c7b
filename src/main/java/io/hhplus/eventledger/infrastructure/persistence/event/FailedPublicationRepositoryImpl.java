package io.hhplus.eventledger.infrastructure.persistence.event;

import io.hhplus.eventledger.domain.event.FailedPublication;
import io.hhplus.eventledger.domain.event.FailedPublication.Status;
import io.hhplus.eventledger.domain.event.FailedPublicationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class FailedPublicationRepositoryImpl implements FailedPublicationRepository {

    private final FailedPublicationJpaRepository jpaRepository;

    @Override
    public FailedPublication save(FailedPublication failedPublication) {
        return jpaRepository.save(failedPublication);
    }

    @Override
    public Optional<FailedPublication> findByEventId(String eventId) {
        return jpaRepository.findByEventId(eventId);
    }

    @Override
    public List<FailedPublication> findRetryable(LocalDateTime now, int limit) {
        return jpaRepository.findRetryable(Status.PENDING, now, PageRequest.of(0, limit));
    }

    @Override
    public long countByStatus(Status status) {
        return jpaRepository.countByStatus(status);
    }
}
