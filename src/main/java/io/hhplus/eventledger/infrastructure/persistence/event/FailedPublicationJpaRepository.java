package io.hhplus.eventledger.infrastructure.persistence.event;

import io.hhplus.eventledger.domain.event.FailedPublication;
import io.hhplus.eventledger.domain.event.FailedPublication.Status;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface FailedPublicationJpaRepository extends JpaRepository<FailedPublication, Long> {

    Optional<FailedPublication> findByEventId(String eventId);

    @Query("SELECT f FROM FailedPublication f " +
           "WHERE f.status = :status " +
           "AND f.nextRetryAt <= :now " +
           "ORDER BY f.nextRetryAt ASC")
    List<FailedPublication> findRetryable(@Param("status") Status status,
                                          @Param("now") LocalDateTime now,
                                          Pageable pageable);

    long countByStatus(Status status);
}
