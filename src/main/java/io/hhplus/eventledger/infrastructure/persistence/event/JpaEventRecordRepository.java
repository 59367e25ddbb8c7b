package io.hhplus.eventledger.infrastructure.persistence.event;

import io.hhplus.eventledger.domain.event.EventRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaEventRecordRepository extends JpaRepository<EventRecord, String> {

    List<EventRecord> findByOrderIdOrderByCreatedAtAsc(String orderId);
}
