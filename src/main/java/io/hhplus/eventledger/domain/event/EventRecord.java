package io.hhplus.eventledger.domain.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * 이벤트 원장 레코드 (append-only)
 * <p>
 * 한 번 기록되면 수정/삭제되지 않는다.
 * isNew()가 항상 true라서 save()는 merge가 아닌 persist로 동작하고,
 * 같은 event_id 또는 idempotency_key가 이미 있으면 flush 시점에 제약조건 위반이 난다.
 */
@Entity
@Table(
    name = "event_store",
    uniqueConstraints = @UniqueConstraint(name = "uk_event_store_idempotency_key", columnNames = "idempotency_key"),
    indexes = @Index(name = "idx_event_store_order_id", columnList = "order_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventRecord implements Persistable<String> {

    @Id
    @Column(name = "event_id", length = 64)
    private String eventId;

    @Column(name = "idempotency_key", nullable = false, length = 255)
    private String idempotencyKey;

    @Column(name = "order_id", nullable = false, length = 128)
    private String orderId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(nullable = false, length = 100)
    private String source;

    @Column(nullable = false, length = 20)
    private String version;

    @Column(name = "correlation_id", length = 128)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /**
     * envelope JSON 원문
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String data;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    public static EventRecord from(OrderCreatedEvent event, Instant recordedAt) {
        EventRecord record = new EventRecord();
        record.eventId = event.getEventId();
        record.idempotencyKey = event.getIdempotencyKey();
        record.orderId = event.getOrderId();
        record.eventType = event.getEventType();
        record.source = event.getSource();
        record.version = event.getVersion();
        record.correlationId = event.getCorrelationId();
        record.createdAt = event.getCreatedAt();
        record.data = event.getPayload();
        record.recordedAt = recordedAt;
        return record;
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return true;
    }
}
