package io.hhplus.eventledger.application.event.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hhplus.eventledger.domain.event.EventRecord;

import java.time.Instant;

/**
 * 원장 레코드 조회 응답 (감사용)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventRecordResponse(
    String eventId,
    String eventType,
    String source,
    String version,
    String orderId,
    String correlationId,
    String idempotencyKey,
    Instant createdAt,
    Instant recordedAt,
    String data
) {
    public static EventRecordResponse from(EventRecord record) {
        return new EventRecordResponse(
            record.getEventId(),
            record.getEventType(),
            record.getSource(),
            record.getVersion(),
            record.getOrderId(),
            record.getCorrelationId(),
            record.getIdempotencyKey(),
            record.getCreatedAt(),
            record.getRecordedAt(),
            record.getData()
        );
    }
}
