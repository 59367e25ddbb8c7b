package io.hhplus.eventledger.domain.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 버스에 실리는 OrderCreated 메시지 본문
 * <p>
 * 형식: {event_id, correlation_id, order_id, customer_id, total_cents, created_at, version}
 * - created_at: RFC3339 (UTC, 초 단위)
 * - version: 없으면 1.0으로 간주
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderCreatedEnvelope(
    String eventId,
    String correlationId,
    String orderId,
    String customerId,
    Long totalCents,
    String createdAt,
    String version
) {
}
