package io.hhplus.eventledger.domain.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 주문 생성 이벤트
 * <p>
 * 생성 시점: EventBuilder.build() 또는 원장 레코드 복원 (재발행)
 * eventId는 빌드 시 한 번만 발급되며 재시도에서도 바뀌지 않는다.
 * payload는 버스에 그대로 실리는 envelope JSON이다.
 */
@Getter
@ToString(exclude = "payload")
@AllArgsConstructor
public class OrderCreatedEvent {

    public static final String EVENT_TYPE = "OrderCreated";
    public static final String SOURCE = "app.orders";

    private final String eventId;
    private final String correlationId;
    private final String eventType;
    private final String source;
    private final String version;
    private final String orderId;
    private final String customerId;
    private final long totalCents;
    private final Instant createdAt;
    private final String idempotencyKey;
    private final String payload;
}
