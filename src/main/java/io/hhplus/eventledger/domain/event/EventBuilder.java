package io.hhplus.eventledger.domain.event;

import io.hhplus.eventledger.domain.order.Order;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 주문 → OrderCreatedEvent 변환
 * <p>
 * - eventId: UUID, build 한 번에 한 번 발급
 * - idempotencyKey: OrderCreated:{orderId}
 * - payload: EventEnvelopeCodec으로 직렬화한 envelope
 */
@Component
@RequiredArgsConstructor
public class EventBuilder {

    private final EventEnvelopeCodec codec;

    public OrderCreatedEvent build(Order order, String correlationId) {
        String eventId = UUID.randomUUID().toString();

        OrderCreatedEnvelope envelope = new OrderCreatedEnvelope(
            eventId,
            correlationId,
            order.getOrderId(),
            order.getCustomerId(),
            order.getTotalCents(),
            codec.formatCreatedAt(order.getCreatedAt()),
            EventEnvelopeCodec.SUPPORTED_VERSION
        );

        return new OrderCreatedEvent(
            eventId,
            correlationId,
            OrderCreatedEvent.EVENT_TYPE,
            OrderCreatedEvent.SOURCE,
            EventEnvelopeCodec.SUPPORTED_VERSION,
            order.getOrderId(),
            order.getCustomerId(),
            order.getTotalCents(),
            order.getCreatedAt(),
            IdempotencyKey.forOrderCreation(order.getOrderId()),
            codec.encode(envelope)
        );
    }

    /**
     * 원장에 저장된 레코드로부터 이벤트를 되살린다. (재발행용)
     * eventId와 payload는 저장된 값을 그대로 쓴다.
     */
    public OrderCreatedEvent restore(EventRecord record) {
        OrderCreatedEnvelope envelope = codec.decode(record.getData());

        return new OrderCreatedEvent(
            record.getEventId(),
            record.getCorrelationId(),
            record.getEventType(),
            record.getSource(),
            record.getVersion(),
            record.getOrderId(),
            envelope.customerId(),
            envelope.totalCents() == null ? 0L : envelope.totalCents(),
            record.getCreatedAt(),
            record.getIdempotencyKey(),
            record.getData()
        );
    }
}
