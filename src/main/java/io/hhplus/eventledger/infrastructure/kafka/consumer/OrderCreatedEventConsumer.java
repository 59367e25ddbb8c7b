package io.hhplus.eventledger.infrastructure.kafka.consumer;

import io.hhplus.eventledger.application.usecase.projection.ApplyOrderCreatedUseCase;
import io.hhplus.eventledger.application.usecase.projection.ProjectionResult;
import io.hhplus.eventledger.config.OrderLedgerProperties;
import io.hhplus.eventledger.infrastructure.kafka.producer.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * OrderCreated 이벤트 컨슈머 (프로젝션)
 * <p>
 * Manual ACK:
 * - ACK: 적용/중복/폐기 → acknowledge()
 * - REDELIVER: 인프라 장애 → nack(backoff), 같은 레코드를 다시 받는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderCreatedEventConsumer {

    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_EVENT_ID = "eventId";

    private final ApplyOrderCreatedUseCase applyOrderCreatedUseCase;
    private final OrderLedgerProperties properties;

    @KafkaListener(
        topics = "${order-ledger.kafka.topic:order-events}",
        groupId = "${order-ledger.kafka.projection-group:order-projection}"
    )
    public void consume(
        @Payload String payload,
        Acknowledgment ack,
        @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
        @Header(KafkaHeaders.OFFSET) long offset,
        @Header(name = OrderEventProducer.HEADER_EVENT_ID, required = false) String eventId,
        @Header(name = OrderEventProducer.HEADER_CORRELATION_ID, required = false) String correlationId
    ) {
        putMdc(MDC_EVENT_ID, eventId);
        putMdc(MDC_CORRELATION_ID, correlationId);
        try {
            log.info("Kafka message received: eventId={}, partition={}, offset={}", eventId, partition, offset);

            ProjectionResult result = applyOrderCreatedUseCase.apply(payload);

            if (result.delivery() == ProjectionResult.Delivery.REDELIVER) {
                log.warn("Requesting redelivery: eventId={}, code={}, partition={}, offset={}",
                    result.eventId(),
                    result.errorCode() != null ? result.errorCode().getCode() : null,
                    partition,
                    offset
                );
                ack.nack(properties.getKafka().getRedeliveryBackoff());
                return;
            }

            log.info("Kafka message processed: eventId={}, outcome={}, partition={}, offset={}",
                result.eventId(), result.outcome(), partition, offset);
            ack.acknowledge();
        } finally {
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
