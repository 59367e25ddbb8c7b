package io.hhplus.eventledger.infrastructure.kafka.producer;

import io.hhplus.eventledger.application.usecase.order.EventPublisher;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.config.OrderLedgerProperties;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * OrderCreated 이벤트 Kafka 발행
 * <p>
 * - key: orderId (같은 주문의 이벤트는 같은 파티션)
 * - value: envelope JSON
 * - headers: event_id, event_type, source, correlation_id
 * <p>
 * 호출자가 성공/실패를 확정할 수 있도록 publish-timeout까지 전송 결과를 기다린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer implements EventPublisher {

    public static final String HEADER_EVENT_ID = "event_id";
    public static final String HEADER_EVENT_TYPE = "event_type";
    public static final String HEADER_SOURCE = "source";
    public static final String HEADER_CORRELATION_ID = "correlation_id";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OrderLedgerProperties properties;

    @Override
    public void publish(OrderCreatedEvent event) {
        ProducerRecord<String, String> record = toRecord(event);
        long timeoutMs = properties.getKafka().getPublishTimeout().toMillis();

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(timeoutMs, TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            log.info("Kafka message published: eventId={}, orderId={}, topic={}, partition={}, offset={}",
                event.getEventId(),
                event.getOrderId(),
                metadata.topic(),
                metadata.partition(),
                metadata.offset()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw publishFailed(event, e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            throw publishFailed(event, e);
        }
    }

    private ProducerRecord<String, String> toRecord(OrderCreatedEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            properties.getKafka().getTopic(),
            event.getOrderId(),
            event.getPayload()
        );
        addHeader(record, HEADER_EVENT_ID, event.getEventId());
        addHeader(record, HEADER_EVENT_TYPE, event.getEventType());
        addHeader(record, HEADER_SOURCE, event.getSource());
        addHeader(record, HEADER_CORRELATION_ID, event.getCorrelationId());
        return record;
    }

    private void addHeader(ProducerRecord<String, String> record, String key, String value) {
        if (value != null) {
            record.headers().add(key, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    private BusinessException publishFailed(OrderCreatedEvent event, Exception cause) {
        Throwable root = cause instanceof ExecutionException && cause.getCause() != null ? cause.getCause() : cause;
        log.error("Failed to publish Kafka message: eventId={}, orderId={}, error={}",
            event.getEventId(),
            event.getOrderId(),
            root.getMessage(),
            root
        );
        return new BusinessException(
            ErrorCode.EVENT_PUBLISH_FAILED,
            ErrorCode.EVENT_PUBLISH_FAILED.getMessage() + ": " + root.getMessage(),
            root
        );
    }
}
