package io.hhplus.eventledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * order-ledger.* 설정
 * <p>
 * 기동 시 한 번 바인딩되고 이후에는 읽기만 한다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "order-ledger")
public class OrderLedgerProperties {

    private Kafka kafka = new Kafka();
    private ProcessedEvents processedEvents = new ProcessedEvents();
    private PublishRetry publishRetry = new PublishRetry();

    @Getter
    @Setter
    public static class Kafka {
        /**
         * OrderCreated 이벤트 토픽
         */
        private String topic = "order-events";

        /**
         * 프로젝션 컨슈머 그룹
         */
        private String projectionGroup = "order-projection";

        /**
         * 발행 결과를 기다리는 최대 시간
         */
        private Duration publishTimeout = Duration.ofSeconds(5);

        /**
         * 재전달(nack) 전 대기 시간
         */
        private Duration redeliveryBackoff = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class ProcessedEvents {
        /**
         * 처리 완료 기록 보존 기간. 최대 재전달 기간보다 길어야 한다.
         */
        private Duration retention = Duration.ofDays(90);
    }

    @Getter
    @Setter
    public static class PublishRetry {
        private int maxAttempts = 5;
        private int batchSize = 50;
    }
}
