package io.hhplus.eventledger.infrastructure.metrics;

import io.hhplus.eventledger.common.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 주요 메트릭을 수집하는 컴포넌트
 * <p>
 * 수집 메트릭:
 * - create_order_total{outcome, error_code}: 주문 생성 명령 결과별 카운터
 * - create_order_duration_seconds: 명령 처리 시간 (P50, P95, P99)
 * - projection_apply_total{outcome, error_code}: 프로젝션 적용 결과별 카운터
 * - projection_apply_duration_seconds: 프로젝션 처리 시간 (P50, P95, P99)
 * - publication_retry_total{result}: 재발행 시도 결과별 카운터
 * - failed_publications_pending: 재발행 대기 건수
 * <p>
 * error_code 태그는 ErrorCode 값(없으면 none)이라 카디널리티가 고정돼 있다.
 * 메트릭 기록 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
public class MetricsCollector {

    static final String NO_ERROR = "none";

    private final MeterRegistry meterRegistry;

    private final Timer commandDurationTimer;
    private final Timer projectionDurationTimer;
    private final AtomicLong pendingPublications = new AtomicLong();

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.commandDurationTimer = Timer.builder("create_order_duration_seconds")
                .description("Create-order command handling duration")
                .publishPercentiles(0.5, 0.95, 0.99)  // P50, P95, P99
                .register(meterRegistry);

        this.projectionDurationTimer = Timer.builder("projection_apply_duration_seconds")
                .description("Projection apply duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        Gauge.builder("failed_publications_pending", pendingPublications, AtomicLong::get)
                .description("Publications waiting for re-drive")
                .register(meterRegistry);
    }

    // ============================================================
    // 주문 생성 명령
    // ============================================================

    public void recordCommand(String outcome, ErrorCode errorCode, long startTimeMs) {
        record("create_order_total", outcome, errorCode, "Create-order command outcomes",
                commandDurationTimer, startTimeMs);
    }

    // ============================================================
    // 프로젝션
    // ============================================================

    public void recordProjection(String outcome, ErrorCode errorCode, long startTimeMs) {
        record("projection_apply_total", outcome, errorCode, "Projection apply outcomes",
                projectionDurationTimer, startTimeMs);
    }

    // ============================================================
    // 재발행
    // ============================================================

    public void recordPublicationRetry(String result) {
        try {
            Counter.builder("publication_retry_total")
                    .tag("result", result)
                    .description("Publication re-drive results")
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            log.warn("Failed to record metric: name=publication_retry_total, error={}", e.getMessage());
        }
    }

    public void updatePendingPublications(long count) {
        pendingPublications.set(count);
    }

    private void record(String counterName, String outcome, ErrorCode errorCode, String description,
                        Timer timer, long startTimeMs) {
        try {
            Counter.builder(counterName)
                    .tag("outcome", outcome)
                    .tag("error_code", errorCode != null ? errorCode.getCode() : NO_ERROR)
                    .description(description)
                    .register(meterRegistry)
                    .increment();

            long duration = System.currentTimeMillis() - startTimeMs;
            timer.record(duration, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("Failed to record metric: name={}, error={}", counterName, e.getMessage());
        }
    }
}
