package io.hhplus.eventledger.infrastructure.redis;

import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.config.OrderLedgerProperties;
import io.hhplus.eventledger.domain.event.MarkOutcome;
import io.hhplus.eventledger.domain.event.ProcessedEventLedger;
import io.hhplus.eventledger.domain.event.ProcessedEventRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis 기반 처리 완료 이벤트 원장
 * <p>
 * 키 형식: event:processed:{eventId}
 * 값: processed_at (RFC3339)
 * TTL: order-ledger.processed-events.retention (기본 90일)
 * <p>
 * 보존 기간이 지난 기록은 Redis 만료로 사라진다.
 * 그 뒤에 같은 이벤트가 재전달되면 다시 적용되지만, upsert라 결과는 같다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisProcessedEventLedger implements ProcessedEventLedger {

    private static final String KEY_PREFIX = "event:processed:";

    private final RedisTemplate<String, String> redisTemplate;
    private final OrderLedgerProperties properties;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    @Override
    public boolean isProcessed(String eventId) {
        try {
            boolean processed = Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(eventId)));
            if (processed) {
                log.debug("Processed event detected: eventId={}", eventId);
            }
            return processed;
        } catch (RuntimeException e) {
            log.error("Failed to read processed-event ledger: eventId={}, error={}", eventId, e.getMessage(), e);
            throw errorClassifier.toBusinessException(e, ErrorCode.PROCESSED_LEDGER_UNAVAILABLE);
        }
    }

    @Override
    public MarkOutcome markProcessed(String eventId) {
        Duration retention = properties.getProcessedEvents().getRetention();
        String processedAt = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));

        Boolean success;
        try {
            // SET NX EX
            success = redisTemplate.opsForValue().setIfAbsent(buildKey(eventId), processedAt, retention);
        } catch (RuntimeException e) {
            log.error("Failed to mark event processed: eventId={}, error={}", eventId, e.getMessage(), e);
            throw errorClassifier.toBusinessException(e, ErrorCode.PROCESSED_LEDGER_UNAVAILABLE);
        }

        if (Boolean.TRUE.equals(success)) {
            log.debug("Event marked processed: eventId={}, retention={}", eventId, retention);
            return MarkOutcome.MARKED;
        }
        log.info("Event already marked processed: eventId={}", eventId);
        return MarkOutcome.ALREADY_MARKED;
    }

    @Override
    public Optional<ProcessedEventRecord> find(String eventId) {
        String key = buildKey(eventId);
        try {
            String processedAt = redisTemplate.opsForValue().get(key);
            if (processedAt == null) {
                return Optional.empty();
            }

            Long ttlSeconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            Instant expiresAt = (ttlSeconds == null || ttlSeconds < 0)
                ? null
                : Instant.now(clock).plusSeconds(ttlSeconds);

            return Optional.of(new ProcessedEventRecord(eventId, Instant.parse(processedAt), expiresAt));
        } catch (RuntimeException e) {
            throw errorClassifier.toBusinessException(e, ErrorCode.PROCESSED_LEDGER_UNAVAILABLE);
        }
    }

    private String buildKey(String eventId) {
        return KEY_PREFIX + eventId;
    }
}
