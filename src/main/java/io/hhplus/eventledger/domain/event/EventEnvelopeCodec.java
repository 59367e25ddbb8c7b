package io.hhplus.eventledger.domain.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * OrderCreated envelope JSON 코덱
 * <p>
 * 쓰기 측(EventBuilder)과 읽기 측(ApplyOrderCreatedUseCase)이 같은 형식을 쓰도록
 * 직렬화/역직렬화와 created_at 포맷을 한 곳에 둔다.
 */
@Component
public class EventEnvelopeCodec {

    public static final String SUPPORTED_VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public EventEnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(OrderCreatedEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "envelope 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON 문법 오류, 객체가 아닌 본문, event_id 누락은 모두 MALFORMED_EVENT.
     * 필드 값(created_at, version 등)의 검증은 호출자 몫이다.
     */
    public OrderCreatedEnvelope decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BusinessException(ErrorCode.MALFORMED_EVENT, "빈 메시지 본문입니다");
        }

        OrderCreatedEnvelope envelope;
        try {
            envelope = objectMapper.readValue(raw, OrderCreatedEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.MALFORMED_EVENT, "envelope 파싱 실패: " + e.getOriginalMessage(), e);
        }

        if (envelope == null || envelope.eventId() == null || envelope.eventId().isBlank()) {
            throw new BusinessException(ErrorCode.MALFORMED_EVENT, "event_id가 없는 메시지입니다");
        }
        return envelope;
    }

    public String formatCreatedAt(Instant createdAt) {
        return DateTimeFormatter.ISO_INSTANT.format(createdAt);
    }

    /**
     * RFC3339 (오프셋 포함) 문자열을 UTC Instant로 변환한다.
     */
    public Instant parseCreatedAt(String createdAt) {
        if (createdAt == null || createdAt.isBlank()) {
            throw new BusinessException(ErrorCode.MALFORMED_EVENT, "created_at이 없습니다");
        }
        try {
            return OffsetDateTime.parse(createdAt).toInstant();
        } catch (DateTimeParseException e) {
            throw new BusinessException(ErrorCode.MALFORMED_EVENT, "created_at 형식 오류: " + createdAt, e);
        }
    }

    public void requireSupportedVersion(String version) {
        if (version != null && !SUPPORTED_VERSION.equals(version)) {
            throw new BusinessException(
                ErrorCode.UNSUPPORTED_EVENT_VERSION,
                String.format("지원하지 않는 이벤트 버전입니다. version: %s", version)
            );
        }
    }
}
