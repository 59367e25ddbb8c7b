package io.hhplus.eventledger.domain.event;

import java.time.Instant;

/**
 * 처리 완료된 이벤트 기록
 *
 * @param expiresAt 보존 기간 만료 시각. 만료 후에는 저장소가 기록을 지운다.
 */
public record ProcessedEventRecord(
    String eventId,
    Instant processedAt,
    Instant expiresAt
) {
}
