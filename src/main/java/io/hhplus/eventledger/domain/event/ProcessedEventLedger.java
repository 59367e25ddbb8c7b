package io.hhplus.eventledger.domain.event;

import java.util.Optional;

/**
 * 처리 완료 이벤트 원장 (읽기 측 멱등성)
 * <p>
 * 사용 순서:
 * 1. 적용 전에 isProcessed() 체크
 * 2. 읽기 모델 반영 후 markProcessed() 호출
 * <p>
 * 모든 메서드는 저장소 장애 시 PROCESSED_LEDGER_UNAVAILABLE을 던진다.
 */
public interface ProcessedEventLedger {

    boolean isProcessed(String eventId);

    /**
     * 존재하지 않을 때만 기록한다. 이미 있으면 ALREADY_MARKED (no-op).
     */
    MarkOutcome markProcessed(String eventId);

    Optional<ProcessedEventRecord> find(String eventId);
}
