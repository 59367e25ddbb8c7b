package io.hhplus.eventledger.domain.event;

/**
 * 처리 완료 기록 결과. 둘 다 성공이다.
 */
public enum MarkOutcome {
    MARKED,
    ALREADY_MARKED
}
