package io.hhplus.eventledger.domain.event;

/**
 * 원장 추가 결과
 * <p>
 * CONFLICT는 실패가 아니라 "이미 기록됨"이다.
 */
public enum AppendOutcome {
    APPENDED,
    CONFLICT
}
