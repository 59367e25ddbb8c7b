package io.hhplus.eventledger.common.exception;

/**
 * 경계에서 실패를 어떻게 다룰지에 대한 결정
 * <p>
 * RESPOND: 동기 호출자에게 상태 코드로 돌려준다 (검증 실패, 멱등성 충돌)
 * DROP: 확인 응답 후 폐기한다 (파싱 실패)
 * RETRY: 확인 응답하지 않고 재전달을 기대한다 (인프라 장애)
 */
public enum Disposition {
    RESPOND,
    DROP,
    RETRY
}
