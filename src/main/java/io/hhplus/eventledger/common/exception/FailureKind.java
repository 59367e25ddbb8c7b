package io.hhplus.eventledger.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 실패 분류
 * <p>
 * 모든 실패는 발생 지점에서 정확히 한 번 분류되고, 이 값이 경계(HTTP, Kafka)까지 데이터로 전달된다.
 * <ul>
 *   <li>VALIDATION: 입력값 오류. 즉시 호출자에게 반환, 재시도하지 않음</li>
 *   <li>CONFLICT: 멱등성 충돌. 이미 생성된 주문이므로 성공으로 취급</li>
 *   <li>PARSE: 이벤트 페이로드 파싱 실패. 재시도해도 고쳐지지 않으므로 폐기</li>
 *   <li>INFRASTRUCTURE: 저장소/브로커 장애. 항상 재시도</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum FailureKind {

    VALIDATION(false),
    CONFLICT(false),
    PARSE(false),
    INFRASTRUCTURE(true);

    private final boolean retriable;
}
