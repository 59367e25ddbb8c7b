package io.hhplus.eventledger.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * <p>
 * 각 코드는 실패 분류(FailureKind)와 HTTP 상태를 함께 가진다.
 * 경계에서는 예외 타입을 검사하지 않고 이 값만 보고 응답/재시도/폐기를 결정한다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 주문 검증 (O)
    // ====================================
    INVALID_ORDER_ID("O001", "주문 ID는 필수입니다", FailureKind.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_CUSTOMER_ID("O002", "고객 ID는 필수입니다", FailureKind.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_TOTAL_AMOUNT("O003", "주문 금액은 0보다 커야 합니다", FailureKind.VALIDATION, HttpStatus.BAD_REQUEST),
    ORDER_ALREADY_EXISTS("O004", "이미 생성된 주문입니다", FailureKind.CONFLICT, HttpStatus.CONFLICT),
    ORDER_NOT_FOUND("O005", "주문을 찾을 수 없습니다", FailureKind.VALIDATION, HttpStatus.NOT_FOUND),

    // ====================================
    // 이벤트 (E)
    // ====================================
    MALFORMED_EVENT("E001", "이벤트 페이로드를 해석할 수 없습니다", FailureKind.PARSE, HttpStatus.UNPROCESSABLE_ENTITY),
    UNSUPPORTED_EVENT_VERSION("E002", "지원하지 않는 이벤트 버전입니다", FailureKind.PARSE, HttpStatus.UNPROCESSABLE_ENTITY),
    EVENT_NOT_FOUND("E003", "이벤트를 찾을 수 없습니다", FailureKind.VALIDATION, HttpStatus.NOT_FOUND),

    // ====================================
    // 인프라 (I)
    // ====================================
    EVENT_STORE_UNAVAILABLE("I001", "이벤트 저장소를 사용할 수 없습니다", FailureKind.INFRASTRUCTURE, HttpStatus.SERVICE_UNAVAILABLE),
    EVENT_PUBLISH_FAILED("I002", "이벤트 발행에 실패했습니다", FailureKind.INFRASTRUCTURE, HttpStatus.SERVICE_UNAVAILABLE),
    PROCESSED_LEDGER_UNAVAILABLE("I003", "처리 이력 저장소를 사용할 수 없습니다", FailureKind.INFRASTRUCTURE, HttpStatus.SERVICE_UNAVAILABLE),
    READ_MODEL_UNAVAILABLE("I004", "조회 모델 저장소를 사용할 수 없습니다", FailureKind.INFRASTRUCTURE, HttpStatus.SERVICE_UNAVAILABLE),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다", FailureKind.INFRASTRUCTURE, HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다", FailureKind.VALIDATION, HttpStatus.BAD_REQUEST),
    STORE_CONSTRAINT_VIOLATION("COMMON003", "저장소 제약조건을 위반한 값입니다", FailureKind.VALIDATION, HttpStatus.BAD_REQUEST);

    private final String code;
    private final String message;
    private final FailureKind kind;
    private final HttpStatus httpStatus;

    public boolean isRetriable() {
        return kind.isRetriable();
    }
}
