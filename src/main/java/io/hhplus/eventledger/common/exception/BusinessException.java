package io.hhplus.eventledger.common.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 * <p>
 * 분류 정보는 ErrorCode에 담겨 있으므로, 잡는 쪽은 getErrorCode()/getKind()만 보면 된다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public FailureKind getKind() {
        return errorCode.getKind();
    }
}
