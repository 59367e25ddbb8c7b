package io.hhplus.eventledger.common.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.format.DateTimeParseException;

/**
 * 실패 분류기
 * <p>
 * 어댑터(JPA, Redis, Kafka)가 라이브러리 예외를 잡은 직후 호출해서
 * 분류된 BusinessException으로 바꾼다. 이후 계층은 ErrorCode만 본다.
 * <p>
 * 분류 규칙:
 * - BusinessException: 이미 분류됨
 * - 중복 키 위반 (DuplicateKeyException, MySQL 1062, SQLState 23505): CONFLICT (조건부 insert 실패)
 * - 그 외 DataIntegrityViolationException (길이 초과, NOT NULL 등): VALIDATION
 * - JsonProcessingException, DateTimeParseException: PARSE
 * - 그 외 (DataAccessException, KafkaException, TimeoutException 등): INFRASTRUCTURE
 */
@Component
public class ErrorClassifier {

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final String SQL_STATE_UNIQUE_VIOLATION = "23505";

    public FailureKind classify(Throwable throwable) {
        if (throwable instanceof BusinessException businessException) {
            return businessException.getKind();
        }
        if (throwable instanceof DataIntegrityViolationException) {
            return isDuplicateKey(throwable) ? FailureKind.CONFLICT : FailureKind.VALIDATION;
        }
        if (throwable instanceof JsonProcessingException || throwable instanceof DateTimeParseException) {
            return FailureKind.PARSE;
        }
        return FailureKind.INFRASTRUCTURE;
    }

    public boolean isConflict(Throwable throwable) {
        return classify(throwable) == FailureKind.CONFLICT;
    }

    /**
     * 발생 지점에서 한 번만 감싼다.
     * PARSE는 MALFORMED_EVENT로, 제약조건 위반은 STORE_CONSTRAINT_VIOLATION으로,
     * 나머지는 호출 지점이 지정한 코드로 분류한다.
     * 충돌을 성공으로 취급해야 하는 곳(이벤트 원장)은 isConflict()로 먼저 걸러낸다.
     *
     * @param throwable 원인 예외
     * @param fallback 저장소별 인프라 에러 코드
     */
    public BusinessException toBusinessException(Throwable throwable, ErrorCode fallback) {
        if (throwable instanceof BusinessException businessException) {
            return businessException;
        }
        FailureKind kind = classify(throwable);
        if (kind == FailureKind.PARSE) {
            return new BusinessException(ErrorCode.MALFORMED_EVENT, throwable.getMessage(), throwable);
        }
        if (kind == FailureKind.VALIDATION) {
            return new BusinessException(
                ErrorCode.STORE_CONSTRAINT_VIOLATION,
                ErrorCode.STORE_CONSTRAINT_VIOLATION.getMessage() + ": " + rootMessage(throwable),
                throwable
            );
        }
        return new BusinessException(fallback, fallback.getMessage() + ": " + throwable.getMessage(), throwable);
    }

    public Disposition dispositionOf(FailureKind kind) {
        return switch (kind) {
            case VALIDATION, CONFLICT -> Disposition.RESPOND;
            case PARSE -> Disposition.DROP;
            case INFRASTRUCTURE -> Disposition.RETRY;
        };
    }

    private boolean isDuplicateKey(Throwable throwable) {
        if (throwable instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException) {
                return sqlException.getErrorCode() == MYSQL_DUPLICATE_ENTRY
                    || SQL_STATE_UNIQUE_VIOLATION.equals(sqlException.getSQLState());
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
