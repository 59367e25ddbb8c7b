package io.hhplus.eventledger.application.usecase.order;

/**
 * 주문 생성 명령 결과
 * <p>
 * - CREATED: 원장 기록 + 발행 완료
 * - ALREADY_EXISTS: 같은 주문이 이미 기록됨 (멱등 성공, 재시도 불필요)
 * - VALIDATION_FAILED: 입력 오류
 * - STORE_UNAVAILABLE: 원장 장애, 명령 전체 재시도 가능
 * - STORED_NOT_PUBLISHED: 기록은 됐고 발행만 실패, 발행만 다시 해야 한다
 * - EVENT_BUILD_FAILED: envelope 직렬화 실패, 아무것도 기록되지 않음
 */
public enum CreateOrderOutcome {
    CREATED(false),
    ALREADY_EXISTS(false),
    VALIDATION_FAILED(false),
    STORE_UNAVAILABLE(true),
    STORED_NOT_PUBLISHED(true),
    EVENT_BUILD_FAILED(false);

    private final boolean retriable;

    CreateOrderOutcome(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
