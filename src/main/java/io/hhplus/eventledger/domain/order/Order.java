package io.hhplus.eventledger.domain.order;

import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 주문 값 객체
 * <p>
 * 직접 저장되지 않는다. 쓰기 측에서는 OrderCreatedEvent 안에,
 * 읽기 측에서는 orders_read 행으로만 남는다.
 * 검증을 통과하지 못한 Order는 만들어지지 않는다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Order {

    /**
     * order_id, customer_id 컬럼 길이 (event_store, orders_read)
     */
    public static final int MAX_ID_LENGTH = 128;

    private final String orderId;
    private final String customerId;
    private final long totalCents;
    private final Instant createdAt;

    private Order(String orderId, String customerId, long totalCents, Instant createdAt) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.totalCents = totalCents;
        this.createdAt = createdAt;
    }

    /**
     * 검증 순서: 주문 ID → 고객 ID → 금액. 첫 번째 실패에서 중단한다.
     * ID는 비어 있지 않고 MAX_ID_LENGTH 이하여야 한다.
     */
    public static Order create(String orderId, String customerId, long totalCents, Instant createdAt) {
        validateOrderId(orderId);
        validateCustomerId(customerId);
        validateTotalCents(totalCents);

        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 생성 시각은 필수입니다");
        }

        return new Order(orderId, customerId, totalCents, createdAt);
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_ID);
        }
        if (orderId.length() > MAX_ID_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_ID,
                String.format("주문 ID는 %d자를 넘을 수 없습니다. length: %d", MAX_ID_LENGTH, orderId.length())
            );
        }
    }

    private static void validateCustomerId(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_CUSTOMER_ID);
        }
        if (customerId.length() > MAX_ID_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_CUSTOMER_ID,
                String.format("고객 ID는 %d자를 넘을 수 없습니다. length: %d", MAX_ID_LENGTH, customerId.length())
            );
        }
    }

    private static void validateTotalCents(long totalCents) {
        if (totalCents <= 0) {
            throw new BusinessException(
                ErrorCode.INVALID_TOTAL_AMOUNT,
                String.format("주문 금액은 0보다 커야 합니다. totalCents: %d", totalCents)
            );
        }
    }
}
