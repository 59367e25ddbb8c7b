package io.hhplus.eventledger.domain.event;

/**
 * 이벤트 원장의 조건부 insert 기준이 되는 멱등성 키
 * <p>
 * 이벤트 ID와는 별개다. 이벤트 ID는 발행마다 새로 발급되지만,
 * 같은 주문에 대한 생성 명령은 항상 같은 키를 가진다.
 */
public final class IdempotencyKey {

    private static final String ORDER_CREATION_PREFIX = "OrderCreated:";

    private IdempotencyKey() {
    }

    /**
     * 형식: OrderCreated:{orderId}
     */
    public static String forOrderCreation(String orderId) {
        return ORDER_CREATION_PREFIX + orderId;
    }
}
