package io.hhplus.eventledger.domain.order;

import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorCode;

import java.util.Optional;

/**
 * 주문 읽기 모델 저장소
 * <p>
 * 저장소 장애 시 READ_MODEL_UNAVAILABLE을 던진다.
 */
public interface OrderReadModelRepository {

    /**
     * order_id 기준 insert-or-replace
     */
    OrderReadModel upsert(Order order);

    Optional<OrderReadModel> findByOrderId(String orderId);

    default OrderReadModel findByOrderIdOrThrow(String orderId) {
        return findByOrderId(orderId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.ORDER_NOT_FOUND,
                "주문을 찾을 수 없습니다. orderId: " + orderId
            ));
    }
}
