package io.hhplus.eventledger.application.usecase.order;

import io.hhplus.eventledger.application.order.dto.OrderResponse;
import io.hhplus.eventledger.application.usecase.UseCase;
import io.hhplus.eventledger.domain.order.OrderReadModelRepository;
import lombok.RequiredArgsConstructor;

/**
 * 읽기 모델 조회. 프로젝션이 아직 반영하지 않았으면 ORDER_NOT_FOUND.
 */
@UseCase
@RequiredArgsConstructor
public class GetOrderUseCase {

    private final OrderReadModelRepository orderReadModelRepository;

    public OrderResponse execute(String orderId) {
        return OrderResponse.from(orderReadModelRepository.findByOrderIdOrThrow(orderId));
    }
}
