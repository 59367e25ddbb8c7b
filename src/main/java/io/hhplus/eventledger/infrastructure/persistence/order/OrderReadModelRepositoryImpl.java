package io.hhplus.eventledger.infrastructure.persistence.order;

import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.order.Order;
import io.hhplus.eventledger.domain.order.OrderReadModel;
import io.hhplus.eventledger.domain.order.OrderReadModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 읽기 모델 upsert
 * <p>
 * 할당된 ID를 가진 엔티티라 save()가 merge로 동작한다. (있으면 update, 없으면 insert)
 * 동시에 같은 주문을 처음 insert하면 한쪽이 PK 위반으로 실패하는데,
 * 이 경우도 READ_MODEL_UNAVAILABLE로 올려서 재전달 시 update 경로를 타게 한다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class OrderReadModelRepositoryImpl implements OrderReadModelRepository {

    private final OrderReadModelJpaRepository jpaRepository;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    @Override
    public OrderReadModel upsert(Order order) {
        try {
            return jpaRepository.save(OrderReadModel.of(order, Instant.now(clock)));
        } catch (RuntimeException e) {
            log.error("Failed to upsert read model: orderId={}, error={}", order.getOrderId(), e.getMessage(), e);
            throw errorClassifier.toBusinessException(e, ErrorCode.READ_MODEL_UNAVAILABLE);
        }
    }

    @Override
    public Optional<OrderReadModel> findByOrderId(String orderId) {
        try {
            return jpaRepository.findById(orderId);
        } catch (RuntimeException e) {
            throw errorClassifier.toBusinessException(e, ErrorCode.READ_MODEL_UNAVAILABLE);
        }
    }
}
