package io.hhplus.eventledger.domain.order;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * 주문 팩토리
 * <p>
 * - 주문 ID가 비어 있으면 UUID를 새로 발급한다 (유일성은 구조적으로 보장, 원장이 강제하지 않음)
 * - 생성 시각은 UTC 초 단위로 찍는다 (이벤트 envelope의 RFC3339 표기와 동일한 정밀도)
 * - 검증 실패 시 BusinessException(VALIDATION)
 */
@Component
@RequiredArgsConstructor
public class OrderFactory {

    private final Clock clock;

    public Order create(String orderId, String customerId, long totalCents) {
        String resolvedOrderId = (orderId == null || orderId.isEmpty())
                ? UUID.randomUUID().toString()
                : orderId;

        Instant createdAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        return Order.create(resolvedOrderId, customerId, totalCents, createdAt);
    }
}
