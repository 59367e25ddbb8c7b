package io.hhplus.eventledger.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 주문 읽기 모델 (orders_read)
 * <p>
 * 프로젝션만 쓴다. order_id 기준 upsert, 마지막 쓰기가 이긴다.
 */
@Entity
@Table(name = "orders_read")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderReadModel {

    @Id
    @Column(name = "order_id", length = 128)
    private String orderId;

    @Column(name = "customer_id", nullable = false, length = 128)
    private String customerId;

    @Column(name = "total_cents", nullable = false)
    private long totalCents;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "projected_at", nullable = false)
    private Instant projectedAt;

    public static OrderReadModel of(Order order, Instant projectedAt) {
        OrderReadModel model = new OrderReadModel();
        model.orderId = order.getOrderId();
        model.customerId = order.getCustomerId();
        model.totalCents = order.getTotalCents();
        model.createdAt = order.getCreatedAt();
        model.projectedAt = projectedAt;
        return model;
    }
}
