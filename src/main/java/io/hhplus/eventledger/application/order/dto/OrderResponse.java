package io.hhplus.eventledger.application.order.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hhplus.eventledger.domain.order.Order;
import io.hhplus.eventledger.domain.order.OrderReadModel;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderResponse(
    String orderId,
    String customerId,
    long totalCents,
    Instant createdAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
            order.getOrderId(),
            order.getCustomerId(),
            order.getTotalCents(),
            order.getCreatedAt()
        );
    }

    public static OrderResponse from(OrderReadModel model) {
        return new OrderResponse(
            model.getOrderId(),
            model.getCustomerId(),
            model.getTotalCents(),
            model.getCreatedAt()
        );
    }
}
