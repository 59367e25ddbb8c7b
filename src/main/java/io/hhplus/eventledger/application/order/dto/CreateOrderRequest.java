package io.hhplus.eventledger.application.order.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hhplus.eventledger.application.usecase.order.CreateOrderCommand;
import jakarta.validation.constraints.Size;

/**
 * 주문 생성 요청
 * <p>
 * 필수값/금액 검증은 도메인(Order.create)에서 한다. 여기서는 저장 컬럼 길이만 막는다.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOrderRequest(
    @Size(max = 128, message = "주문 ID는 128자 이하여야 합니다")
    String orderId,

    @Size(max = 128, message = "고객 ID는 128자 이하여야 합니다")
    String customerId,

    Long totalCents
) {
    public CreateOrderCommand toCommand(String correlationId) {
        return new CreateOrderCommand(
            orderId,
            customerId,
            totalCents == null ? 0L : totalCents,
            correlationId
        );
    }
}
