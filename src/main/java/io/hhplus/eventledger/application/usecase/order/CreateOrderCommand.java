package io.hhplus.eventledger.application.usecase.order;

/**
 * 주문 생성 명령
 *
 * @param orderId 비어 있으면 새로 발급
 * @param correlationId 요청 추적 ID (이벤트에 그대로 실린다)
 */
public record CreateOrderCommand(
    String orderId,
    String customerId,
    long totalCents,
    String correlationId
) {
}
