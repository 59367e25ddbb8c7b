package io.hhplus.eventledger.presentation.api.order;

import io.hhplus.eventledger.application.event.dto.EventRecordResponse;
import io.hhplus.eventledger.application.order.dto.CreateOrderRequest;
import io.hhplus.eventledger.application.order.dto.OrderResponse;
import io.hhplus.eventledger.application.usecase.event.GetOrderEventsUseCase;
import io.hhplus.eventledger.application.usecase.order.CreateOrderResult;
import io.hhplus.eventledger.application.usecase.order.CreateOrderUseCase;
import io.hhplus.eventledger.application.usecase.order.GetOrderUseCase;
import io.hhplus.eventledger.presentation.common.CorrelationIdFilter;
import io.hhplus.eventledger.presentation.common.ErrorResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final CreateOrderUseCase createOrderUseCase;
    private final GetOrderUseCase getOrderUseCase;
    private final GetOrderEventsUseCase getOrderEventsUseCase;

    /**
     * 주문 생성 API
     * <p>
     * 201 CREATED / 409 ALREADY_EXISTS / 400 VALIDATION_FAILED /
     * 503 STORE_UNAVAILABLE / 503 STORED_NOT_PUBLISHED (details.event_id로 재발행 가능) /
     * 500 EVENT_BUILD_FAILED
     */
    @PostMapping
    public ResponseEntity<?> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @RequestAttribute(name = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId
    ) {
        String resolvedCorrelationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        CreateOrderResult result = createOrderUseCase.execute(request.toCommand(resolvedCorrelationId));

        return switch (result.outcome()) {
            case CREATED -> ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(result.order()));
            case ALREADY_EXISTS, VALIDATION_FAILED, STORE_UNAVAILABLE, STORED_NOT_PUBLISHED, EVENT_BUILD_FAILED ->
                    ResponseEntity.status(result.errorCode().getHttpStatus())
                            .body(ErrorResponse.of(result.errorCode(), result.message(), details(result)));
        };
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(getOrderUseCase.execute(orderId));
    }

    @GetMapping("/{orderId}/events")
    public ResponseEntity<List<EventRecordResponse>> getOrderEvents(@PathVariable String orderId) {
        return ResponseEntity.ok(getOrderEventsUseCase.execute(orderId));
    }

    private Map<String, Object> details(CreateOrderResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (result.order() != null) {
            details.put("order_id", result.order().getOrderId());
        }
        if (result.eventId() != null) {
            details.put("event_id", result.eventId());
        }
        details.put("retriable", result.isRetriable());
        return details;
    }
}
