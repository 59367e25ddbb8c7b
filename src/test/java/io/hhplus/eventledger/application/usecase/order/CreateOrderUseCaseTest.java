package io.hhplus.eventledger.application.usecase.order;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.eventledger.application.usecase.event.PublicationFailureRecorder;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.event.AppendOutcome;
import io.hhplus.eventledger.domain.event.EventBuilder;
import io.hhplus.eventledger.domain.event.EventEnvelopeCodec;
import io.hhplus.eventledger.domain.event.EventLedger;
import io.hhplus.eventledger.domain.event.EventRecord;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import io.hhplus.eventledger.domain.order.Order;
import io.hhplus.eventledger.domain.order.OrderFactory;
import io.hhplus.eventledger.infrastructure.metrics.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("CreateOrderUseCase 테스트")
class CreateOrderUseCaseTest {

    @Mock
    private EventLedger eventLedger;

    @Mock
    private EventPublisher eventPublisher;

    @Mock
    private PublicationFailureRecorder publicationFailureRecorder;

    private SimpleMeterRegistry meterRegistry;
    private OrderFactory orderFactory;
    private EventBuilder eventBuilder;
    private MetricsCollector metricsCollector;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        orderFactory = new OrderFactory(clock);
        eventBuilder = new EventBuilder(new EventEnvelopeCodec(new ObjectMapper()));
        metricsCollector = new MetricsCollector(meterRegistry);
    }

    private CreateOrderUseCase useCase(EventLedger ledger) {
        return new CreateOrderUseCase(
            orderFactory, eventBuilder, ledger, eventPublisher,
            publicationFailureRecorder, new ErrorClassifier(), metricsCollector
        );
    }

    @Test
    @DisplayName("정상 흐름: 원장 기록 후 발행하고 CREATED")
    void execute_created() {
        // given
        given(eventLedger.append(any(OrderCreatedEvent.class))).willReturn(AppendOutcome.APPENDED);

        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand(null, "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.CREATED);
        assertThat(result.order().getOrderId()).isNotBlank();
        assertThat(result.eventId()).isNotBlank();

        ArgumentCaptor<OrderCreatedEvent> captor = ArgumentCaptor.forClass(OrderCreatedEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertThat(captor.getValue().getEventId()).isEqualTo(result.eventId());
        assertThat(captor.getValue().getCorrelationId()).isEqualTo("r1");

        assertThat(meterRegistry.get("create_order_total")
            .tag("outcome", "CREATED")
            .tag("error_code", "none")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("검증 실패 시 원장과 버스를 건드리지 않는다")
    void execute_validationFailed() {
        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand(null, "", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.VALIDATION_FAILED);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.INVALID_CUSTOMER_ID);
        assertThat(result.isRetriable()).isFalse();
        verifyNoInteractions(eventLedger, eventPublisher);
    }

    @Test
    @DisplayName("원장 충돌이면 ALREADY_EXISTS, 발행하지 않는다")
    void execute_alreadyExists() {
        // given
        given(eventLedger.append(any(OrderCreatedEvent.class))).willReturn(AppendOutcome.CONFLICT);

        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand("o1", "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.ALREADY_EXISTS);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.ORDER_ALREADY_EXISTS);
        assertThat(result.isRetriable()).isFalse();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("원장 장애면 STORE_UNAVAILABLE (재시도 가능)")
    void execute_storeUnavailable() {
        // given
        given(eventLedger.append(any(OrderCreatedEvent.class)))
            .willThrow(new BusinessException(ErrorCode.EVENT_STORE_UNAVAILABLE));

        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand("o1", "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.STORE_UNAVAILABLE);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.EVENT_STORE_UNAVAILABLE);
        assertThat(result.isRetriable()).isTrue();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("원장이 값을 거부하면(길이 초과) ALREADY_EXISTS가 아니라 VALIDATION_FAILED")
    void execute_rejectedByStoreConstraint() {
        // given
        given(eventLedger.append(any(OrderCreatedEvent.class))).willThrow(new BusinessException(
            ErrorCode.STORE_CONSTRAINT_VIOLATION, "Data too long for column 'correlation_id' at row 1"
        ));

        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand("o1", "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.VALIDATION_FAILED);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.STORE_CONSTRAINT_VIOLATION);
        assertThat(result.isRetriable()).isFalse();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("envelope 생성에 실패하면 EVENT_BUILD_FAILED, 원장은 건드리지 않고 메트릭은 남긴다")
    void execute_eventBuildFailed() {
        // given
        EventBuilder failingBuilder = mock(EventBuilder.class);
        given(failingBuilder.build(any(Order.class), anyString()))
            .willThrow(new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "envelope 직렬화 실패"));
        CreateOrderUseCase useCase = new CreateOrderUseCase(
            orderFactory, failingBuilder, eventLedger, eventPublisher,
            publicationFailureRecorder, new ErrorClassifier(), metricsCollector
        );

        // when
        CreateOrderResult result = useCase.execute(new CreateOrderCommand("o1", "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.EVENT_BUILD_FAILED);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
        assertThat(result.isRetriable()).isFalse();
        verifyNoInteractions(eventLedger, eventPublisher);
        assertThat(meterRegistry.get("create_order_total")
            .tag("outcome", "EVENT_BUILD_FAILED")
            .tag("error_code", ErrorCode.INTERNAL_SERVER_ERROR.getCode())
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("발행 실패면 STORED_NOT_PUBLISHED, eventId를 돌려주고 append는 한 번만 호출한다")
    void execute_storedNotPublished() {
        // given
        given(eventLedger.append(any(OrderCreatedEvent.class))).willReturn(AppendOutcome.APPENDED);
        willThrow(new BusinessException(ErrorCode.EVENT_PUBLISH_FAILED))
            .given(eventPublisher).publish(any(OrderCreatedEvent.class));

        // when
        CreateOrderResult result = useCase(eventLedger).execute(new CreateOrderCommand("o1", "cust-1", 500L, "r1"));

        // then
        assertThat(result.outcome()).isEqualTo(CreateOrderOutcome.STORED_NOT_PUBLISHED);
        assertThat(result.eventId()).isNotBlank();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.EVENT_PUBLISH_FAILED);
        assertThat(result.isRetriable()).isTrue();
        verify(eventLedger, times(1)).append(any(OrderCreatedEvent.class));

        ArgumentCaptor<OrderCreatedEvent> captor = ArgumentCaptor.forClass(OrderCreatedEvent.class);
        verify(publicationFailureRecorder).record(captor.capture(), anyString());
        assertThat(captor.getValue().getEventId()).isEqualTo(result.eventId());
    }

    @Test
    @DisplayName("같은 주문 ID로 다시 제출하면 ALREADY_EXISTS, 발행은 한 번뿐이다")
    void execute_resubmitSameOrder() {
        // given
        InMemoryEventLedger ledger = new InMemoryEventLedger();
        CreateOrderUseCase useCase = useCase(ledger);

        CreateOrderResult first = useCase.execute(new CreateOrderCommand(null, "cust-1", 500L, "r1"));
        String orderId = first.order().getOrderId();

        // when
        CreateOrderResult second = useCase.execute(new CreateOrderCommand(orderId, "cust-1", 500L, "r2"));

        // then
        assertThat(first.outcome()).isEqualTo(CreateOrderOutcome.CREATED);
        assertThat(second.outcome()).isEqualTo(CreateOrderOutcome.ALREADY_EXISTS);
        assertThat(ledger.eventsForOrder(orderId)).hasSize(1);
        verify(eventPublisher, times(1)).publish(any(OrderCreatedEvent.class));
        verify(publicationFailureRecorder, never()).record(any(), anyString());
    }

    /**
     * 멱등성 키 기준 조건부 insert만 흉내 낸 원장
     */
    static class InMemoryEventLedger implements EventLedger {

        private final Map<String, OrderCreatedEvent> byIdempotencyKey = new LinkedHashMap<>();

        @Override
        public AppendOutcome append(OrderCreatedEvent event) {
            if (byIdempotencyKey.putIfAbsent(event.getIdempotencyKey(), event) != null) {
                return AppendOutcome.CONFLICT;
            }
            return AppendOutcome.APPENDED;
        }

        @Override
        public List<EventRecord> eventsForOrder(String orderId) {
            List<EventRecord> records = new ArrayList<>();
            for (OrderCreatedEvent event : byIdempotencyKey.values()) {
                if (event.getOrderId().equals(orderId)) {
                    records.add(EventRecord.from(event, Instant.EPOCH));
                }
            }
            return records;
        }

        @Override
        public Optional<EventRecord> findByEventId(String eventId) {
            return byIdempotencyKey.values().stream()
                .filter(event -> event.getEventId().equals(eventId))
                .findFirst()
                .map(event -> EventRecord.from(event, Instant.EPOCH));
        }
    }
}
