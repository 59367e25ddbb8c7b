package io.hhplus.eventledger.application.usecase.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.eventledger.application.usecase.order.EventPublisher;
import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorClassifier;
import io.hhplus.eventledger.common.exception.ErrorCode;
import io.hhplus.eventledger.domain.event.EventBuilder;
import io.hhplus.eventledger.domain.event.EventEnvelopeCodec;
import io.hhplus.eventledger.domain.event.EventLedger;
import io.hhplus.eventledger.domain.event.EventRecord;
import io.hhplus.eventledger.domain.event.OrderCreatedEvent;
import io.hhplus.eventledger.domain.order.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("RepublishEventUseCase 테스트")
class RepublishEventUseCaseTest {

    @Mock
    private EventLedger eventLedger;

    @Mock
    private EventPublisher eventPublisher;

    private EventBuilder eventBuilder;
    private RepublishEventUseCase useCase;

    @BeforeEach
    void setUp() {
        eventBuilder = new EventBuilder(new EventEnvelopeCodec(new ObjectMapper()));
        useCase = new RepublishEventUseCase(eventLedger, eventBuilder, eventPublisher, new ErrorClassifier());
    }

    private EventRecord storedRecord() {
        Order order = Order.create("o1", "c1", 100L, Instant.parse("2024-01-01T00:00:00Z"));
        return EventRecord.from(eventBuilder.build(order, "r1"), Instant.parse("2024-01-01T00:00:01Z"));
    }

    @Test
    @DisplayName("저장된 envelope를 같은 eventId로 다시 발행한다")
    void execute_published() {
        // given
        EventRecord record = storedRecord();
        given(eventLedger.findByEventId(record.getEventId())).willReturn(Optional.of(record));

        // when
        RepublishResult result = useCase.execute(record.getEventId());

        // then
        assertThat(result.outcome()).isEqualTo(RepublishOutcome.PUBLISHED);
        ArgumentCaptor<OrderCreatedEvent> captor = ArgumentCaptor.forClass(OrderCreatedEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertThat(captor.getValue().getEventId()).isEqualTo(record.getEventId());
        assertThat(captor.getValue().getPayload()).isEqualTo(record.getData());
    }

    @Test
    @DisplayName("원장에 없는 이벤트는 NOT_FOUND")
    void execute_notFound() {
        given(eventLedger.findByEventId("missing")).willReturn(Optional.empty());

        RepublishResult result = useCase.execute("missing");

        assertThat(result.outcome()).isEqualTo(RepublishOutcome.NOT_FOUND);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.EVENT_NOT_FOUND);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("원장 조회 장애는 STORE_UNAVAILABLE")
    void execute_storeUnavailable() {
        given(eventLedger.findByEventId("e1")).willThrow(new BusinessException(ErrorCode.EVENT_STORE_UNAVAILABLE));

        RepublishResult result = useCase.execute("e1");

        assertThat(result.outcome()).isEqualTo(RepublishOutcome.STORE_UNAVAILABLE);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.EVENT_STORE_UNAVAILABLE);
    }

    @Test
    @DisplayName("발행 실패는 PUBLISH_FAILED")
    void execute_publishFailed() {
        EventRecord record = storedRecord();
        given(eventLedger.findByEventId(record.getEventId())).willReturn(Optional.of(record));
        willThrow(new BusinessException(ErrorCode.EVENT_PUBLISH_FAILED)).given(eventPublisher).publish(any());

        RepublishResult result = useCase.execute(record.getEventId());

        assertThat(result.outcome()).isEqualTo(RepublishOutcome.PUBLISH_FAILED);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.EVENT_PUBLISH_FAILED);
    }
}
