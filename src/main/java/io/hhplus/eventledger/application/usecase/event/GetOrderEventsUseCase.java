package io.hhplus.eventledger.application.usecase.event;

import io.hhplus.eventledger.application.event.dto.EventRecordResponse;
import io.hhplus.eventledger.application.usecase.UseCase;
import io.hhplus.eventledger.domain.event.EventLedger;
import lombok.RequiredArgsConstructor;

import java.util.List;

@UseCase
@RequiredArgsConstructor
public class GetOrderEventsUseCase {

    private final EventLedger eventLedger;

    public List<EventRecordResponse> execute(String orderId) {
        return eventLedger.eventsForOrder(orderId).stream()
            .map(EventRecordResponse::from)
            .toList();
    }
}
