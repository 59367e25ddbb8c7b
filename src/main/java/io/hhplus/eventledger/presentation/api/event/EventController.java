package io.hhplus.eventledger.presentation.api.event;

import io.hhplus.eventledger.application.usecase.event.RepublishEventUseCase;
import io.hhplus.eventledger.application.usecase.event.RepublishResult;
import io.hhplus.eventledger.presentation.common.ErrorResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final RepublishEventUseCase republishEventUseCase;

    /**
     * 원장에 기록된 이벤트 수동 재발행 (STORED_NOT_PUBLISHED 복구용)
     */
    @PostMapping("/{eventId}/publish")
    public ResponseEntity<?> republish(@PathVariable String eventId) {
        RepublishResult result = republishEventUseCase.execute(eventId);

        if (result.isPublished()) {
            return ResponseEntity.ok(Map.of(
                "event_id", result.eventId(),
                "outcome", result.outcome().name()
            ));
        }
        return ResponseEntity.status(result.errorCode().getHttpStatus())
                .body(ErrorResponse.of(result.errorCode(), result.message(), Map.of("event_id", eventId)));
    }
}
