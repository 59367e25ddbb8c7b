package io.hhplus.eventledger.domain.event;

import java.util.List;
import java.util.Optional;

/**
 * 이벤트 원장 (쓰기 측 멱등성)
 */
public interface EventLedger {

    /**
     * 조건부 insert. 같은 이벤트 ID 또는 멱등성 키가 없을 때만 기록한다.
     * 존재 여부를 먼저 조회하지 않고 저장소의 제약조건으로 판정한다.
     *
     * @return APPENDED 또는 CONFLICT
     * @throws io.hhplus.eventledger.common.exception.BusinessException EVENT_STORE_UNAVAILABLE
     */
    AppendOutcome append(OrderCreatedEvent event);

    /**
     * 주문별 이벤트 이력 (created_at 오름차순)
     */
    List<EventRecord> eventsForOrder(String orderId);

    Optional<EventRecord> findByEventId(String eventId);
}
