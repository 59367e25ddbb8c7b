package io.hhplus.eventledger.application.usecase.order;

import io.hhplus.eventledger.domain.event.OrderCreatedEvent;

/**
 * 이벤트 버스 발행 포트
 * <p>
 * 정상 반환이면 버스가 이벤트를 받아들인 것이다.
 * 실패 시 EVENT_PUBLISH_FAILED(INFRASTRUCTURE)를 던진다.
 */
public interface EventPublisher {

    void publish(OrderCreatedEvent event);
}
