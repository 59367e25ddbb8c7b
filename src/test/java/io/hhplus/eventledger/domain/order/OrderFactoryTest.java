package io.hhplus.eventledger.domain.order;

import io.hhplus.eventledger.common.exception.BusinessException;
import io.hhplus.eventledger.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderFactory 테스트")
class OrderFactoryTest {

    private OrderFactory orderFactory;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00.750Z"), ZoneOffset.UTC);
        orderFactory = new OrderFactory(clock);
    }

    @Test
    @DisplayName("주문 ID가 없으면 새 ID를 발급하고, 생성 시각은 초 단위로 자른다")
    void create_generatesOrderId() {
        // when
        Order order = orderFactory.create(null, "cust-1", 500L);

        // then
        assertThat(order.getOrderId()).isNotBlank();
        assertThat(order.getCustomerId()).isEqualTo("cust-1");
        assertThat(order.getTotalCents()).isEqualTo(500L);
        assertThat(order.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("빈 문자열 주문 ID도 새로 발급한다")
    void create_emptyOrderId() {
        Order first = orderFactory.create("", "cust-1", 500L);
        Order second = orderFactory.create("", "cust-1", 500L);

        assertThat(first.getOrderId()).isNotBlank();
        assertThat(first.getOrderId()).isNotEqualTo(second.getOrderId());
    }

    @Test
    @DisplayName("주문 ID가 주어지면 그대로 사용한다")
    void create_keepsOrderId() {
        Order order = orderFactory.create("o1", "cust-1", 500L);

        assertThat(order.getOrderId()).isEqualTo("o1");
    }

    @Test
    @DisplayName("검증 실패는 BusinessException으로 전파된다")
    void create_invalid() {
        assertThatThrownBy(() -> orderFactory.create(null, "cust-1", 0L))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_TOTAL_AMOUNT);
    }
}
