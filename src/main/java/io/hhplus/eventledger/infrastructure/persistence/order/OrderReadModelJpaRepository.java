package io.hhplus.eventledger.infrastructure.persistence.order;

import io.hhplus.eventledger.domain.order.OrderReadModel;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrderReadModelJpaRepository extends JpaRepository<OrderReadModel, String> {
}
