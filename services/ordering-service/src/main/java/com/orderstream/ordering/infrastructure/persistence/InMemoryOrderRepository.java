package com.orderstream.ordering.infrastructure.persistence;

import com.orderstream.ordering.domain.port.OrderRepository;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Order;

public class InMemoryOrderRepository extends InMemoryEntityRepository<Order> implements OrderRepository {

    public InMemoryOrderRepository() {
        super(EntityType.ORDER, Order::withId);
    }

    @Override
    public synchronized int nextSequentialId() {
        int max = 0;
        for (Order order : getAll()) {
            max = Math.max(max, order.sequentialId());
        }
        return max + 1;
    }
}
