package com.orderstream.ordering.infrastructure.persistence;

import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.OrderItem;
import java.util.List;

public class InMemoryOrderItemRepository extends InMemoryEntityRepository<OrderItem> implements OrderItemRepository {

    public InMemoryOrderItemRepository() {
        super(EntityType.ORDER_ITEM, OrderItem::withId);
    }

    @Override
    public List<OrderItem> findByOrderId(String orderId) {
        return findAll(item -> item.orderId().equals(orderId));
    }

    @Override
    public boolean existsByItemId(String productId) {
        return !findAll(item -> item.itemId().equals(productId)).isEmpty();
    }
}
