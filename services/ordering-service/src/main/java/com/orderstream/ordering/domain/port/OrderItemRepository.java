package com.orderstream.ordering.domain.port;

import com.orderstream.syncmodel.OrderItem;
import java.util.List;

public interface OrderItemRepository extends EntityRepository<OrderItem> {

    List<OrderItem> findByOrderId(String orderId);

    /** True if any order item references the given product. */
    boolean existsByItemId(String productId);
}
