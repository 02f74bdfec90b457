package com.orderstream.ordering.domain.port;

import com.orderstream.syncmodel.Order;

public interface OrderRepository extends EntityRepository<Order> {

    /** Highest existing sequential id plus one, starting at 1. */
    int nextSequentialId();
}
