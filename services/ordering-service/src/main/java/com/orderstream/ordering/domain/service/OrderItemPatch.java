package com.orderstream.ordering.domain.service;

import com.orderstream.syncmodel.OrderStatus;

/**
 * Partial update of an order item. Null fields are left unchanged.
 *
 * @param itemId   new product; the unit price is captured again from it
 * @param quantity new quantity, at least 1
 * @param status   new status
 */
public record OrderItemPatch(String itemId, Integer quantity, OrderStatus status) {

    public static OrderItemPatch status(OrderStatus status) {
        return new OrderItemPatch(null, null, status);
    }

    public boolean isEmpty() {
        return itemId == null && quantity == null && status == null;
    }
}
