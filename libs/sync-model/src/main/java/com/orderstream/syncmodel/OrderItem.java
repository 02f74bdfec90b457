package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One line of an order.
 *
 * @param itemId product this line refers to
 * @param price  unit price captured from the product when the line was created
 */
public record OrderItem(
        @JsonProperty("id") String id,
        @JsonProperty("order_id") String orderId,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("quantity") int quantity,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("status") OrderStatus status
) implements Identifiable {

    public OrderItem withId(String newId) {
        return new OrderItem(newId, orderId, itemId, quantity, price, status);
    }

    public OrderItem withStatus(OrderStatus newStatus) {
        return new OrderItem(id, orderId, itemId, quantity, price, newStatus);
    }

    /** Unit price times quantity. */
    public BigDecimal lineTotal() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
