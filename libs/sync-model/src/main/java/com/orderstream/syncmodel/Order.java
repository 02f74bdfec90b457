package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A customer order.
 * <p>
 * {@code status} and {@code totalPrice} are derived from the order's items and are only
 * ever written by the status aggregator.
 *
 * @param sequentialId human-friendly number shown on tickets, assigned at creation
 * @param eventId      event the order was taken at
 */
public record Order(
        @JsonProperty("id") String id,
        @JsonProperty("sequential_id") int sequentialId,
        @JsonProperty("total_price") BigDecimal totalPrice,
        @JsonProperty("status") OrderStatus status,
        @JsonProperty("event_id") String eventId
) implements Identifiable {

    public Order withId(String newId) {
        return new Order(newId, sequentialId, totalPrice, status, eventId);
    }

    public Order withStatusAndTotal(OrderStatus newStatus, BigDecimal newTotal) {
        return new Order(id, sequentialId, newTotal, newStatus, eventId);
    }
}
