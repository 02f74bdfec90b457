package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Lifecycle status shared by orders and order items.
 * <p>
 * The priority ordering drives order aggregation: an order takes the status of its
 * highest-priority item, so a single cancelled item dominates everything else.
 */
public enum OrderStatus {
    DRAFT("Draft", 0),
    ORDERED("Ordered", 1),
    READY("Ready", 2),
    COMPLETED("Completed", 3),
    CANCELLED("Cancelled", 4);

    private final String value;
    private final int priority;

    OrderStatus(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    /** Wire representation. */
    @JsonValue
    public String value() {
        return value;
    }

    public int priority() {
        return priority;
    }

    /** Returns whichever of the two statuses has the higher priority. */
    public OrderStatus max(OrderStatus other) {
        return other != null && other.priority > priority ? other : this;
    }

    /** Case-insensitive lookup by wire value or constant name. */
    public static Optional<OrderStatus> fromString(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(raw) || status.name().equalsIgnoreCase(raw)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static OrderStatus fromValue(String raw) {
        return fromString(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + raw));
    }
}
