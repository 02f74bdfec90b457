package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A kitchen or serving station.
 * <p>
 * A station's queue holds the order items whose product belongs to one of
 * {@code categoryIds} and whose status is one of {@code inputStatuses}. Advancing an
 * item moves it to {@code outputStatus}.
 */
public record Station(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("category_ids") List<String> categoryIds,
        @JsonProperty("input_statuses") List<OrderStatus> inputStatuses,
        @JsonProperty("output_status") OrderStatus outputStatus
) implements Identifiable {

    public Station {
        categoryIds = categoryIds == null ? List.of() : List.copyOf(categoryIds);
        inputStatuses = inputStatuses == null ? List.of() : List.copyOf(inputStatuses);
    }

    public Station withId(String newId) {
        return new Station(newId, name, categoryIds, inputStatuses, outputStatus);
    }

    /** True when an item of the given category and status belongs in this station's queue. */
    public boolean accepts(String categoryId, OrderStatus status) {
        return categoryId != null && status != null
                && categoryIds.contains(categoryId) && inputStatuses.contains(status);
    }
}
