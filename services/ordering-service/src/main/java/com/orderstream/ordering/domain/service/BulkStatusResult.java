package com.orderstream.ordering.domain.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import java.util.List;

/**
 * Outcome of a bulk status change.
 *
 * @param updated items written, in request order
 * @param skipped requested ids that did not exist
 * @param orders  affected orders after their single recomputation each
 */
public record BulkStatusResult(
        @JsonProperty("updated") List<OrderItem> updated,
        @JsonProperty("skipped") List<String> skipped,
        @JsonProperty("orders") List<Order> orders
) {
}
