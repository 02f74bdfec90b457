package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderstream.ordering.domain.service.OrderItemPatch;
import com.orderstream.syncmodel.OrderStatus;

/**
 * Partial update of an order item; omitted fields are left as they are.
 */
public record OrderItemUpdateRequest(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("quantity") Integer quantity,
        @JsonProperty("status") OrderStatus status
) {

    /** True when only the status changes, which station staff may do. */
    public boolean isStatusOnly() {
        return itemId == null && quantity == null;
    }

    public OrderItemPatch toPatch() {
        return new OrderItemPatch(itemId, quantity, status);
    }
}
