package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record OrderItemRequest(
        @JsonProperty("order_id") @NotBlank String orderId,
        @JsonProperty("item_id") @NotBlank String itemId,
        @JsonProperty("quantity") @NotNull Integer quantity
) {
}
