package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

/**
 * Create or replace a product.
 *
 * @param active whether cashiers may order it, {@code true} when omitted
 */
public record ProductRequest(
        @JsonProperty("name") @NotBlank String name,
        @JsonProperty("category_id") @NotBlank String categoryId,
        @JsonProperty("price") @NotNull BigDecimal price,
        @JsonProperty("active") Boolean active
) {

    public boolean activeOrDefault() {
        return active == null || active;
    }
}
