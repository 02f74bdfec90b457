package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A sellable menu item.
 *
 * @param categoryId category that decides which stations see this product
 * @param price      current list price; order items snapshot it at creation time
 * @param active     inactive products stay resolvable for existing order items but cannot be ordered
 */
public record Product(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("active") boolean active
) implements Identifiable {

    public Product withId(String newId) {
        return new Product(newId, name, categoryId, price, active);
    }
}
