package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Menu grouping used to route products to kitchen stations. */
public record Category(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
) implements Identifiable {

    public Category withId(String newId) {
        return new Category(newId, name);
    }
}
