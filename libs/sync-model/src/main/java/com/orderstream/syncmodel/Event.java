package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A festival or venue event that orders are taken at. */
public record Event(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
) implements Identifiable {

    public Event withId(String newId) {
        return new Event(newId, name);
    }
}
