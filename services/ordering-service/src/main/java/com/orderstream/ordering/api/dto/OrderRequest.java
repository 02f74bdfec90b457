package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code event_id} is optional; the active event is used when it is absent. */
public record OrderRequest(@JsonProperty("event_id") String eventId) {
}
