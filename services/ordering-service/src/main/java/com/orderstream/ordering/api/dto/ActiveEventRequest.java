package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code event_id} may be null to clear the active event. */
public record ActiveEventRequest(@JsonProperty("event_id") String eventId) {
}
