package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Global singleton configuration. */
public record Settings(
        @JsonProperty("id") String id,
        @JsonProperty("active_event_id") String activeEventId
) implements Identifiable {

    /** Id of the one and only settings row. */
    public static final String GLOBAL_ID = "global";

    public static Settings defaults() {
        return new Settings(GLOBAL_ID, null);
    }

    public Settings withActiveEventId(String eventId) {
        return new Settings(id, eventId);
    }
}
