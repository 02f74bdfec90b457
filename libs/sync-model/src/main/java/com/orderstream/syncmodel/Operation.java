package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** The kind of mutation a {@link ChangeEnvelope} describes. */
public enum Operation {
    ADD("Add"),
    UPDATE("Update"),
    DELETE("Delete");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<Operation> fromString(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (Operation op : values()) {
            if (op.value.equalsIgnoreCase(raw)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Operation fromValue(String raw) {
        return fromString(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + raw));
    }
}
