package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Every synchronized entity type. Each type is one logical channel on the change bus and
 * one cache store on the client.
 */
public enum EntityType {
    CATEGORY("Category", Category.class, "categories"),
    PRODUCT("Product", Product.class, "products"),
    STATION("Station", Station.class, "stations"),
    ORDER("Order", Order.class, "orders"),
    ORDER_ITEM("OrderItem", OrderItem.class, "order-items"),
    SETTINGS("Settings", Settings.class, "settings"),
    EVENT("Event", Event.class, "events");

    private final String value;
    private final Class<? extends Identifiable> payloadType;
    private final String resourcePath;

    EntityType(String value, Class<? extends Identifiable> payloadType, String resourcePath) {
        this.value = value;
        this.payloadType = payloadType;
        this.resourcePath = resourcePath;
    }

    /** Canonical string representation, as carried in {@code entity_type}. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Record class carried by Add and Update envelopes of this type. */
    public Class<? extends Identifiable> payloadType() {
        return payloadType;
    }

    /** Collection path segment under {@code /api/v1}. */
    public String resourcePath() {
        return resourcePath;
    }

    public static Optional<EntityType> fromString(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (EntityType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Looks up the entity type whose payload is the given record class. */
    public static EntityType forPayloadType(Class<?> payloadType) {
        for (EntityType type : values()) {
            if (type.payloadType.equals(payloadType)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No entity type for payload " + payloadType.getName());
    }

    @JsonCreator
    public static EntityType fromValue(String raw) {
        return fromString(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + raw));
    }
}
