package com.orderstream.ordering.domain;

import com.orderstream.syncmodel.EntityType;

/** Thrown when a referenced entity does not exist. */
public class NotFoundException extends RuntimeException {

    private final EntityType entityType;
    private final String id;

    public NotFoundException(EntityType entityType, String id) {
        super("%s '%s' not found".formatted(entityType.value(), id));
        this.entityType = entityType;
        this.id = id;
    }

    public EntityType entityType() {
        return entityType;
    }

    public String id() {
        return id;
    }
}
