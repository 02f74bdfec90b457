package com.orderstream.syncmodel;

/**
 * A tagged change notification flowing from the server to every connected client.
 * <p>
 * Add and Update carry the full entity; Delete carries only the id, so {@code payload} is
 * {@code null} for deletes and {@code entityId} is always populated. Envelopes have no sequence
 * number or timestamp: ordering is the delivery order of a single subscriber.
 *
 * @param <T>        the entity record type
 * @param entityType channel the envelope is published on
 * @param operation  Add, Update or Delete
 * @param entityId   id of the affected entity
 * @param payload    full entity for Add/Update, {@code null} for Delete
 */
public record ChangeEnvelope<T extends Identifiable>(
        EntityType entityType,
        Operation operation,
        String entityId,
        T payload
) {

    public static <T extends Identifiable> ChangeEnvelope<T> added(T entity) {
        return new ChangeEnvelope<>(EntityType.forPayloadType(entity.getClass()), Operation.ADD, entity.id(), entity);
    }

    public static <T extends Identifiable> ChangeEnvelope<T> updated(T entity) {
        return new ChangeEnvelope<>(EntityType.forPayloadType(entity.getClass()), Operation.UPDATE, entity.id(), entity);
    }

    public static <T extends Identifiable> ChangeEnvelope<T> deleted(EntityType entityType, String id) {
        return new ChangeEnvelope<>(entityType, Operation.DELETE, id, null);
    }

    /**
     * The same envelope with its payload typed as {@code type}.
     *
     * @throws ClassCastException if the payload is not a {@code type}
     */
    public <U extends Identifiable> ChangeEnvelope<U> as(Class<U> type) {
        return new ChangeEnvelope<>(entityType, operation, entityId, payload == null ? null : type.cast(payload));
    }

    public boolean isDelete() {
        return operation == Operation.DELETE;
    }
}
