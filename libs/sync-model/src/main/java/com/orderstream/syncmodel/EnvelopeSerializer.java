package com.orderstream.syncmodel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON wire format for {@link ChangeEnvelope}:
 * <pre>{"entity_type":"Product","operation":"Update","payload":{...}}</pre>
 * A Delete envelope carries the bare id string as its payload.
 */
public final class EnvelopeSerializer {

    public static final String FIELD_ENTITY_TYPE = "entity_type";
    public static final String FIELD_OPERATION = "operation";
    public static final String FIELD_PAYLOAD = "payload";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvelopeSerializer() {
        // utility class
    }

    /**
     * Serializes an envelope to its wire representation.
     *
     * @throws EnvelopeSerializationException if Jackson cannot write the payload
     */
    public static String serialize(ChangeEnvelope<?> envelope) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(FIELD_ENTITY_TYPE, envelope.entityType().value());
        root.put(FIELD_OPERATION, envelope.operation().value());
        root.put(FIELD_PAYLOAD, envelope.isDelete() ? envelope.entityId() : envelope.payload());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException(
                    "Failed to serialize " + envelope.entityType().value() + " envelope for " + envelope.entityId(), e);
        }
    }

    /**
     * Deserializes a wire frame, resolving the payload class from {@code entity_type}.
     *
     * @throws EnvelopeSerializationException if the JSON is malformed or names an unknown type
     */
    public static ChangeEnvelope<? extends Identifiable> deserialize(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException("Failed to parse envelope", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeSerializationException("Envelope must be a JSON object", null);
        }
        EntityType entityType = EntityType.fromString(root.path(FIELD_ENTITY_TYPE).asText(null))
                .orElseThrow(() -> new EnvelopeSerializationException(
                        "Unknown entity_type: " + root.path(FIELD_ENTITY_TYPE), null));
        Operation operation = Operation.fromString(root.path(FIELD_OPERATION).asText(null))
                .orElseThrow(() -> new EnvelopeSerializationException(
                        "Unknown operation: " + root.path(FIELD_OPERATION), null));
        return readPayload(json, entityType, operation, root.path(FIELD_PAYLOAD), entityType.payloadType());
    }

    /**
     * Deserializes a wire frame whose entity type is known in advance.
     *
     * @throws EnvelopeSerializationException if the frame is malformed or carries a different type
     */
    public static <T extends Identifiable> ChangeEnvelope<T> deserialize(String json, Class<T> payloadType) {
        ChangeEnvelope<? extends Identifiable> envelope = deserialize(json);
        if (!envelope.entityType().payloadType().equals(payloadType)) {
            throw new EnvelopeSerializationException(
                    "Expected " + payloadType.getSimpleName() + " envelope but got " + envelope.entityType().value(), null);
        }
        return envelope.as(payloadType);
    }

    /** Deserializes, returning empty on any failure. */
    public static Optional<ChangeEnvelope<? extends Identifiable>> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static <T extends Identifiable> ChangeEnvelope<T> readPayload(
            String json, EntityType entityType, Operation operation, JsonNode payload, Class<T> payloadType) {
        if (operation == Operation.DELETE) {
            if (!payload.isTextual()) {
                throw new EnvelopeSerializationException("Delete payload must be the entity id", null);
            }
            return new ChangeEnvelope<>(entityType, operation, payload.asText(), null);
        }
        if (!payload.isObject()) {
            throw new EnvelopeSerializationException(operation.value() + " payload must be an object", null);
        }
        // read from the text, not the tree, so decimal prices keep their scale
        JavaType type = MAPPER.getTypeFactory().constructParametricType(PayloadFrame.class, payloadType);
        try {
            PayloadFrame<T> frame = MAPPER.readValue(json, type);
            T entity = frame.payload();
            return new ChangeEnvelope<>(entityType, operation, entity.id(), entity);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EnvelopeSerializationException("Failed to read " + entityType.value() + " payload", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PayloadFrame<T>(@JsonProperty(FIELD_PAYLOAD) T payload) {
    }

    /** Thrown when an envelope cannot be written or read. */
    public static class EnvelopeSerializationException extends RuntimeException {
        public EnvelopeSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
