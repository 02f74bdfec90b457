package com.orderstream.syncmodel;

import java.util.ArrayList;

/**
 * Checks that a {@link ChangeEnvelope} is well formed before it is published.
 * Returns all problems at once rather than failing on the first.
 */
public final class EnvelopeValidator {

    private EnvelopeValidator() {
        // utility class
    }

    public static ValidationResult validate(ChangeEnvelope<?> envelope) {
        var errors = new ArrayList<String>();

        if (envelope.entityType() == null) {
            errors.add("entityType must not be null");
        }
        if (envelope.operation() == null) {
            errors.add("operation must not be null");
        }
        if (envelope.entityId() == null || envelope.entityId().isBlank()) {
            errors.add("entityId must not be null or blank");
        }
        if (envelope.operation() != null && envelope.operation() != Operation.DELETE) {
            if (envelope.payload() == null) {
                errors.add("payload must not be null for " + envelope.operation().value());
            } else {
                if (envelope.entityType() != null
                        && !envelope.entityType().payloadType().isInstance(envelope.payload())) {
                    errors.add("payload type " + envelope.payload().getClass().getSimpleName()
                            + " does not match entityType " + envelope.entityType().value());
                }
                if (envelope.entityId() != null && !envelope.entityId().equals(envelope.payload().id())) {
                    errors.add("entityId must match payload id");
                }
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
