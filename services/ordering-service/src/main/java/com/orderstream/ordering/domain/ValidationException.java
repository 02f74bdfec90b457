package com.orderstream.ordering.domain;

import com.orderstream.syncmodel.ValidationResult;
import java.util.List;

/**
 * Thrown when a mutation is rejected before anything is written. Carries every problem found,
 * not just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public static ValidationException from(ValidationResult result) {
        return new ValidationException(result.errors());
    }

    public List<String> errors() {
        return errors;
    }
}
