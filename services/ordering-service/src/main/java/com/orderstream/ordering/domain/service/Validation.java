package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.syncmodel.ValidationResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Collects every rule violation for one mutation before deciding. */
final class Validation {

    private final List<String> errors = new ArrayList<>();

    static Validation start() {
        return new Validation();
    }

    /** Trimmed value must be non-empty and at most {@code maxLength} characters. */
    Validation name(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be empty");
        } else if (value.strip().length() > maxLength) {
            errors.add(field + " must be at most " + maxLength + " characters");
        }
        return this;
    }

    Validation nonNegative(String field, BigDecimal value) {
        if (value == null) {
            errors.add(field + " is required");
        } else if (value.signum() < 0) {
            errors.add(field + " must not be negative");
        }
        return this;
    }

    Validation positive(String field, int value) {
        if (value <= 0) {
            errors.add(field + " must be greater than 0");
        }
        return this;
    }

    Validation require(boolean condition, String message) {
        if (!condition) {
            errors.add(message);
        }
        return this;
    }

    ValidationResult result() {
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * @throws ValidationException if any rule was violated
     */
    void throwIfInvalid() {
        ValidationResult result = result();
        if (!result.valid()) {
            throw ValidationException.from(result);
        }
    }

    static String trimmed(String value) {
        return value == null ? null : value.strip();
    }
}
