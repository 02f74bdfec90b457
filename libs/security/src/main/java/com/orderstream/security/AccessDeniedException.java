package com.orderstream.security;

import java.util.List;

/**
 * Thrown when a caller lacks the role an operation is gated on.
 */
public class AccessDeniedException extends RuntimeException {

    private final List<Role> required;

    public AccessDeniedException(String userId, List<Role> required) {
        super("Caller '%s' lacks any of the required roles %s".formatted(userId == null ? "anonymous" : userId, required));
        this.required = List.copyOf(required);
    }

    public List<Role> required() {
        return required;
    }
}
