package com.orderstream.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles. The hierarchy (ADMIN implies CASHIER and STAFF) is encoded once here
 * instead of at every gate.
 */
public enum Role {

    ADMIN("ROLE_ADMIN"),
    CASHIER("ROLE_CASHIER"),
    STAFF("ROLE_STAFF");

    private static final String PREFIX = "ROLE_";

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "ROLE_CASHIER"). */
    public String value() {
        return value;
    }

    public Set<Role> impliedRoles() {
        return switch (this) {
            case ADMIN -> EnumSet.of(CASHIER, STAFF);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /** True when this role is {@code other} or implies it through the hierarchy. */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a role by canonical value ("ROLE_STAFF") or bare name ("staff"), ignoring case.
     */
    public static Optional<Role> fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.strip().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith(PREFIX)) {
            normalized = PREFIX + normalized;
        }
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
