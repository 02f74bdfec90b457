package com.orderstream.security;

import java.util.Arrays;

/**
 * Role checks with hierarchy support.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the caller has the required role, directly or via hierarchy.
     * An ADMIN caller satisfies {@code hasRole(ctx, CASHIER)}.
     */
    public static boolean hasRole(CallerContext context, Role required) {
        return context.roles().stream()
                .anyMatch(userRole -> userRole.implies(required));
    }

    public static boolean hasAnyRole(CallerContext context, Role... required) {
        for (Role role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Gate for a mutation entry point.
     *
     * @throws AccessDeniedException if the caller has none of {@code required}
     */
    public static void requireAnyRole(CallerContext context, Role... required) {
        if (!hasAnyRole(context, required)) {
            throw new AccessDeniedException(context.userId(), Arrays.asList(required));
        }
    }
}
