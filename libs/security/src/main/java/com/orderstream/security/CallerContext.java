package com.orderstream.security;

import java.util.List;

/**
 * Identity and roles of whoever invoked a mutation, as supplied by the upstream
 * auth/session layer.
 *
 * @param userId caller id, {@code null} when anonymous
 * @param roles  granted roles (never null)
 */
public record CallerContext(String userId, List<Role> roles) {

    public CallerContext {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static CallerContext anonymous() {
        return new CallerContext(null, List.of());
    }

    public boolean isAnonymous() {
        return userId == null && roles.isEmpty();
    }
}
