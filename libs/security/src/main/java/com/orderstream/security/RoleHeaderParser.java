package com.orderstream.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the comma-separated role header set by the upstream session layer
 * (e.g. {@code "ADMIN, cashier"} or {@code "ROLE_STAFF"}).
 */
public final class RoleHeaderParser {

    /** Header carrying the caller's roles. */
    public static final String ROLES_HEADER = "X-User-Roles";

    /** Header carrying the caller's id. */
    public static final String USER_ID_HEADER = "X-User-Id";

    private RoleHeaderParser() {
        // utility class
    }

    /**
     * Unknown or blank entries are dropped; duplicates are collapsed.
     *
     * @param header raw header value (may be null)
     */
    public static List<Role> parse(String header) {
        if (header == null || header.isBlank()) {
            return List.of();
        }
        var roles = new ArrayList<Role>();
        for (String part : header.split(",")) {
            Role.fromString(part).filter(role -> !roles.contains(role)).ifPresent(roles::add);
        }
        return List.copyOf(roles);
    }

    public static CallerContext toCallerContext(String userIdHeader, String rolesHeader) {
        String userId = userIdHeader == null || userIdHeader.isBlank() ? null : userIdHeader.strip();
        return new CallerContext(userId, parse(rolesHeader));
    }
}
