package com.orderstream.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("ADMIN implies CASHIER and STAFF")
    void adminImpliesEverything() {
        assertThat(Role.ADMIN.impliedRoles()).containsExactlyInAnyOrder(Role.CASHIER, Role.STAFF);
        assertThat(Role.ADMIN.implies(Role.ADMIN)).isTrue();
    }

    @Test
    @DisplayName("CASHIER and STAFF do not imply each other")
    void cashierAndStaffAreIndependent() {
        assertThat(Role.CASHIER.implies(Role.STAFF)).isFalse();
        assertThat(Role.STAFF.implies(Role.CASHIER)).isFalse();
        assertThat(Role.STAFF.implies(Role.ADMIN)).isFalse();
    }

    @Test
    @DisplayName("fromString accepts canonical values and bare names in any case")
    void fromString() {
        assertThat(Role.fromString("ROLE_ADMIN")).contains(Role.ADMIN);
        assertThat(Role.fromString("cashier")).contains(Role.CASHIER);
        assertThat(Role.fromString(" Staff ")).contains(Role.STAFF);
        assertThat(Role.fromString("chef")).isEmpty();
        assertThat(Role.fromString(null)).isEmpty();
    }
}
