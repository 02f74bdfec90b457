package com.orderstream.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleHeaderParser")
class RoleHeaderParserTest {

    @Test
    @DisplayName("parses a comma-separated list of mixed forms")
    void parsesList() {
        assertThat(RoleHeaderParser.parse("ADMIN, role_staff ,cashier"))
                .containsExactly(Role.ADMIN, Role.STAFF, Role.CASHIER);
    }

    @Test
    @DisplayName("drops unknown and duplicate entries")
    void dropsUnknown() {
        assertThat(RoleHeaderParser.parse("chef,STAFF,,staff")).containsExactly(Role.STAFF);
    }

    @Test
    @DisplayName("missing header yields no roles")
    void missingHeader() {
        assertThat(RoleHeaderParser.parse(null)).isEmpty();
        assertThat(RoleHeaderParser.parse("  ")).isEmpty();
    }

    @Test
    @DisplayName("builds an anonymous context from empty headers")
    void anonymousContext() {
        var ctx = RoleHeaderParser.toCallerContext(" ", null);

        assertThat(ctx.isAnonymous()).isTrue();
    }

    @Test
    @DisplayName("builds a caller context from both headers")
    void callerContext() {
        var ctx = RoleHeaderParser.toCallerContext(" cashier-3 ", "CASHIER");

        assertThat(ctx.userId()).isEqualTo("cashier-3");
        assertThat(ctx.roles()).containsExactly(Role.CASHIER);
    }
}
