package com.orderstream.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should reject a missing correlation id")
    void shouldRejectNullCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(null, "user-1", "req-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> new CorrelationContext("  ", "user-1", "req-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should allow null user and request ids")
    void shouldAllowNullOptionalFields() {
        var ctx = new CorrelationContext("corr-1", null, null);

        assertThat(ctx.userId()).isNull();
        assertThat(ctx.requestId()).isNull();
    }
}
