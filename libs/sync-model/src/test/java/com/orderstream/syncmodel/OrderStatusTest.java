package com.orderstream.syncmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderStatus")
class OrderStatusTest {

    @Test
    @DisplayName("priorities are strictly increasing in declaration order")
    void prioritiesIncrease() {
        OrderStatus[] statuses = OrderStatus.values();
        for (int i = 1; i < statuses.length; i++) {
            assertThat(statuses[i].priority()).isGreaterThan(statuses[i - 1].priority());
        }
        assertThat(OrderStatus.CANCELLED.priority()).isEqualTo(4);
    }

    @ParameterizedTest
    @CsvSource({
            "DRAFT, ORDERED, ORDERED",
            "READY, ORDERED, READY",
            "COMPLETED, CANCELLED, CANCELLED",
            "READY, READY, READY"
    })
    @DisplayName("max() keeps the higher-priority status")
    void maxKeepsHigher(OrderStatus a, OrderStatus b, OrderStatus expected) {
        assertThat(a.max(b)).isEqualTo(expected);
    }

    @Test
    @DisplayName("fromString accepts wire values and constant names")
    void fromString() {
        assertThat(OrderStatus.fromString("Ready")).contains(OrderStatus.READY);
        assertThat(OrderStatus.fromString("cancelled")).contains(OrderStatus.CANCELLED);
        assertThat(OrderStatus.fromString("Shipped")).isEmpty();
        assertThat(OrderStatus.fromString(null)).isEmpty();
    }

    @Test
    @DisplayName("fromValue rejects unknown values")
    void fromValueRejectsUnknown() {
        assertThatThrownBy(() -> OrderStatus.fromValue("Lost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Lost");
    }
}
