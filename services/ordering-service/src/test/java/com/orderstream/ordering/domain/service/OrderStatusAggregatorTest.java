package com.orderstream.ordering.domain.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.OrderStatus;
import com.orderstream.syncmodel.Product;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OrderStatusAggregator")
class OrderStatusAggregatorTest {

    private OrderingFixture fixture;
    private Product burger;

    @BeforeEach
    void setUp() {
        fixture = new OrderingFixture();
        burger = fixture.product("Burger", fixture.category("Mains"), "10.00");
    }

    private OrderItem item(OrderStatus status) {
        return new OrderItem(null, "o-1", "p-1", 1, BigDecimal.ONE, status);
    }

    @Nested
    @DisplayName("dominantStatus()")
    class DominantStatus {

        @Test
        @DisplayName("empty set is Draft")
        void emptyIsDraft() {
            assertThat(OrderStatusAggregator.dominantStatus(List.of())).isEqualTo(OrderStatus.DRAFT);
        }

        @Test
        @DisplayName("picks the highest priority")
        void picksHighest() {
            assertThat(OrderStatusAggregator.dominantStatus(List.of(
                    item(OrderStatus.ORDERED), item(OrderStatus.COMPLETED), item(OrderStatus.READY))))
                    .isEqualTo(OrderStatus.COMPLETED);
        }

        @Test
        @DisplayName("a single Cancelled item dominates")
        void cancelledDominates() {
            assertThat(OrderStatusAggregator.dominantStatus(List.of(
                    item(OrderStatus.COMPLETED), item(OrderStatus.CANCELLED))))
                    .isEqualTo(OrderStatus.CANCELLED);
        }
    }

    @Test
    @DisplayName("totalPrice sums price times quantity without losing scale")
    void totalPrice() {
        var items = List.of(
                new OrderItem("a", "o", "p", 2, new BigDecimal("10.00"), OrderStatus.DRAFT),
                new OrderItem("b", "o", "p", 3, new BigDecimal("2.50"), OrderStatus.DRAFT));

        assertThat(OrderStatusAggregator.totalPrice(items)).isEqualByComparingTo("27.50");
    }

    @Test
    @DisplayName("Ordered, Ready, Completed, then Cancelled as items move")
    void statusFollowsItems() {
        Order order = fixture.orders.create(null);
        OrderItem first = fixture.orderItems.create(order.id(), burger.id(), 1);
        OrderItem second = fixture.orderItems.create(order.id(), burger.id(), 1);
        fixture.orderItems.bulkUpdateStatus(List.of(first.id(), second.id()), OrderStatus.ORDERED);
        assertThat(fixture.orders.get(order.id()).status()).isEqualTo(OrderStatus.ORDERED);

        fixture.orderItems.update(first.id(), OrderItemPatch.status(OrderStatus.READY));
        assertThat(fixture.orders.get(order.id()).status()).isEqualTo(OrderStatus.READY);

        fixture.orderItems.update(second.id(), OrderItemPatch.status(OrderStatus.COMPLETED));
        assertThat(fixture.orders.get(order.id()).status()).isEqualTo(OrderStatus.COMPLETED);

        fixture.orderItems.update(second.id(), OrderItemPatch.status(OrderStatus.CANCELLED));
        assertThat(fixture.orders.get(order.id()).status()).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    @DisplayName("order reverts to Draft with a zero total when its last item is removed")
    void lastItemDeleted() {
        Order order = fixture.orders.create(null);
        OrderItem only = fixture.orderItems.create(order.id(), burger.id(), 2);
        fixture.orderItems.update(only.id(), OrderItemPatch.status(OrderStatus.READY));
        assertThat(fixture.orders.get(order.id()).totalPrice()).isEqualByComparingTo("20.00");

        fixture.orderItems.delete(only.id());

        Order after = fixture.orders.get(order.id());
        assertThat(after.status()).isEqualTo(OrderStatus.DRAFT);
        assertThat(after.totalPrice()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("recompute counts and times each run")
    void recordsMetrics() {
        Order order = fixture.orders.create(null);

        fixture.aggregator.recompute(order.id());
        fixture.aggregator.recompute(order.id());

        assertThat(fixture.recomputations()).isEqualTo(2.0);
        assertThat(fixture.registry.get("orders.status.recompute.duration").timer().count()).isEqualTo(2);
    }
}
