package com.orderstream.ordering.domain.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.OrderStatus;
import com.orderstream.syncmodel.Product;
import com.orderstream.syncmodel.Station;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StationQueueService")
class StationQueueServiceTest {

    private OrderingFixture fixture;
    private Station grill;
    private OrderItem burgerOrdered;
    private OrderItem burgerDraft;
    private OrderItem colaOrdered;

    @BeforeEach
    void setUp() {
        fixture = new OrderingFixture();
        Category mains = fixture.category("Mains");
        Category drinks = fixture.category("Drinks");
        Product burger = fixture.product("Burger", mains, "10.00");
        Product cola = fixture.product("Cola", drinks, "3.00");
        grill = fixture.stations.create("Grill", List.of(mains.id()), List.of(OrderStatus.ORDERED), OrderStatus.READY);

        Order placed = fixture.orders.create(null);
        burgerOrdered = fixture.orderItems.create(placed.id(), burger.id(), 1);
        colaOrdered = fixture.orderItems.create(placed.id(), cola.id(), 1);
        fixture.orderItems.bulkUpdateStatus(List.of(burgerOrdered.id(), colaOrdered.id()), OrderStatus.ORDERED);

        Order draft = fixture.orders.create(null);
        burgerDraft = fixture.orderItems.create(draft.id(), burger.id(), 1);
    }

    @Test
    @DisplayName("queue holds items of the station's categories in its input statuses")
    void queue() {
        assertThat(fixture.stationQueues.queue(grill.id()))
                .extracting(OrderItem::id)
                .containsExactly(burgerOrdered.id());
    }

    @Test
    @DisplayName("advance moves only queued items to the output status")
    void advanceSelected() {
        BulkStatusResult result = fixture.stationQueues.advance(grill.id(),
                List.of(burgerOrdered.id(), colaOrdered.id(), burgerDraft.id()));

        assertThat(result.updated()).extracting(OrderItem::id).containsExactly(burgerOrdered.id());
        assertThat(fixture.orderItems.get(burgerOrdered.id()).status()).isEqualTo(OrderStatus.READY);
        assertThat(fixture.orderItems.get(colaOrdered.id()).status()).isEqualTo(OrderStatus.ORDERED);
        assertThat(fixture.orders.get(burgerOrdered.orderId()).status()).isEqualTo(OrderStatus.READY);
        assertThat(fixture.stationQueues.queue(grill.id())).isEmpty();
    }

    @Test
    @DisplayName("advance with no ids empties the whole queue")
    void advanceAll() {
        BulkStatusResult result = fixture.stationQueues.advance(grill.id(), List.of());

        assertThat(result.updated()).hasSize(1);
        assertThat(fixture.stationQueues.queue(grill.id())).isEmpty();
    }
}
