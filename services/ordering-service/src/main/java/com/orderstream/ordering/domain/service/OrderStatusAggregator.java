package com.orderstream.ordering.domain.service;

import com.orderstream.observability.MetricFactory;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.ordering.domain.port.OrderRepository;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.OrderStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives an order's status and total from its items.
 *
 * <p>The status is the highest-priority status among the order's items
 * ({@code Draft < Ordered < Ready < Completed < Cancelled}), so one cancelled item makes the
 * whole order read Cancelled. An order with no items is Draft with a zero total. The total is
 * the sum of each item's captured unit price times its quantity.
 *
 * <p>Recomputation runs inline with the item mutation that triggered it. Reading the siblings and
 * writing the order are two separate repository calls with no transaction around them: two
 * concurrent item updates on the same order can race, and the last order write wins.
 */
@Component
public class OrderStatusAggregator {

    private static final Logger log = LoggerFactory.getLogger(OrderStatusAggregator.class);

    private final OrderRepository orders;
    private final OrderItemRepository orderItems;
    private final Counter recomputations;
    private final Timer recomputeTimer;

    public OrderStatusAggregator(OrderRepository orders, OrderItemRepository orderItems, MetricFactory metrics) {
        this.orders = orders;
        this.orderItems = orderItems;
        this.recomputations = metrics.counter("orders.status.recomputed", "Order status recomputations");
        this.recomputeTimer = metrics.timer("orders.status.recompute.duration", "Time spent recomputing an order");
    }

    /**
     * Re-reads the order's items and persists the derived status and total.
     *
     * @return the order as persisted
     * @throws com.orderstream.ordering.domain.NotFoundException if the order does not exist
     */
    public Order recompute(String orderId) {
        Timer.Sample sample = Timer.start();
        try {
            Order order = orders.get(orderId);
            var siblings = orderItems.findByOrderId(orderId);
            OrderStatus status = dominantStatus(siblings);
            BigDecimal total = totalPrice(siblings);

            Order updated = orders.update(order.withStatusAndTotal(status, total));
            recomputations.increment();
            log.debug("Order {} recomputed from {} items: {} -> {}, total {}",
                    orderId, siblings.size(), order.status().value(), status.value(), total);
            return updated;
        } finally {
            sample.stop(recomputeTimer);
        }
    }

    /** Highest-priority status among {@code items}, or Draft when there are none. */
    public static OrderStatus dominantStatus(Collection<OrderItem> items) {
        OrderStatus result = OrderStatus.DRAFT;
        for (OrderItem item : items) {
            result = result.max(item.status());
        }
        return result;
    }

    public static BigDecimal totalPrice(Collection<OrderItem> items) {
        BigDecimal total = BigDecimal.ZERO;
        for (OrderItem item : items) {
            total = total.add(item.lineTotal());
        }
        return total;
    }
}
