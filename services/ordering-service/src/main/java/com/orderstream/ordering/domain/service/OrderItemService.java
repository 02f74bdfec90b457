package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.ordering.domain.port.OrderRepository;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.OrderStatus;
import com.orderstream.syncmodel.Product;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Mutations on order items, each followed by recomputation of the parent order.
 *
 * <p>Every entry point writes first, recomputes the affected orders, and only then publishes.
 * If any write or recomputation fails the exception propagates and nothing is published; writes
 * that already succeeded are not rolled back.
 */
@Service
public class OrderItemService {

    private static final Logger log = LoggerFactory.getLogger(OrderItemService.class);

    private final OrderItemRepository orderItems;
    private final OrderRepository orders;
    private final EntityRepository<Product> products;
    private final OrderStatusAggregator aggregator;
    private final ChangeEventBus bus;

    public OrderItemService(OrderItemRepository orderItems, OrderRepository orders, EntityRepository<Product> products,
                            OrderStatusAggregator aggregator, ChangeEventBus bus) {
        this.orderItems = orderItems;
        this.orders = orders;
        this.products = products;
        this.aggregator = aggregator;
        this.bus = bus;
    }

    public List<OrderItem> getAll() {
        return orderItems.getAll();
    }

    public OrderItem get(String id) {
        return orderItems.get(id);
    }

    /**
     * Adds a line to an order. The unit price is captured from the product now and never follows
     * later product price changes. The new item starts in the order's current status.
     */
    public OrderItem create(String orderId, String itemId, int quantity) {
        Validation.start().positive("quantity", quantity).throwIfInvalid();
        Order order = orders.get(orderId);
        Product product = orderableProduct(itemId);

        OrderItem created = orderItems.create(
                new OrderItem(null, orderId, itemId, quantity, product.price(), order.status()));
        Order recomputed = aggregator.recompute(orderId);

        bus.publish(ChangeEnvelope.added(created));
        bus.publish(ChangeEnvelope.updated(recomputed));
        log.info("Added item {} ({} x {}) to order {}", created.id(), quantity, itemId, orderId);
        return created;
    }

    /**
     * Applies a partial update to one item and recomputes its order.
     */
    public OrderItem update(String id, OrderItemPatch patch) {
        ItemWrite write = writeItem(id, patch, true);

        bus.publish(ChangeEnvelope.updated(write.item()));
        bus.publish(ChangeEnvelope.updated(write.order()));
        log.info("Updated item {} of order {}", id, write.item().orderId());
        return write.item();
    }

    /**
     * Moves every listed item to {@code status}. Unknown ids are skipped. Items are written without
     * recomputation; each distinct affected order is then recomputed exactly once.
     */
    public BulkStatusResult bulkUpdateStatus(Collection<String> ids, OrderStatus status) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        var patch = OrderItemPatch.status(status);
        List<OrderItem> updated = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> affectedOrders = new LinkedHashSet<>();

        for (String id : ids) {
            if (orderItems.findById(id).isEmpty()) {
                log.warn("Bulk status update skipping unknown item {}", id);
                skipped.add(id);
                continue;
            }
            OrderItem item = writeItem(id, patch, false).item();
            updated.add(item);
            affectedOrders.add(item.orderId());
        }

        List<Order> recomputed = new ArrayList<>(affectedOrders.size());
        for (String orderId : affectedOrders) {
            recomputed.add(aggregator.recompute(orderId));
        }

        updated.forEach(item -> bus.publish(ChangeEnvelope.updated(item)));
        recomputed.forEach(order -> bus.publish(ChangeEnvelope.updated(order)));
        log.info("Bulk status {} applied to {} items across {} orders ({} skipped)",
                status.value(), updated.size(), recomputed.size(), skipped.size());
        return new BulkStatusResult(List.copyOf(updated), List.copyOf(skipped), List.copyOf(recomputed));
    }

    public void delete(String id) {
        OrderItem existing = orderItems.get(id);

        orderItems.delete(id);
        Order recomputed = aggregator.recompute(existing.orderId());

        bus.publish(ChangeEnvelope.deleted(EntityType.ORDER_ITEM, id));
        bus.publish(ChangeEnvelope.updated(recomputed));
        log.info("Removed item {} from order {}", id, existing.orderId());
    }

    /**
     * Single write path for item updates. {@code recompute} is false only for the bulk path,
     * which recomputes once per order after all writes.
     */
    private ItemWrite writeItem(String id, OrderItemPatch patch, boolean recompute) {
        OrderItem existing = orderItems.get(id);
        if (patch.quantity() != null) {
            Validation.start().positive("quantity", patch.quantity()).throwIfInvalid();
        }

        OrderItem next = existing;
        if (patch.itemId() != null && !patch.itemId().equals(existing.itemId())) {
            Product product = orderableProduct(patch.itemId());
            next = new OrderItem(id, next.orderId(), product.id(), next.quantity(), product.price(), next.status());
        }
        if (patch.quantity() != null) {
            next = new OrderItem(id, next.orderId(), next.itemId(), patch.quantity(), next.price(), next.status());
        }
        if (patch.status() != null) {
            next = next.withStatus(patch.status());
        }

        OrderItem written = orderItems.update(next);
        Order order = recompute ? aggregator.recompute(written.orderId()) : null;
        return new ItemWrite(written, order);
    }

    private Product orderableProduct(String productId) {
        Optional<Product> product = products.findById(productId);
        if (product.isEmpty()) {
            throw new ValidationException("item_id '%s' does not reference an existing product".formatted(productId));
        }
        if (!product.get().active()) {
            throw new ValidationException("Product '%s' is not active".formatted(productId));
        }
        return product.get();
    }

    private record ItemWrite(OrderItem item, Order order) {
    }
}
