package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.ordering.domain.port.OrderRepository;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Event;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.OrderStatus;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orders as a cashier sees them. An order's status and total cannot be set here; both are
 * derived from the order's items by {@link OrderStatusAggregator}.
 */
@Service
public class OrderService {

    /** Event id stamped on orders taken while no event is active. */
    public static final String DEFAULT_EVENT_ID = "default";

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orders;
    private final OrderItemRepository orderItems;
    private final EntityRepository<Event> events;
    private final SettingsService settings;
    private final ChangeEventBus bus;

    public OrderService(OrderRepository orders, OrderItemRepository orderItems, EntityRepository<Event> events,
                        SettingsService settings, ChangeEventBus bus) {
        this.orders = orders;
        this.orderItems = orderItems;
        this.events = events;
        this.settings = settings;
        this.bus = bus;
    }

    public List<Order> getAll() {
        return orders.getAll();
    }

    public Order get(String id) {
        return orders.get(id);
    }

    public List<OrderItem> items(String orderId) {
        orders.get(orderId);
        return orderItems.findByOrderId(orderId);
    }

    /**
     * Opens an empty draft order with the next sequential number.
     *
     * @param eventId event to file the order under; {@code null} uses the active event, or
     *                {@value #DEFAULT_EVENT_ID} when none is active
     */
    public synchronized Order create(String eventId) {
        String resolvedEventId = eventId;
        if (resolvedEventId != null) {
            events.get(resolvedEventId);
        } else {
            resolvedEventId = settings.get().activeEventId();
            if (resolvedEventId == null) {
                resolvedEventId = DEFAULT_EVENT_ID;
            }
        }

        Order created = orders.create(
                new Order(null, orders.nextSequentialId(), BigDecimal.ZERO, OrderStatus.DRAFT, resolvedEventId));
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created order {} #{} for event {}", created.id(), created.sequentialId(), resolvedEventId);
        return created;
    }

    public void delete(String id) {
        orders.get(id);
        int itemCount = orderItems.findByOrderId(id).size();
        if (itemCount > 0) {
            throw new ValidationException("Order '%s' still has %d items".formatted(id, itemCount));
        }

        orders.delete(id);
        bus.publish(ChangeEnvelope.deleted(EntityType.ORDER, id));
        log.info("Deleted order {}", id);
    }
}
