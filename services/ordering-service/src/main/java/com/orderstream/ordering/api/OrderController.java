package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.OrderRequest;
import com.orderstream.ordering.domain.service.OrderService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Orders. There is no update endpoint: status and total are owned by the aggregator and change
 * only when the order's items change.
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    private final OrderService orders;

    public OrderController(OrderService orders) {
        this.orders = orders;
    }

    @GetMapping
    public List<Order> list() {
        return orders.getAll();
    }

    @GetMapping("/{id}")
    public Order get(@PathVariable String id) {
        return orders.get(id);
    }

    @GetMapping("/{id}/items")
    public List<OrderItem> items(@PathVariable String id) {
        return orders.items(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Order create(@RequestBody(required = false) OrderRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.CASHIER);
        return orders.create(request == null ? null : request.eventId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.CASHIER);
        orders.delete(id);
    }
}
