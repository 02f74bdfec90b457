package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.BulkStatusRequest;
import com.orderstream.ordering.api.dto.OrderItemRequest;
import com.orderstream.ordering.api.dto.OrderItemUpdateRequest;
import com.orderstream.ordering.domain.service.BulkStatusResult;
import com.orderstream.ordering.domain.service.OrderItemService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.OrderItem;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order lines. Cashiers add, change and remove lines; station staff may only move statuses.
 */
@RestController
@RequestMapping("/api/v1/order-items")
public class OrderItemController {

    private final OrderItemService orderItems;

    public OrderItemController(OrderItemService orderItems) {
        this.orderItems = orderItems;
    }

    @GetMapping
    public List<OrderItem> list() {
        return orderItems.getAll();
    }

    @GetMapping("/{id}")
    public OrderItem get(@PathVariable String id) {
        return orderItems.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrderItem create(@Valid @RequestBody OrderItemRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.CASHIER);
        return orderItems.create(request.orderId(), request.itemId(), request.quantity());
    }

    @PutMapping("/{id}")
    public OrderItem update(@PathVariable String id, @RequestBody OrderItemUpdateRequest request, CallerContext caller) {
        if (request.isStatusOnly()) {
            RoleChecker.requireAnyRole(caller, Role.CASHIER, Role.STAFF);
        } else {
            RoleChecker.requireAnyRole(caller, Role.CASHIER);
        }
        return orderItems.update(id, request.toPatch());
    }

    @PutMapping("/bulk-status")
    public BulkStatusResult bulkStatus(@Valid @RequestBody BulkStatusRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.CASHIER, Role.STAFF);
        return orderItems.bulkUpdateStatus(request.ids(), request.status());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.CASHIER);
        orderItems.delete(id);
    }
}
