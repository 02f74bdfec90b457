package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.ProductRequest;
import com.orderstream.ordering.domain.service.ProductService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.Product;
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
 * Product catalog. Price changes here never touch existing order items, which keep the price
 * captured when they were added.
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private final ProductService products;

    public ProductController(ProductService products) {
        this.products = products;
    }

    @GetMapping
    public List<Product> list() {
        return products.getAll();
    }

    @GetMapping("/{id}")
    public Product get(@PathVariable String id) {
        return products.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Product create(@Valid @RequestBody ProductRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return products.create(request.name(), request.categoryId(), request.price(), request.activeOrDefault());
    }

    @PutMapping("/{id}")
    public Product update(@PathVariable String id, @Valid @RequestBody ProductRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return products.update(id, request.name(), request.categoryId(), request.price(), request.activeOrDefault());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        products.delete(id);
    }
}
