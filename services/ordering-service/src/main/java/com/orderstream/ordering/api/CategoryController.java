package com.orderstream.ordering.api;

import com.orderstream.ordering.api.dto.CategoryRequest;
import com.orderstream.ordering.domain.service.CategoryService;
import com.orderstream.security.CallerContext;
import com.orderstream.security.Role;
import com.orderstream.security.RoleChecker;
import com.orderstream.syncmodel.Category;
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

@RestController
@RequestMapping("/api/v1/categories")
public class CategoryController {

    private final CategoryService categories;

    public CategoryController(CategoryService categories) {
        this.categories = categories;
    }

    @GetMapping
    public List<Category> list() {
        return categories.getAll();
    }

    @GetMapping("/{id}")
    public Category get(@PathVariable String id) {
        return categories.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Category create(@Valid @RequestBody CategoryRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return categories.create(request.name());
    }

    @PutMapping("/{id}")
    public Category update(@PathVariable String id, @Valid @RequestBody CategoryRequest request, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        return categories.update(id, request.name());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, CallerContext caller) {
        RoleChecker.requireAnyRole(caller, Role.ADMIN);
        categories.delete(id);
    }
}
