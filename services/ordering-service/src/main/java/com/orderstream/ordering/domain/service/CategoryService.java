package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Product;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CategoryService {

    static final int MAX_NAME_LENGTH = 100;

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final EntityRepository<Category> categories;
    private final EntityRepository<Product> products;
    private final ChangeEventBus bus;

    public CategoryService(EntityRepository<Category> categories, EntityRepository<Product> products, ChangeEventBus bus) {
        this.categories = categories;
        this.products = products;
        this.bus = bus;
    }

    public List<Category> getAll() {
        return categories.getAll();
    }

    public Category get(String id) {
        return categories.get(id);
    }

    public Category create(String name) {
        Validation.start().name("name", name, MAX_NAME_LENGTH).throwIfInvalid();

        Category created = categories.create(new Category(null, Validation.trimmed(name)));
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created category {} '{}'", created.id(), created.name());
        return created;
    }

    public Category update(String id, String name) {
        categories.get(id);
        Validation.start().name("name", name, MAX_NAME_LENGTH).throwIfInvalid();

        Category updated = categories.update(new Category(id, Validation.trimmed(name)));
        bus.publish(ChangeEnvelope.updated(updated));
        log.info("Updated category {}", id);
        return updated;
    }

    public void delete(String id) {
        categories.get(id);
        long referencing = products.getAll().stream().filter(p -> id.equals(p.categoryId())).count();
        if (referencing > 0) {
            throw new ValidationException("Category '%s' is still used by %d products".formatted(id, referencing));
        }

        categories.delete(id);
        bus.publish(ChangeEnvelope.deleted(EntityType.CATEGORY, id));
        log.info("Deleted category {}", id);
    }
}
