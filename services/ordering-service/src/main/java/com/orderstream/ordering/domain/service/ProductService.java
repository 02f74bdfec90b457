package com.orderstream.ordering.domain.service;

import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Product;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Catalog products. Changing a product's price never touches order items that already exist;
 * they keep the price captured when they were created.
 */
@Service
public class ProductService {

    static final int MAX_NAME_LENGTH = 100;

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final EntityRepository<Product> products;
    private final EntityRepository<Category> categories;
    private final OrderItemRepository orderItems;
    private final ChangeEventBus bus;

    public ProductService(EntityRepository<Product> products, EntityRepository<Category> categories,
                          OrderItemRepository orderItems, ChangeEventBus bus) {
        this.products = products;
        this.categories = categories;
        this.orderItems = orderItems;
        this.bus = bus;
    }

    public List<Product> getAll() {
        return products.getAll();
    }

    public Product get(String id) {
        return products.get(id);
    }

    public Product create(String name, String categoryId, BigDecimal price, boolean active) {
        validate(name, categoryId, price);

        Product created = products.create(new Product(null, Validation.trimmed(name), categoryId, price, active));
        bus.publish(ChangeEnvelope.added(created));
        log.info("Created product {} '{}' at {}", created.id(), created.name(), created.price());
        return created;
    }

    public Product update(String id, String name, String categoryId, BigDecimal price, boolean active) {
        products.get(id);
        validate(name, categoryId, price);

        Product updated = products.update(new Product(id, Validation.trimmed(name), categoryId, price, active));
        bus.publish(ChangeEnvelope.updated(updated));
        log.info("Updated product {}", id);
        return updated;
    }

    public void delete(String id) {
        products.get(id);
        if (orderItems.existsByItemId(id)) {
            throw new ValidationException("Product '%s' is referenced by order items".formatted(id));
        }

        products.delete(id);
        bus.publish(ChangeEnvelope.deleted(EntityType.PRODUCT, id));
        log.info("Deleted product {}", id);
    }

    private void validate(String name, String categoryId, BigDecimal price) {
        Validation.start()
                .name("name", name, MAX_NAME_LENGTH)
                .nonNegative("price", price)
                .require(categoryId != null && categories.findById(categoryId).isPresent(),
                        "category_id '%s' does not reference an existing category".formatted(categoryId))
                .throwIfInvalid();
    }
}
