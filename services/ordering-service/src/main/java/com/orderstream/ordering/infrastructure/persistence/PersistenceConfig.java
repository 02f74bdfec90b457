package com.orderstream.ordering.infrastructure.persistence;

import com.orderstream.ordering.domain.port.EntityRepository;
import com.orderstream.ordering.domain.port.OrderItemRepository;
import com.orderstream.ordering.domain.port.OrderRepository;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Event;
import com.orderstream.syncmodel.Product;
import com.orderstream.syncmodel.Settings;
import com.orderstream.syncmodel.Station;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory adapters behind the persistence ports. A durable store replaces this
 * configuration without touching the domain.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public EntityRepository<Category> categoryRepository() {
        return new InMemoryEntityRepository<>(EntityType.CATEGORY, Category::withId);
    }

    @Bean
    public EntityRepository<Product> productRepository() {
        return new InMemoryEntityRepository<>(EntityType.PRODUCT, Product::withId);
    }

    @Bean
    public EntityRepository<Station> stationRepository() {
        return new InMemoryEntityRepository<>(EntityType.STATION, Station::withId);
    }

    @Bean
    public EntityRepository<Event> eventRepository() {
        return new InMemoryEntityRepository<>(EntityType.EVENT, Event::withId);
    }

    @Bean
    public EntityRepository<Settings> settingsRepository() {
        return new InMemoryEntityRepository<>(EntityType.SETTINGS, (settings, id) -> settings);
    }

    @Bean
    public OrderRepository orderRepository() {
        return new InMemoryOrderRepository();
    }

    @Bean
    public OrderItemRepository orderItemRepository() {
        return new InMemoryOrderItemRepository();
    }
}
