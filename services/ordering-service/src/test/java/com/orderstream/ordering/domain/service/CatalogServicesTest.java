package com.orderstream.ordering.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.orderstream.ordering.domain.NotFoundException;
import com.orderstream.ordering.domain.ValidationException;
import com.orderstream.ordering.domain.bus.Subscription;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Event;
import com.orderstream.syncmodel.Operation;
import com.orderstream.syncmodel.OrderStatus;
import com.orderstream.syncmodel.Product;
import com.orderstream.syncmodel.Settings;
import com.orderstream.syncmodel.Station;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Catalog services")
class CatalogServicesTest {

    private OrderingFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new OrderingFixture();
    }

    @Nested
    @DisplayName("CategoryService")
    class Categories {

        @Test
        @DisplayName("trims the name and publishes Add")
        void createTrimsAndPublishes() throws Exception {
            Subscription subscription = fixture.bus.subscribe(EntityType.CATEGORY);

            Category created = fixture.categories.create("  Drinks ");

            assertThat(created.name()).isEqualTo("Drinks");
            List<ChangeEnvelope<?>> received = OrderingFixture.drain(subscription);
            assertThat(received).singleElement()
                    .satisfies(env -> assertThat(env.operation()).isEqualTo(Operation.ADD))
                    .satisfies(env -> assertThat(env.payload()).isEqualTo(created));
        }

        @Test
        @DisplayName("rejects blank and overlong names without publishing")
        void rejectsBadNames() throws Exception {
            Subscription subscription = fixture.bus.subscribe(EntityType.CATEGORY);

            assertThatThrownBy(() -> fixture.categories.create("   "))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("name must not be empty");
            assertThatThrownBy(() -> fixture.categories.create("x".repeat(CategoryService.MAX_NAME_LENGTH + 1)))
                    .isInstanceOf(ValidationException.class);

            assertThat(OrderingFixture.drain(subscription)).isEmpty();
        }

        @Test
        @DisplayName("cannot delete a category that still has products")
        void deleteBlockedByProducts() {
            Category mains = fixture.category("Mains");
            fixture.product("Burger", mains, "10.00");

            assertThatThrownBy(() -> fixture.categories.delete(mains.id()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("still used by 1 products");
        }

        @Test
        @DisplayName("delete publishes the id only")
        void deletePublishesId() throws Exception {
            Category drinks = fixture.category("Drinks");
            Subscription subscription = fixture.bus.subscribe(EntityType.CATEGORY);

            fixture.categories.delete(drinks.id());

            assertThat(OrderingFixture.drain(subscription)).singleElement()
                    .satisfies(env -> assertThat(env.isDelete()).isTrue())
                    .satisfies(env -> assertThat(env.entityId()).isEqualTo(drinks.id()));
            assertThatThrownBy(() -> fixture.categories.get(drinks.id())).isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("ProductService")
    class Products {

        @Test
        @DisplayName("collects every violation at once")
        void collectsAllErrors() {
            assertThatThrownBy(() -> fixture.products.create("", "missing", new BigDecimal("-1"), true))
                    .isInstanceOfSatisfying(ValidationException.class,
                            ex -> assertThat(ex.errors()).hasSize(3));
        }

        @Test
        @DisplayName("cannot delete a product that has been ordered")
        void deleteBlockedByOrderItems() {
            Product burger = fixture.product("Burger", fixture.category("Mains"), "10.00");
            var order = fixture.orders.create(null);
            fixture.orderItems.create(order.id(), burger.id(), 1);

            assertThatThrownBy(() -> fixture.products.delete(burger.id()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("zero price is allowed")
        void zeroPrice() {
            Product water = fixture.product("Tap water", fixture.category("Drinks"), "0.00");

            assertThat(water.price()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("StationService")
    class Stations {

        @Test
        @DisplayName("requires an output status and existing categories")
        void validates() {
            assertThatThrownBy(() -> fixture.stations.create("Grill", List.of("nope"), List.of(OrderStatus.ORDERED), null))
                    .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.errors())
                            .containsExactly("output_status is required",
                                    "category_ids entry 'nope' does not reference an existing category"));
        }

        @Test
        @DisplayName("creates a station over existing categories")
        void creates() {
            Category mains = fixture.category("Mains");

            Station grill = fixture.stations.create("Grill", List.of(mains.id()), List.of(OrderStatus.ORDERED),
                    OrderStatus.READY);

            assertThat(fixture.stations.getAll()).containsExactly(grill);
            assertThat(grill.accepts(mains.id(), OrderStatus.ORDERED)).isTrue();
        }
    }

    @Nested
    @DisplayName("SettingsService and EventService")
    class SettingsAndEvents {

        @Test
        @DisplayName("settings are created on first read and published once")
        void lazySettings() throws Exception {
            Subscription subscription = fixture.bus.subscribe(EntityType.SETTINGS);

            Settings first = fixture.settings.get();
            Settings second = fixture.settings.get();

            assertThat(first.id()).isEqualTo(Settings.GLOBAL_ID);
            assertThat(second).isEqualTo(first);
            assertThat(OrderingFixture.drain(subscription)).hasSize(1);
        }

        @Test
        @DisplayName("active event must exist and cannot be deleted while active")
        void activeEvent() {
            Event festival = fixture.events.create("Summer fair");

            assertThatThrownBy(() -> fixture.settings.setActiveEvent("unknown"))
                    .isInstanceOf(NotFoundException.class);

            assertThat(fixture.settings.setActiveEvent(festival.id()).activeEventId()).isEqualTo(festival.id());
            assertThatThrownBy(() -> fixture.events.delete(festival.id()))
                    .isInstanceOf(ValidationException.class);

            fixture.settings.setActiveEvent(null);
            fixture.events.delete(festival.id());
            assertThat(fixture.events.getAll()).isEmpty();
        }
    }
}
