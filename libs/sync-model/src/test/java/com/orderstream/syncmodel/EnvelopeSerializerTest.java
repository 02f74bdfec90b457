package com.orderstream.syncmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EnvelopeSerializer")
class EnvelopeSerializerTest {

    private static final Product BURGER = new Product("p-1", "Burger", "c-1", new BigDecimal("10.00"), true);

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("writes entity_type, operation and the full payload for Add")
        void writesAddEnvelope() {
            var json = EnvelopeSerializer.serialize(ChangeEnvelope.added(BURGER));

            assertThat(json)
                    .contains("\"entity_type\":\"Product\"")
                    .contains("\"operation\":\"Add\"")
                    .contains("\"category_id\":\"c-1\"")
                    .contains("\"price\":10.00");
        }

        @Test
        @DisplayName("writes the bare id as payload for Delete")
        void writesDeleteEnvelope() {
            var json = EnvelopeSerializer.serialize(ChangeEnvelope.deleted(EntityType.ORDER_ITEM, "oi-9"));

            assertThat(json).isEqualTo("{\"entity_type\":\"OrderItem\",\"operation\":\"Delete\",\"payload\":\"oi-9\"}");
        }

        @Test
        @DisplayName("writes statuses using their wire values")
        void writesStatusValues() {
            var station = new Station("s-1", "Grill", List.of("c-1"), List.of(OrderStatus.ORDERED), OrderStatus.READY);

            var json = EnvelopeSerializer.serialize(ChangeEnvelope.updated(station));

            assertThat(json)
                    .contains("\"input_statuses\":[\"Ordered\"]")
                    .contains("\"output_status\":\"Ready\"");
        }
    }

    @Nested
    @DisplayName("deserialize()")
    class Deserialize {

        @Test
        @DisplayName("resolves the payload class from entity_type")
        void resolvesPayloadType() {
            var json = "{\"entity_type\":\"OrderItem\",\"operation\":\"Update\",\"payload\":"
                    + "{\"id\":\"oi-1\",\"order_id\":\"o-1\",\"item_id\":\"p-1\",\"quantity\":2,"
                    + "\"price\":4.50,\"status\":\"Ready\"}}";

            var envelope = EnvelopeSerializer.deserialize(json);

            assertThat(envelope.entityType()).isEqualTo(EntityType.ORDER_ITEM);
            assertThat(envelope.operation()).isEqualTo(Operation.UPDATE);
            assertThat(envelope.entityId()).isEqualTo("oi-1");
            assertThat(envelope.payload()).isInstanceOf(OrderItem.class);
            var item = (OrderItem) envelope.payload();
            assertThat(item.status()).isEqualTo(OrderStatus.READY);
            assertThat(item.lineTotal()).isEqualByComparingTo("9.00");
        }

        @Test
        @DisplayName("reads a Delete envelope's id from the payload string")
        void readsDelete() {
            var envelope = EnvelopeSerializer.deserialize(
                    "{\"entity_type\":\"Category\",\"operation\":\"Delete\",\"payload\":\"c-7\"}");

            assertThat(envelope.isDelete()).isTrue();
            assertThat(envelope.entityId()).isEqualTo("c-7");
            assertThat(envelope.payload()).isNull();
        }

        @Test
        @DisplayName("typed variant returns the envelope for a matching type")
        void typedVariant() {
            var json = EnvelopeSerializer.serialize(ChangeEnvelope.added(BURGER));

            ChangeEnvelope<Product> envelope = EnvelopeSerializer.deserialize(json, Product.class);

            assertThat(envelope.payload()).isEqualTo(BURGER);
        }

        @Test
        @DisplayName("typed variant rejects a different entity type")
        void typedVariantRejectsMismatch() {
            var json = EnvelopeSerializer.serialize(ChangeEnvelope.added(BURGER));

            assertThatThrownBy(() -> EnvelopeSerializer.deserialize(json, Category.class))
                    .isInstanceOf(EnvelopeSerializer.EnvelopeSerializationException.class)
                    .hasMessageContaining("Category");
        }

        @Test
        @DisplayName("rejects unknown entity types")
        void rejectsUnknownType() {
            assertThatThrownBy(() -> EnvelopeSerializer.deserialize(
                    "{\"entity_type\":\"Invoice\",\"operation\":\"Add\",\"payload\":{}}"))
                    .isInstanceOf(EnvelopeSerializer.EnvelopeSerializationException.class)
                    .hasMessageContaining("entity_type");
        }

        @Test
        @DisplayName("rejects a Delete whose payload is not an id")
        void rejectsObjectDeletePayload() {
            assertThatThrownBy(() -> EnvelopeSerializer.deserialize(
                    "{\"entity_type\":\"Category\",\"operation\":\"Delete\",\"payload\":{\"id\":\"c-1\"}}"))
                    .isInstanceOf(EnvelopeSerializer.EnvelopeSerializationException.class);
        }

        @Test
        @DisplayName("tryDeserialize returns empty for malformed JSON")
        void tryDeserializeMalformed() {
            assertThat(EnvelopeSerializer.tryDeserialize("not json")).isEmpty();
            assertThat(EnvelopeSerializer.tryDeserialize("[]")).isEmpty();
        }
    }
}
