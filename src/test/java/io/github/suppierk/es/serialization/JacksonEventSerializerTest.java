package io.github.suppierk.es.serialization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.error.FatalModelException;
import io.github.suppierk.es.shoppingcart.PricedProductItem;
import io.github.suppierk.es.shoppingcart.event.ProductItemAddedToShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEventType;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartOpened;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class JacksonEventSerializerTest {
  static final UUID SHOPPING_CART_ID = UUID.fromString("5c8f3a52-8d7e-4b7a-9f55-0f1a2b3c4d5e");
  static final UUID CLIENT_ID = UUID.fromString("0b6d1f2e-3c4a-4e5f-8a9b-1c2d3e4f5a6b");

  final JacksonEventSerializer<ShoppingCartEvent> serializer =
      new JacksonEventSerializer<>(ShoppingCartEventType.registry());

  @Test
  void events_are_stored_under_their_type_tag() {
    final var opened =
        new ShoppingCartOpened(
            SHOPPING_CART_ID, CLIENT_ID, Instant.parse("2024-03-01T10:15:30Z"));

    final var serialized = serializer.serialize(opened);

    assertEquals("ShoppingCartOpened", serialized.type());
    assertTrue(serialized.data().contains("\"openedAt\":\"2024-03-01T10:15:30Z\""));
    assertEquals(opened, serializer.deserialize(serialized));
  }

  @Test
  void prices_keep_their_scale() {
    final var added =
        new ProductItemAddedToShoppingCart(
            SHOPPING_CART_ID,
            new PricedProductItem(UUID.randomUUID(), 2, new BigDecimal("19.90")));

    final var restored =
        (ProductItemAddedToShoppingCart) serializer.deserialize(serializer.serialize(added));

    assertEquals(new BigDecimal("19.90"), restored.productItem().unitPrice());
  }

  @Test
  void unknown_payload_fields_are_ignored() {
    final var restored =
        serializer.deserialize(
            new SerializedEvent(
                "ShoppingCartConfirmed",
                "{\"shoppingCartId\":\"%s\",\"confirmedAt\":\"2024-03-01T10:15:30Z\",\"note\":1}"
                    .formatted(SHOPPING_CART_ID)));

    assertEquals(ShoppingCartEventType.SHOPPING_CART_CONFIRMED, restored.type());
  }

  @Test
  void when_type_tag_is_unknown_fatal_model_exception_is_thrown() {
    final var serialized = new SerializedEvent("ShoppingCartAbandoned", "{}");

    final var exception =
        assertThrows(FatalModelException.class, () -> serializer.deserialize(serialized));
    assertEquals(500, exception.getStatusCode());
  }

  @Test
  void when_payload_does_not_match_its_type_fatal_model_exception_is_thrown() {
    final var missingFields = new SerializedEvent("ShoppingCartOpened", "{}");
    final var notJson = new SerializedEvent("ShoppingCartOpened", "not json");

    assertThrows(FatalModelException.class, () -> serializer.deserialize(missingFields));
    assertThrows(FatalModelException.class, () -> serializer.deserialize(notJson));
  }

  @Test
  void when_event_is_not_registered_fatal_model_exception_is_thrown() {
    final Map<String, Class<? extends DomainEvent>> eventTypes =
        Map.of("ShoppingCartOpened", ShoppingCartOpened.class);
    final var partial = new JacksonEventSerializer<>(eventTypes);
    final DomainEvent stranger = () -> "ShoppingCartOpened";

    assertThrows(FatalModelException.class, () -> partial.serialize(stranger));
  }

  @Test
  void when_arguments_are_missing_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new JacksonEventSerializer<>(Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> new JacksonEventSerializer<>(null, ShoppingCartEventType.registry()));
    assertThrows(IllegalArgumentException.class, () -> serializer.serialize(null));
    assertThrows(IllegalArgumentException.class, () -> serializer.deserialize(null));
    assertThrows(IllegalArgumentException.class, () -> new SerializedEvent(" ", "{}"));
  }
}
