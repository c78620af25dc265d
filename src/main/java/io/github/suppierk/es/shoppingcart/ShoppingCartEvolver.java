/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.shoppingcart;

import io.github.suppierk.es.cqrs.Evolver;
import io.github.suppierk.es.error.FatalModelException;
import io.github.suppierk.es.shoppingcart.event.ProductItemAddedToShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ProductItemRemovedFromShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartCanceled;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartConfirmed;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartOpened;

/**
 * Folds {@link ShoppingCartEvent}s into a {@link ShoppingCart}.
 *
 * <p>The fold accepts every event of a well-formed stream: removing a product which is not in the
 * shopping cart, or more of it than the cart holds, is not an error here. Those commands are
 * rejected before such events are ever appended.
 */
public final class ShoppingCartEvolver implements Evolver<ShoppingCart, ShoppingCartEvent> {
  @Override
  public ShoppingCart evolve(final ShoppingCart state, final ShoppingCartEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return switch (event.type()) {
      case SHOPPING_CART_OPENED -> {
        final var opened = payload(event, ShoppingCartOpened.class);
        yield ShoppingCart.opened(opened.shoppingCartId(), opened.clientId(), opened.openedAt());
      }
      case PRODUCT_ITEM_ADDED_TO_SHOPPING_CART -> existing(state, event)
          .withProductItemAdded(payload(event, ProductItemAddedToShoppingCart.class).productItem());
      case PRODUCT_ITEM_REMOVED_FROM_SHOPPING_CART -> existing(state, event)
          .withProductItemRemoved(
              payload(event, ProductItemRemovedFromShoppingCart.class)
                  .productItem()
                  .toProductItem());
      case SHOPPING_CART_CONFIRMED -> existing(state, event)
          .confirmed(payload(event, ShoppingCartConfirmed.class).confirmedAt());
      case SHOPPING_CART_CANCELED -> existing(state, event)
          .canceled(payload(event, ShoppingCartCanceled.class).canceledAt());
    };
  }

  private static ShoppingCart existing(final ShoppingCart state, final ShoppingCartEvent event) {
    if (state == null) {
      throw new FatalModelException(
          "'%s' of shopping cart '%s' precedes its opening"
              .formatted(event.eventType(), event.shoppingCartId()));
    }

    return state;
  }

  private static <E extends ShoppingCartEvent> E payload(
      final ShoppingCartEvent event, final Class<E> eventClass) {
    if (!eventClass.isInstance(event)) {
      throw new FatalModelException(
          "Event tagged '%s' is a %s".formatted(event.eventType(), event.getClass().getName()));
    }

    return eventClass.cast(event);
  }
}
