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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * State of a shopping cart as derived from its events.
 *
 * <p>Product items are unique by product and keep the order in which products were first added.
 * Every transition returns a new instance.
 *
 * @param id of the shopping cart
 * @param clientId who opened the shopping cart
 * @param status current status
 * @param productItems currently held, every quantity is positive
 * @param openedAt when the shopping cart was opened
 * @param confirmedAt when the shopping cart was confirmed, {@code null} if it was not
 * @param canceledAt when the shopping cart was canceled, {@code null} if it was not
 */
public record ShoppingCart(
    UUID id,
    UUID clientId,
    ShoppingCartStatus status,
    List<PricedProductItem> productItems,
    Instant openedAt,
    Instant confirmedAt,
    Instant canceledAt) {
  private static final String STREAM_PREFIX = "shopping_cart-";

  public ShoppingCart {
    if (id == null
        || clientId == null
        || status == null
        || productItems == null
        || openedAt == null) {
      throw new IllegalArgumentException(
          "ID, client ID, status, product items and opening time of a shopping cart are required");
    }

    productItems = List.copyOf(productItems);
  }

  /**
   * @param shoppingCartId of the shopping cart
   * @return ID of the event stream of the shopping cart
   */
  public static String streamId(UUID shoppingCartId) {
    if (shoppingCartId == null) {
      throw new IllegalArgumentException("Shopping cart ID cannot be null");
    }

    return STREAM_PREFIX + shoppingCartId;
  }

  /**
   * @return a new pending shopping cart without products
   */
  public static ShoppingCart opened(UUID id, UUID clientId, Instant openedAt) {
    return new ShoppingCart(
        id, clientId, ShoppingCartStatus.PENDING, List.of(), openedAt, null, null);
  }

  public Optional<PricedProductItem> findProductItem(UUID productId) {
    return productItems.stream().filter(item -> item.productId().equals(productId)).findFirst();
  }

  /**
   * Merges the product into the shopping cart. For a product which is already present quantities
   * are summed and the price it was first added at is kept.
   *
   * @param productItem to add
   * @return shopping cart with the product added
   */
  public ShoppingCart withProductItemAdded(PricedProductItem productItem) {
    final List<PricedProductItem> items = new ArrayList<>(productItems);
    final int index = indexOf(productItem.productId());

    if (index < 0) {
      items.add(productItem);
    } else {
      final PricedProductItem existing = items.get(index);
      items.set(
          index, existing.withQuantity(Math.addExact(existing.quantity(), productItem.quantity())));
    }

    return withProductItems(items);
  }

  /**
   * Subtracts the product from the shopping cart, dropping it when nothing is left. Removing a
   * product which is not present changes nothing.
   *
   * @param productItem to remove
   * @return shopping cart with the product removed
   */
  public ShoppingCart withProductItemRemoved(ProductItem productItem) {
    final int index = indexOf(productItem.productId());

    if (index < 0) {
      return this;
    }

    final List<PricedProductItem> items = new ArrayList<>(productItems);
    final PricedProductItem existing = items.get(index);
    final int remaining = existing.quantity() - productItem.quantity();

    if (remaining <= 0) {
      items.remove(index);
    } else {
      items.set(index, existing.withQuantity(remaining));
    }

    return withProductItems(items);
  }

  public ShoppingCart confirmed(Instant at) {
    return new ShoppingCart(
        id, clientId, ShoppingCartStatus.CONFIRMED, productItems, openedAt, at, canceledAt);
  }

  public ShoppingCart canceled(Instant at) {
    return new ShoppingCart(
        id, clientId, ShoppingCartStatus.CANCELED, productItems, openedAt, confirmedAt, at);
  }

  private ShoppingCart withProductItems(List<PricedProductItem> items) {
    return new ShoppingCart(id, clientId, status, items, openedAt, confirmedAt, canceledAt);
  }

  private int indexOf(UUID productId) {
    for (int i = 0; i < productItems.size(); i++) {
      if (productItems.get(i).productId().equals(productId)) {
        return i;
      }
    }

    return -1;
  }
}
