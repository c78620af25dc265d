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

package io.github.suppierk.es.shoppingcart.event;

import io.github.suppierk.es.error.FatalModelException;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/** Type tags of {@link ShoppingCartEvent}s, as they are persisted. */
public enum ShoppingCartEventType {
  SHOPPING_CART_OPENED("ShoppingCartOpened", ShoppingCartOpened.class),
  PRODUCT_ITEM_ADDED_TO_SHOPPING_CART(
      "ProductItemAddedToShoppingCart", ProductItemAddedToShoppingCart.class),
  PRODUCT_ITEM_REMOVED_FROM_SHOPPING_CART(
      "ProductItemRemovedFromShoppingCart", ProductItemRemovedFromShoppingCart.class),
  SHOPPING_CART_CONFIRMED("ShoppingCartConfirmed", ShoppingCartConfirmed.class),
  SHOPPING_CART_CANCELED("ShoppingCartCanceled", ShoppingCartCanceled.class);

  private static final Map<String, ShoppingCartEventType> BY_TYPE_NAME =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(ShoppingCartEventType::typeName, type -> type));

  private final String typeName;
  private final Class<? extends ShoppingCartEvent> eventClass;

  ShoppingCartEventType(String typeName, Class<? extends ShoppingCartEvent> eventClass) {
    this.typeName = typeName;
    this.eventClass = eventClass;
  }

  public String typeName() {
    return typeName;
  }

  public Class<? extends ShoppingCartEvent> eventClass() {
    return eventClass;
  }

  /**
   * @param typeName as persisted
   * @return matching constant
   * @throws FatalModelException if the tag is not a part of the model
   */
  public static ShoppingCartEventType fromTypeName(String typeName) {
    final ShoppingCartEventType type = typeName == null ? null : BY_TYPE_NAME.get(typeName);

    if (type == null) {
      throw new FatalModelException("Unknown shopping cart event type '%s'".formatted(typeName));
    }

    return type;
  }

  /**
   * @return every tag mapped to its event class, as expected by serializers
   */
  public static Map<String, Class<? extends ShoppingCartEvent>> registry() {
    return Arrays.stream(values())
        .collect(
            Collectors.toUnmodifiableMap(
                ShoppingCartEventType::typeName, ShoppingCartEventType::eventClass));
  }
}
