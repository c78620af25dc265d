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

import io.github.suppierk.es.cqrs.DomainEvent;
import java.util.UUID;

/**
 * Closed set of facts about a shopping cart.
 *
 * <p>Adding a fact means adding a record here and a constant to {@link ShoppingCartEventType}; the
 * compiler then points at every {@code switch} which has to handle it.
 */
public sealed interface ShoppingCartEvent extends DomainEvent
    permits ShoppingCartOpened,
        ProductItemAddedToShoppingCart,
        ProductItemRemovedFromShoppingCart,
        ShoppingCartConfirmed,
        ShoppingCartCanceled {

  UUID shoppingCartId();

  ShoppingCartEventType type();

  @Override
  default String eventType() {
    return type().typeName();
  }
}
