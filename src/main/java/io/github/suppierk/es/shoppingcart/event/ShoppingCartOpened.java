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

import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * The shopping cart was opened - always the first event of its stream.
 *
 * @param shoppingCartId of the opened shopping cart
 * @param clientId who opened it
 * @param openedAt when it was opened
 */
public record ShoppingCartOpened(UUID shoppingCartId, UUID clientId, Instant openedAt)
    implements ShoppingCartEvent {
  @Serial private static final long serialVersionUID = 3318470325873941873L;

  public ShoppingCartOpened {
    Payloads.required(shoppingCartId, "shoppingCartId");
    Payloads.required(clientId, "clientId");
    Payloads.required(openedAt, "openedAt");
  }

  @Override
  public ShoppingCartEventType type() {
    return ShoppingCartEventType.SHOPPING_CART_OPENED;
  }
}
