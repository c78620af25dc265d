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

package io.github.suppierk.es.shoppingcart.command;

import io.github.suppierk.es.authorization.AnonymousDomainClient;
import io.github.suppierk.es.authorization.DomainClient;
import io.github.suppierk.es.cqrs.DomainCommand;
import io.github.suppierk.es.shoppingcart.PricedProductItem;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Adds a product to a pending shopping cart at the price it was resolved to by the caller.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param shoppingCartId of the shopping cart
 * @param productItem to add
 */
public record AddProductItemToShoppingCart(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    UUID shoppingCartId,
    PricedProductItem productItem)
    implements DomainCommand.Update<UUID> {
  @Serial private static final long serialVersionUID = -2587045313346452830L;

  public AddProductItemToShoppingCart {
    if (messageId == null || createdAt == null || shoppingCartId == null) {
      throw new IllegalArgumentException(
          "Message ID, creation time and shopping cart ID are required");
    }

    if (productItem == null) {
      throw new IllegalArgumentException("Product item is required");
    }
  }

  public AddProductItemToShoppingCart(UUID shoppingCartId, PricedProductItem productItem) {
    this(
        UUID.randomUUID(),
        Instant.now(),
        AnonymousDomainClient.getInstance(),
        shoppingCartId,
        productItem);
  }

  @Override
  public String streamId() {
    return ShoppingCart.streamId(shoppingCartId);
  }
}
