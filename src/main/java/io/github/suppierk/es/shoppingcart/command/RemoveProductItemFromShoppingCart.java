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
import io.github.suppierk.es.shoppingcart.ProductItem;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Takes some quantity of a product out of a pending shopping cart.
 *
 * <p>The price is not a part of the command: the product leaves the shopping cart at the price it
 * was added for.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param shoppingCartId of the shopping cart
 * @param productItem to remove
 */
public record RemoveProductItemFromShoppingCart(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    UUID shoppingCartId,
    ProductItem productItem)
    implements DomainCommand.Update<UUID> {
  @Serial private static final long serialVersionUID = 4402719573315650861L;

  public RemoveProductItemFromShoppingCart {
    if (messageId == null || createdAt == null || shoppingCartId == null) {
      throw new IllegalArgumentException(
          "Message ID, creation time and shopping cart ID are required");
    }

    if (productItem == null) {
      throw new IllegalArgumentException("Product item is required");
    }
  }

  public RemoveProductItemFromShoppingCart(UUID shoppingCartId, ProductItem productItem) {
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
