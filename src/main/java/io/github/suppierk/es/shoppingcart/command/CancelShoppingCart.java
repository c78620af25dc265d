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
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Cancels a pending shopping cart.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued, becomes the cancellation time
 * @param domainClient issuing the command
 * @param shoppingCartId of the shopping cart
 */
public record CancelShoppingCart(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    UUID shoppingCartId)
    implements DomainCommand.Update<UUID> {
  @Serial private static final long serialVersionUID = 1873324091604577122L;

  public CancelShoppingCart {
    if (messageId == null || createdAt == null || shoppingCartId == null) {
      throw new IllegalArgumentException(
          "Message ID, creation time and shopping cart ID are required");
    }
  }

  public CancelShoppingCart(UUID shoppingCartId) {
    this(UUID.randomUUID(), Instant.now(), AnonymousDomainClient.getInstance(), shoppingCartId);
  }

  @Override
  public String streamId() {
    return ShoppingCart.streamId(shoppingCartId);
  }
}
