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

package io.github.suppierk.es.shoppingcart.handler;

import io.github.suppierk.es.cqrs.DomainCommand;
import io.github.suppierk.es.cqrs.DomainCommandHandler;
import io.github.suppierk.es.error.InvalidStateTransitionException;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import io.github.suppierk.es.shoppingcart.ShoppingCartStatus;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import java.util.List;

/**
 * Base for commands which are only allowed while the shopping cart is {@link
 * ShoppingCartStatus#PENDING}.
 *
 * @param <UPDATE> the type of the particular command
 */
@SuppressWarnings("squid:S119")
public abstract class PendingShoppingCartHandler<UPDATE extends DomainCommand.Update<?>>
    extends DomainCommandHandler.Update<UPDATE, ShoppingCart, ShoppingCartEvent> {
  protected PendingShoppingCartHandler(final Class<UPDATE> commandClass) {
    super(commandClass);
  }

  /**
   * @param shoppingCart which is known to be pending
   * @param command to decide on
   * @return new events
   */
  protected abstract List<ShoppingCartEvent> decidePending(
      final ShoppingCart shoppingCart, final UPDATE command);

  @Override
  protected final List<ShoppingCartEvent> decideUpdate(
      final ShoppingCart shoppingCart, final UPDATE command) {
    if (shoppingCart.status() != ShoppingCartStatus.PENDING) {
      throw new InvalidStateTransitionException(
          "'%s' is not allowed for shopping cart '%s' which is %s"
              .formatted(
                  getCommandClass().getSimpleName(), shoppingCart.id(), shoppingCart.status()));
    }

    return decidePending(shoppingCart, command);
  }
}
