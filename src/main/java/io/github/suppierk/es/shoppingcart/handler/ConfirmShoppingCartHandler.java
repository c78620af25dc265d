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

import io.github.suppierk.es.error.InvalidOperationException;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import io.github.suppierk.es.shoppingcart.command.ConfirmShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartConfirmed;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import java.util.List;

public final class ConfirmShoppingCartHandler
    extends PendingShoppingCartHandler<ConfirmShoppingCart> {
  public ConfirmShoppingCartHandler() {
    super(ConfirmShoppingCart.class);
  }

  @Override
  protected List<ShoppingCartEvent> decidePending(
      final ShoppingCart shoppingCart, final ConfirmShoppingCart command) {
    if (shoppingCart.productItems().isEmpty()) {
      throw new InvalidOperationException(
          "Shopping cart '%s' is empty and cannot be confirmed".formatted(shoppingCart.id()));
    }

    return List.of(new ShoppingCartConfirmed(shoppingCart.id(), command.createdAt()));
  }
}
