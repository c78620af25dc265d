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

import io.github.suppierk.es.cqrs.DomainCommandHandler;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import io.github.suppierk.es.shoppingcart.command.OpenShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartOpened;
import java.util.List;

public final class OpenShoppingCartHandler
    extends DomainCommandHandler.Create<OpenShoppingCart, ShoppingCart, ShoppingCartEvent> {
  public OpenShoppingCartHandler() {
    super(OpenShoppingCart.class);
  }

  @Override
  protected List<ShoppingCartEvent> decideCreation(final OpenShoppingCart command) {
    return List.of(
        new ShoppingCartOpened(command.shoppingCartId(), command.clientId(), command.createdAt()));
  }
}
