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

import io.github.suppierk.es.cqrs.BoundedContext;
import io.github.suppierk.es.serialization.EventSerializer;
import io.github.suppierk.es.serialization.JacksonEventSerializer;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEventType;
import io.github.suppierk.es.shoppingcart.handler.AddProductItemHandler;
import io.github.suppierk.es.shoppingcart.handler.CancelShoppingCartHandler;
import io.github.suppierk.es.shoppingcart.handler.ConfirmShoppingCartHandler;
import io.github.suppierk.es.shoppingcart.handler.OpenShoppingCartHandler;
import io.github.suppierk.es.shoppingcart.handler.RemoveProductItemHandler;
import io.github.suppierk.es.store.EventStore;
import java.util.Optional;
import java.util.UUID;

/** Shopping carts, with all of their commands registered. */
public class ShoppingCartContext extends BoundedContext<ShoppingCart, ShoppingCartEvent> {
  public ShoppingCartContext(final EventStore<ShoppingCartEvent> eventStore) {
    this(eventStore, DEFAULT_MAX_ATTEMPTS);
  }

  public ShoppingCartContext(
      final EventStore<ShoppingCartEvent> eventStore, final int maxAttempts) {
    super(eventStore, new ShoppingCartEvolver(), maxAttempts);

    addDomainCommandHandler(new OpenShoppingCartHandler());
    addDomainCommandHandler(new AddProductItemHandler());
    addDomainCommandHandler(new RemoveProductItemHandler());
    addDomainCommandHandler(new ConfirmShoppingCartHandler());
    addDomainCommandHandler(new CancelShoppingCartHandler());
  }

  /**
   * @return serializer knowing every shopping cart event, for stores which persist them
   */
  public static EventSerializer<ShoppingCartEvent> eventSerializer() {
    return new JacksonEventSerializer<>(ShoppingCartEventType.registry());
  }

  /**
   * @param shoppingCartId of the shopping cart
   * @return current state of the shopping cart, empty if it was never opened
   */
  public Optional<ShoppingCart> getShoppingCart(final UUID shoppingCartId) {
    return load(ShoppingCart.streamId(shoppingCartId)).state();
  }
}
