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
import io.github.suppierk.es.shoppingcart.PricedProductItem;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import io.github.suppierk.es.shoppingcart.command.AddProductItemToShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ProductItemAddedToShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import java.util.List;

/**
 * Adds products at the price given by the command. The quantity held after the merge has to fit an
 * {@code int}.
 */
public final class AddProductItemHandler
    extends PendingShoppingCartHandler<AddProductItemToShoppingCart> {
  public AddProductItemHandler() {
    super(AddProductItemToShoppingCart.class);
  }

  @Override
  protected List<ShoppingCartEvent> decidePending(
      final ShoppingCart shoppingCart, final AddProductItemToShoppingCart command) {
    final PricedProductItem added = command.productItem();
    final int held =
        shoppingCart.findProductItem(added.productId()).map(PricedProductItem::quantity).orElse(0);

    if ((long) held + added.quantity() > Integer.MAX_VALUE) {
      throw new InvalidOperationException(
          "Cannot add %d of product '%s' to shopping cart '%s' which holds %d"
              .formatted(added.quantity(), added.productId(), shoppingCart.id(), held));
    }

    return List.of(new ProductItemAddedToShoppingCart(shoppingCart.id(), added));
  }
}
