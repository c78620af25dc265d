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
import io.github.suppierk.es.shoppingcart.ProductItem;
import io.github.suppierk.es.shoppingcart.ShoppingCart;
import io.github.suppierk.es.shoppingcart.command.RemoveProductItemFromShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ProductItemRemovedFromShoppingCart;
import io.github.suppierk.es.shoppingcart.event.ShoppingCartEvent;
import java.util.List;

/**
 * Only products which are in the shopping cart, in at most the quantity held, can be removed. The
 * removal is recorded at the price the product is held for.
 */
public final class RemoveProductItemHandler
    extends PendingShoppingCartHandler<RemoveProductItemFromShoppingCart> {
  public RemoveProductItemHandler() {
    super(RemoveProductItemFromShoppingCart.class);
  }

  @Override
  protected List<ShoppingCartEvent> decidePending(
      final ShoppingCart shoppingCart, final RemoveProductItemFromShoppingCart command) {
    final ProductItem requested = command.productItem();
    final PricedProductItem held =
        shoppingCart
            .findProductItem(requested.productId())
            .orElseThrow(
                () ->
                    new InvalidOperationException(
                        "Product '%s' is not in shopping cart '%s'"
                            .formatted(requested.productId(), shoppingCart.id())));

    if (held.quantity() < requested.quantity()) {
      throw new InvalidOperationException(
          "Cannot remove %d of product '%s' from shopping cart '%s' which holds %d"
              .formatted(
                  requested.quantity(), requested.productId(), shoppingCart.id(), held.quantity()));
    }

    return List.of(
        new ProductItemRemovedFromShoppingCart(
            shoppingCart.id(), PricedProductItem.of(requested, held.unitPrice())));
  }
}
