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

import io.github.suppierk.es.shoppingcart.PricedProductItem;
import java.io.Serial;
import java.util.UUID;

/**
 * @param shoppingCartId of the shopping cart
 * @param productItem removed, at the price it was held for
 */
public record ProductItemRemovedFromShoppingCart(UUID shoppingCartId, PricedProductItem productItem)
    implements ShoppingCartEvent {
  @Serial private static final long serialVersionUID = 6653390761268052722L;

  public ProductItemRemovedFromShoppingCart {
    Payloads.required(shoppingCartId, "shoppingCartId");
    Payloads.required(productItem, "productItem");
  }

  @Override
  public ShoppingCartEventType type() {
    return ShoppingCartEventType.PRODUCT_ITEM_REMOVED_FROM_SHOPPING_CART;
  }
}
