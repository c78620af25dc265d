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

import java.io.Serial;
import java.io.Serializable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Some quantity of a product at a fixed unit price.
 *
 * @param productId of the product
 * @param quantity strictly positive
 * @param unitPrice non-negative
 */
public record PricedProductItem(UUID productId, int quantity, BigDecimal unitPrice)
    implements Serializable {
  @Serial private static final long serialVersionUID = -8093355329104779541L;

  public PricedProductItem {
    if (productId == null) {
      throw new IllegalArgumentException("Product ID cannot be null");
    }

    if (quantity <= 0) {
      throw new IllegalArgumentException("Quantity must be positive, got %d".formatted(quantity));
    }

    if (unitPrice == null || unitPrice.signum() < 0) {
      throw new IllegalArgumentException(
          "Unit price must be non-negative, got %s".formatted(unitPrice));
    }
  }

  /**
   * @param productItem quantity of the product
   * @param unitPrice non-negative
   * @return a new instance
   */
  public static PricedProductItem of(ProductItem productItem, BigDecimal unitPrice) {
    return new PricedProductItem(productItem.productId(), productItem.quantity(), unitPrice);
  }

  /**
   * @param newQuantity strictly positive
   * @return the same product at the same price in a different quantity
   */
  public PricedProductItem withQuantity(int newQuantity) {
    return new PricedProductItem(productId, newQuantity, unitPrice);
  }

  public ProductItem toProductItem() {
    return new ProductItem(productId, quantity);
  }
}
