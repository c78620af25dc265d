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
import java.util.UUID;

/**
 * Some quantity of a product, without a price.
 *
 * @param productId of the product
 * @param quantity strictly positive
 */
public record ProductItem(UUID productId, int quantity) implements Serializable {
  @Serial private static final long serialVersionUID = 1940281650342919147L;

  public ProductItem {
    if (productId == null) {
      throw new IllegalArgumentException("Product ID cannot be null");
    }

    if (quantity <= 0) {
      throw new IllegalArgumentException("Quantity must be positive, got %d".formatted(quantity));
    }
  }
}
