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

package io.github.suppierk.es.cqrs;

import java.util.List;

/**
 * Internal sealed utility for verifying inputs coming from users of the engine.
 *
 * <p>Handlers and contexts are extended by users, so anything they return is treated with the
 * same suspicion as method arguments: {@code null}s are rejected at the boundary instead of
 * surfacing later as corrupt state.
 */
abstract sealed class Suspicious permits BoundedContext, DomainCommandHandler {
  /**
   * Use for properties of arguments and for values returned by user-defined code.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the value name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Use for method arguments only, see {@link #throwIllegalStateIfNull(Object, String)} for their
   * properties.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Use when a service cannot be provided because the resource to provide it is missing.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the resource name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatMustNotBeNull)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Same as {@link #throwIllegalStateIfNull(Object, String)}, applied to the list and each of its
   * elements.
   *
   * @param values which must not be or contain {@code null}
   * @param whatMustNotBeNull is the name of the list
   * @param <T> is the type of the elements
   * @return an unmodifiable copy of the values
   * @throws IllegalStateException when the list or one of its elements is {@code null}
   */
  protected final <T> List<T> throwIllegalStateIfAnyNull(
      List<T> values, String whatMustNotBeNull) throws IllegalStateException {
    throwIllegalStateIfNull(values, whatMustNotBeNull);

    for (int i = 0; i < values.size(); i++) {
      throwIllegalStateIfNull(values.get(i), "%s element #%d".formatted(whatMustNotBeNull, i));
    }

    return List.copyOf(values);
  }
}
