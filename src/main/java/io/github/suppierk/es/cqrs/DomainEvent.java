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

import java.io.Serializable;

/**
 * An immutable fact which happened to an aggregate.
 *
 * <p>Events are never changed or removed once appended; their identity is the stream they belong
 * to and their position in it. Every aggregate defines its own closed set of events, each
 * distinguished by a type tag.
 */
public interface DomainEvent extends Serializable {
  /**
   * @return the type tag of this event, stable across releases as it is what gets persisted
   */
  String eventType();
}
