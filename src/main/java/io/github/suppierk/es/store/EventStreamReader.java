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

package io.github.suppierk.es.store;

import java.util.Optional;

/**
 * Read side of an event store.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
@FunctionalInterface
public interface EventStreamReader<EVENT> {
  /**
   * @param streamId to read
   * @return all events of the stream in order, or {@link Optional#empty()} if the stream has none
   */
  Optional<EventStream<EVENT>> read(final String streamId);
}
