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

import io.github.suppierk.es.error.ConcurrencyConflictException;
import java.util.List;

/**
 * Write side of an event store.
 *
 * <p>Implementations must compare and append atomically: of any number of writers expecting the
 * same revision, exactly one succeeds.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
@FunctionalInterface
public interface EventStreamWriter<EVENT> {
  /**
   * Appends events to the end of a stream, creating the stream when it has no events yet.
   *
   * @param streamId to append to
   * @param expectedRevision the stream must be at, {@code 0} for a stream which must not exist
   * @param events to append, in order
   * @return revision of the stream after the append
   * @throws ConcurrencyConflictException if the stream is not at the expected revision
   */
  long append(final String streamId, final long expectedRevision, final List<EVENT> events);
}
