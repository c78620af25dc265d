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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventStore} keeping streams on the heap, for tests and single-process prototypes.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
public final class InMemoryEventStore<EVENT> implements EventStore<EVENT> {
  private final ReentrantReadWriteLock lock;
  private final Map<String, List<EVENT>> streams;

  public InMemoryEventStore() {
    this.lock = new ReentrantReadWriteLock();
    this.streams = new HashMap<>();
  }

  @Override
  public Optional<EventStream<EVENT>> read(final String streamId) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    lock.readLock().lock();
    try {
      final List<EVENT> events = streams.get(streamId);

      if (events == null) {
        return Optional.empty();
      }

      return Optional.of(new EventStream<>(streamId, events, events.size()));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long append(final String streamId, final long expectedRevision, final List<EVENT> events) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    final List<EVENT> newEvents = List.copyOf(events);

    lock.writeLock().lock();
    try {
      final List<EVENT> stored = streams.getOrDefault(streamId, List.of());

      if (stored.size() != expectedRevision) {
        throw ConcurrencyConflictException.revisionMismatch(
            streamId, expectedRevision, stored.size());
      }

      if (newEvents.isEmpty()) {
        return expectedRevision;
      }

      final List<EVENT> appended = new ArrayList<>(stored.size() + newEvents.size());
      appended.addAll(stored);
      appended.addAll(newEvents);
      streams.put(streamId, List.copyOf(appended));

      return appended.size();
    } finally {
      lock.writeLock().unlock();
    }
  }
}
