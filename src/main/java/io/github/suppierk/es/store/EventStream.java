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

import java.util.List;

/**
 * Events previously appended to a stream.
 *
 * @param streamId of the stream
 * @param events in the order they were appended
 * @param revision of the stream at the time it was read, equal to the number of events
 * @param <EVENT> the closed set of events of the aggregate
 */
public record EventStream<EVENT>(String streamId, List<EVENT> events, long revision) {
  public EventStream {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    events = List.copyOf(events);

    if (revision != events.size()) {
      throw new IllegalArgumentException(
          "Revision %d of stream '%s' does not match its %d event(s)"
              .formatted(revision, streamId, events.size()));
    }
  }
}
