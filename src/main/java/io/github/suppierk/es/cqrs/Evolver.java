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

/**
 * Pure fold step of an aggregate: combines the state derived so far with the next event of the
 * stream.
 *
 * <p>Implementations must not perform I/O, must not consult clocks or random sources, and must
 * return new state instead of modifying the given one.
 *
 * @param <STATE> of the aggregate
 * @param <EVENT> the closed set of events of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
@FunctionalInterface
public interface Evolver<STATE, EVENT> {
  /**
   * @param state derived from the preceding events, {@code null} for the first event of a stream
   * @param event to apply
   * @return state after the event
   */
  STATE evolve(final STATE state, final EVENT event);

  /**
   * Replays events in order starting from the uninitialized state.
   *
   * @param events of a single stream in stream order
   * @return state together with the number of events folded, or {@link StreamState#notFound()}
   *     if there were no events at all
   * @throws IllegalArgumentException if events or one of them is {@code null}
   */
  default StreamState<STATE> reconstruct(final Iterable<? extends EVENT> events) {
    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    STATE state = null;
    long revision = 0;

    for (EVENT event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event at position %d is null".formatted(revision + 1));
      }

      state = evolve(state, event);
      revision++;
    }

    return revision == 0 ? StreamState.notFound() : StreamState.of(state, revision);
  }
}
