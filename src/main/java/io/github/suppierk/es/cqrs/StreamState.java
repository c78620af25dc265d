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

import java.util.Objects;
import java.util.Optional;

/**
 * Result of replaying a stream: the aggregate state and the revision it is valid at.
 *
 * <p>A stream without events has no state at all - it is never represented by a state with
 * made-up identity, so callers can tell 'does not exist' apart from an empty aggregate.
 *
 * @param <STATE> of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public final class StreamState<STATE> {
  private final STATE state;
  private final long revision;

  private StreamState(final STATE state, final long revision) {
    this.state = state;
    this.revision = revision;
  }

  /**
   * @return state of a stream which has no events
   */
  public static <STATE> StreamState<STATE> notFound() {
    return new StreamState<>(null, 0);
  }

  /**
   * @param state derived from the stream
   * @param revision number of events the state was derived from
   * @return a new instance
   * @throws IllegalArgumentException if state is {@code null} or revision is not positive
   */
  public static <STATE> StreamState<STATE> of(final STATE state, final long revision) {
    if (state == null) {
      throw new IllegalArgumentException("State cannot be null");
    }

    if (revision <= 0) {
      throw new IllegalArgumentException(
          "Revision of an existing stream must be positive, got %d".formatted(revision));
    }

    return new StreamState<>(state, revision);
  }

  public boolean exists() {
    return state != null;
  }

  public Optional<STATE> state() {
    return Optional.ofNullable(state);
  }

  /**
   * @return number of events folded, {@code 0} when the stream does not exist
   */
  public long revision() {
    return revision;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StreamState<?> that = (StreamState<?>) o;
    return revision == that.revision && Objects.equals(state, that.state);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, revision);
  }

  @Override
  public String toString() {
    return exists() ? "StreamState[" + state + " @ " + revision + "]" : "StreamState[not found]";
  }
}
