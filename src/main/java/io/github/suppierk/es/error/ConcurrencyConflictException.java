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

package io.github.suppierk.es.error;

import java.io.Serial;

/**
 * Thrown when the revision a decision was based on is no longer the current revision of the
 * stream.
 *
 * <p>This is the only rejection which may be resolved by trying again: the caller is expected to
 * read the stream anew, repeat the decision and append with the fresh revision.
 */
public class ConcurrencyConflictException extends DomainException {
  @Serial private static final long serialVersionUID = 8577164521340226655L;

  /**
   * Constructs a new exception with {@code null} as its detail message.
   *
   * <p>The cause is not initialized, and may subsequently be initialized by a call to {@link
   * #initCause}.
   */
  public ConcurrencyConflictException() {
    super();
  }

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public ConcurrencyConflictException(String message) {
    super(message);
  }

  /**
   * Constructs a new exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public ConcurrencyConflictException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructs a new exception with the specified cause.
   *
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public ConcurrencyConflictException(Throwable cause) {
    super(cause);
  }

  /**
   * @param streamId which was written to
   * @param expectedRevision the writer based its decision on
   * @param actualRevision of the stream at the time of the append
   * @return a new exception describing the mismatch
   */
  public static ConcurrencyConflictException revisionMismatch(
      String streamId, long expectedRevision, long actualRevision) {
    return new ConcurrencyConflictException(
        "Stream '%s' was expected at revision %d, but is at revision %d"
            .formatted(streamId, expectedRevision, actualRevision));
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/412">412 Precondition Failed</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public final int getStatusCode() {
    return 412;
  }
}
