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

import io.github.suppierk.es.authorization.AnonymousDomainClient;
import io.github.suppierk.es.authorization.DomainClient;
import java.io.Serializable;
import java.time.Instant;

/**
 * Envelope of everything a client sends to a {@link BoundedContext}: who sent it, when, and under
 * which identifier it can be traced.
 *
 * <p>Events are stamped with {@link #createdAt()} instead of the time they are decided at, so the
 * timestamp is an absolute {@link Instant} rather than any temporal a client happens to use.
 *
 * @param <I> is the type of the message identifier
 */
public interface DomainMessage<I extends Serializable> extends Serializable {
  /**
   * Named {@code messageId()} rather than {@code id()}, which records of commands usually need
   * for the ID of the aggregate they address.
   *
   * @return an identifier of this message, for tracing and deduplication
   */
  I messageId();

  /**
   * Decisions never consult a clock - whenever an event needs a timestamp, it is taken from here.
   * A decision repeated after a concurrency conflict therefore produces the very same events.
   *
   * @return the time when the client issued this message
   */
  Instant createdAt();

  /**
   * @return the client who issued this message, {@link AnonymousDomainClient} unless a record
   *     declares a {@code domainClient} component of its own
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
