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
 * Represents an immutable intent to change an aggregate as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Confirm Shopping Cart' instead of
 * 'Set Shopping Cart status to CONFIRMED'.
 *
 * <p>In an event-sourced system the aggregate either has no events yet or is derived from its
 * stream, so there are exactly two kinds of commands: the ones which start a stream and the ones
 * which continue it. The {@code sealed} hierarchy forces every command to declare which one it
 * is, and the matching {@link DomainCommandHandler} variant enforces the existence check.
 *
 * @param <I> is the type of the command identifier
 */
public sealed interface DomainCommand<I extends Serializable> extends DomainMessage<I>
    permits DomainCommand.Create, DomainCommand.Update {
  /**
   * @return identifier of the event stream this command is addressed to
   */
  String streamId();

  /**
   * Marker interface, denoting that the command starts a new stream, which must not have any
   * events yet.
   */
  non-sealed interface Create<I extends Serializable> extends DomainCommand<I> {}

  /** Marker interface, denoting that the command continues an existing stream. */
  non-sealed interface Update<I extends Serializable> extends DomainCommand<I> {}
}
