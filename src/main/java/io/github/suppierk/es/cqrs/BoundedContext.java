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

import io.github.suppierk.es.error.ConcurrencyConflictException;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for commands addressed to a single aggregate type.
 *
 * <p>Every command goes through the same cycle:
 *
 * <ol>
 *   <li>The registered {@link DomainCommandHandler} authorizes the command.
 *   <li>The stream is read and folded into {@link StreamState} with the {@link Evolver}.
 *   <li>The handler decides on the command against that state.
 *   <li>New events are appended, expecting the stream to still be at the revision it was read at.
 * </ol>
 *
 * <p>When another writer appended in between, the whole read-decide-append cycle is repeated, up
 * to {@code maxAttempts} times. Business rejections are never repeated.
 *
 * @param <STATE> of the aggregate
 * @param <EVENT> the closed set of events of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class BoundedContext<STATE, EVENT> extends Suspicious {
  /** Attempts made when the context is constructed without an explicit bound. */
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private static final Logger LOG = LoggerFactory.getLogger(BoundedContext.class);

  private final EventStore<EVENT> eventStore;
  private final Evolver<STATE, EVENT> evolver;
  private final int maxAttempts;

  private final ReentrantReadWriteLock handlersLock;
  private final Map<Class<?>, DomainCommandHandler<?, STATE, EVENT>> handlers;

  /**
   * @param eventStore to read streams from and append events to
   * @param evolver to reconstruct state with
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  protected BoundedContext(
      final EventStore<EVENT> eventStore, final Evolver<STATE, EVENT> evolver) {
    this(eventStore, evolver, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * @param eventStore to read streams from and append events to
   * @param evolver to reconstruct state with
   * @param maxAttempts how many times a command may be decided before a concurrency conflict is
   *     surfaced to the caller, at least {@code 1}
   * @throws IllegalArgumentException if any argument is {@code null} or attempts are not positive
   */
  protected BoundedContext(
      final EventStore<EVENT> eventStore,
      final Evolver<STATE, EVENT> evolver,
      final int maxAttempts) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.evolver = throwIllegalArgumentIfNull(evolver, "Evolver");

    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "Max attempts must be positive, got %d".formatted(maxAttempts));
    }

    this.maxAttempts = maxAttempts;
    this.handlersLock = new ReentrantReadWriteLock();
    this.handlers = new HashMap<>();
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is {@code null}
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public final void addDomainCommandHandler(final DomainCommandHandler<?, STATE, EVENT> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Domain command handler");
    final var commandClass = nonNullHandler.getCommandClass();

    handlersLock.writeLock().lock();
    try {
      if (handlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(commandClass.getSimpleName()));
      }

      handlers.put(commandClass, nonNullHandler);
    } finally {
      handlersLock.writeLock().unlock();
    }
  }

  /**
   * @return command classes which this context can handle
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    handlersLock.readLock().lock();
    try {
      return Set.copyOf(handlers.keySet());
    } finally {
      handlersLock.readLock().unlock();
    }
  }

  /**
   * Reads a stream and folds it into state.
   *
   * @param streamId to read
   * @return current state of the stream, {@link StreamState#notFound()} if it has no events
   * @throws IllegalArgumentException if the stream ID is {@code null}
   * @throws io.github.suppierk.es.error.FatalModelException if the stream does not match the event
   *     model
   */
  public final StreamState<STATE> load(final String streamId) {
    final String nonNullStreamId = throwIllegalArgumentIfNull(streamId, "Stream ID");

    return throwIllegalStateIfNull(eventStore.read(nonNullStreamId), "Read result")
        .map(EventStream::events)
        .map(evolver::reconstruct)
        .orElseGet(StreamState::notFound);
  }

  /**
   * Handles the command, repeating the decision if the stream changes while it is being made.
   *
   * @param command to handle
   * @return appended events and the new revision of the stream
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if there is no handler for the command
   * @throws ConcurrencyConflictException if the stream kept changing for all the attempts
   * @throws io.github.suppierk.es.error.DomainException if the command is rejected
   */
  public final <COMMAND extends DomainCommand<?>> CommandResult<EVENT> handle(
      final COMMAND command) {
    return handle(command, OptionalLong.empty());
  }

  /**
   * Handles the command only if the stream is still at the revision the caller has seen, for
   * example the one sent back by a client in an {@code If-Match} header.
   *
   * <p>The decision is not repeated on mismatch: the caller has to look at the new state first.
   *
   * @param command to handle
   * @param expectedRevision the caller based the command on
   * @return appended events and the new revision of the stream
   * @throws IllegalArgumentException if the command is {@code null} or revision is negative
   * @throws UnsupportedOperationException if there is no handler for the command
   * @throws ConcurrencyConflictException if the stream is not at the expected revision
   * @throws io.github.suppierk.es.error.DomainException if the command is rejected
   */
  public final <COMMAND extends DomainCommand<?>> CommandResult<EVENT> handle(
      final COMMAND command, final long expectedRevision) {
    if (expectedRevision < 0) {
      throw new IllegalArgumentException(
          "Expected revision cannot be negative, got %d".formatted(expectedRevision));
    }

    return handle(command, OptionalLong.of(expectedRevision));
  }

  private <COMMAND extends DomainCommand<?>> CommandResult<EVENT> handle(
      final COMMAND command, final OptionalLong expectedRevision) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler<COMMAND, STATE, EVENT> handler = findHandler(nonNullCommand);
    final String streamId = handler.authorize(nonNullCommand).streamId();

    for (int attempt = 1; ; attempt++) {
      final StreamState<STATE> current = load(streamId);

      if (expectedRevision.isPresent() && expectedRevision.getAsLong() != current.revision()) {
        throw ConcurrencyConflictException.revisionMismatch(
            streamId, expectedRevision.getAsLong(), current.revision());
      }

      final List<EVENT> events = handler.decide(current, nonNullCommand);

      if (events.isEmpty()) {
        return new CommandResult<>(streamId, current.revision(), events);
      }

      try {
        final long revision = eventStore.append(streamId, current.revision(), events);
        return new CommandResult<>(streamId, revision, events);
      } catch (ConcurrencyConflictException e) {
        if (expectedRevision.isPresent() || attempt >= maxAttempts) {
          LOG.warn(
              "Giving up on '{}' for stream '{}' after {} attempt(s)",
              handler.getCommandClass().getSimpleName(),
              streamId,
              attempt);
          throw e;
        }

        LOG.debug(
            "Stream '{}' changed while deciding on '{}', attempt {} of {}: {}",
            streamId,
            handler.getCommandClass().getSimpleName(),
            attempt,
            maxAttempts,
            e.getMessage());
      }
    }
  }

  private <COMMAND extends DomainCommand<?>> DomainCommandHandler<COMMAND, STATE, EVENT>
      findHandler(final COMMAND command) {
    final DomainCommandHandler<?, STATE, EVENT> handler;

    handlersLock.readLock().lock();
    try {
      handler =
          throwUnsupportedOperationIfNull(
              handlers.get(command.getClass()),
              "Handler for '%s'".formatted(command.getClass().getSimpleName()));
    } finally {
      handlersLock.readLock().unlock();
    }

    // Registered under its own command class
    @SuppressWarnings("unchecked")
    final DomainCommandHandler<COMMAND, STATE, EVENT> typed =
        (DomainCommandHandler<COMMAND, STATE, EVENT>) handler;
    return typed;
  }

  final boolean isAnyWriteLockHeld() {
    return handlersLock.isWriteLocked();
  }

  final boolean isAnyReadLockHeld() {
    return handlersLock.getReadLockCount() > 0;
  }
}
