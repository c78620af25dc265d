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

import io.github.suppierk.es.authorization.DomainClient;
import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.es.error.AlreadyExistsException;
import io.github.suppierk.es.error.NotFoundException;
import java.util.List;

/**
 * Class to decide whether a specific {@link DomainCommand} can be accepted:
 *
 * <ul>
 *   <li>Assert that the {@link DomainClient} can invoke the {@link DomainCommand}.
 *   <li>Assert that the stream exists (or does not exist yet) as the command kind requires.
 *   <li>Enforce business rules against the current state and produce new events.
 * </ul>
 *
 * <p>Deciding is pure: handlers never read or write the event store themselves and never consult
 * a clock, which makes them safe to re-run whenever an append loses a race.
 *
 * <p>Because {@link DomainCommand} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <STATE> of the aggregate
 * @param <EVENT> the closed set of events of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?>,
  STATE,
  EVENT
>
extends
  Suspicious
permits
  DomainCommandHandler.Create, DomainCommandHandler.Update
{
// @formatter:on
  private static final String DECIDED_EVENTS = "Decided events";

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * @return the class type of the command being handled by this {@link DomainCommandHandler}
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * @param domainClient invoking the command
   * @return {@code true} if the client can invoke current handler, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return true;
  }

  /**
   * Checks the command itself, without looking at any state.
   *
   * @param command to check
   * @return the same command
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws IllegalStateException if the command has no client or no stream ID
   * @throws UnauthorizedException if the client is not allowed to use this handler
   */
  public final COMMAND authorize(final COMMAND command) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw UnauthorizedException.refused(nonNullDomainClient, getCommandClass());
    }

    throwIllegalStateIfNull(nonNullCommand.streamId(), "Command's stream ID");
    return nonNullCommand;
  }

  /**
   * Decides which events the command results in, given the current state of its stream.
   *
   * @param current state of the stream the command is addressed to
   * @param command to decide on
   * @return new events, in the order they must be appended
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if the decision produced {@code null}s
   * @throws UnauthorizedException if the client is not allowed to use this handler
   * @throws io.github.suppierk.es.error.DomainException if the command is rejected
   */
  public final List<EVENT> decide(final StreamState<STATE> current, final COMMAND command) {
    final StreamState<STATE> nonNullCurrent = throwIllegalArgumentIfNull(current, "Current state");
    final COMMAND nonNullCommand = authorize(command);

    return throwIllegalStateIfAnyNull(
        internalDecide(nonNullCurrent, nonNullCommand), DECIDED_EVENTS);
  }

  /**
   * Variant-specific part of {@link #decide(StreamState, DomainCommand)}.
   *
   * @param current state of the stream, never {@code null}
   * @param command authorized command, never {@code null}
   * @return new events
   */
  abstract List<EVENT> internalDecide(final StreamState<STATE> current, final COMMAND command);

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}: the stream must
   * have no events yet.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <STATE> of the aggregate
   * @param <EVENT> the closed set of events of the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?>,
    STATE,
    EVENT
  > extends DomainCommandHandler<CREATE, STATE, EVENT> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic producing the events which start the stream.
     *
     * @param command containing the data required to start the stream
     * @return events starting the stream
     */
    protected abstract List<EVENT> decideCreation(final CREATE command);

    @Override
    final List<EVENT> internalDecide(final StreamState<STATE> current, final CREATE command) {
      if (current.exists()) {
        throw new AlreadyExistsException(
            "Stream '%s' already exists at revision %d"
                .formatted(command.streamId(), current.revision()));
      }

      return decideCreation(command);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}: the stream
   * must already exist.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <STATE> of the aggregate
   * @param <EVENT> the closed set of events of the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?>,
    STATE,
    EVENT
  > extends DomainCommandHandler<UPDATE, STATE, EVENT> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic validating the command against the current state and producing new events.
     *
     * @param state current state of the aggregate, never {@code null}
     * @param command containing the data required to change the aggregate
     * @return events continuing the stream
     */
    protected abstract List<EVENT> decideUpdate(final STATE state, final UPDATE command);

    @Override
    final List<EVENT> internalDecide(final StreamState<STATE> current, final UPDATE command) {
      final STATE state =
          current
              .state()
              .orElseThrow(
                  () ->
                      new NotFoundException(
                          "Stream '%s' does not exist".formatted(command.streamId())));

      return decideUpdate(state, command);
    }
  }
}
