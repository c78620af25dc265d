package io.github.suppierk.es.cqrs;

import static io.github.suppierk.es.cqrs.TestAggregate.EVOLVER;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.es.cqrs.TestAggregate.Counter;
import io.github.suppierk.es.cqrs.TestAggregate.CounterContext;
import io.github.suppierk.es.cqrs.TestAggregate.Delta;
import io.github.suppierk.es.cqrs.TestAggregate.Increment;
import io.github.suppierk.es.cqrs.TestAggregate.IncrementHandler;
import io.github.suppierk.es.cqrs.TestAggregate.NoEventsHandler;
import io.github.suppierk.es.cqrs.TestAggregate.StartCounter;
import io.github.suppierk.es.cqrs.TestAggregate.StartCounterHandler;
import io.github.suppierk.es.error.AlreadyExistsException;
import io.github.suppierk.es.error.ConcurrencyConflictException;
import io.github.suppierk.es.error.InvalidOperationException;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStream;
import io.github.suppierk.es.store.InMemoryEventStore;
import io.github.suppierk.test.AnotherDomainClient;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoundedContextTest {
  RacingEventStore eventStore;
  CounterContext context;

  @BeforeEach
  void setUp() {
    eventStore = new RacingEventStore();
    context = new CounterContext(eventStore);
    context.addDomainCommandHandler(new StartCounterHandler());
    context.addDomainCommandHandler(new IncrementHandler());
  }

  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_null_throw_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> new CounterContext(null));
      assertThrows(
          IllegalArgumentException.class, () -> new CounterContext(eventStore, null, 1));
      assertDoesNotThrow(() -> new CounterContext(eventStore, EVOLVER, 1));
    }

    @Test
    void when_max_attempts_is_not_positive_throw_illegal_argument_exception() {
      assertThrows(
          IllegalArgumentException.class, () -> new CounterContext(eventStore, EVOLVER, 0));
      assertThrows(
          IllegalArgumentException.class, () -> new CounterContext(eventStore, EVOLVER, -3));
    }

    @Test
    void when_adding_null_command_handler_illegal_argument_must_be_thrown() {
      final var empty = new CounterContext(eventStore);

      assertThrows(IllegalArgumentException.class, () -> empty.addDomainCommandHandler(null));
      assertTrue(empty.getSupportedDomainCommandClasses().isEmpty());
      assertFalse(empty.isAnyWriteLockHeld());
    }

    @Test
    void when_adding_existing_command_handler_illegal_state_must_be_thrown() {
      final var duplicate = new IncrementHandler();

      assertThrows(IllegalStateException.class, () -> context.addDomainCommandHandler(duplicate));
      assertEquals(
          Set.of(StartCounter.class, Increment.class), context.getSupportedDomainCommandClasses());
      assertFalse(context.isAnyWriteLockHeld());
      assertFalse(context.isAnyReadLockHeld());
    }
  }

  @Nested
  class Handle {
    @Test
    void when_command_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> context.handle(null));
    }

    @Test
    void when_there_is_no_handler_unsupported_operation_exception_is_thrown() {
      final var empty = new CounterContext(eventStore);
      final var command = new StartCounter("c", 1);

      assertThrows(UnsupportedOperationException.class, () -> empty.handle(command));
      assertFalse(empty.isAnyReadLockHeld());
    }

    @Test
    void accepted_commands_are_appended_and_folded() {
      final var started = context.handle(new StartCounter("c", 5));
      assertEquals(new CommandResult<>("c", 1, List.of(new Delta("c", 5))), started);

      final var incremented = context.handle(new Increment("c", 3));
      assertEquals(new CommandResult<>("c", 2, List.of(new Delta("c", 3))), incremented);

      assertEquals(StreamState.of(new Counter("c", 8), 2), context.load("c"));
      assertFalse(context.isAnyReadLockHeld());
    }

    @Test
    void unknown_stream_is_not_found() {
      assertFalse(context.load("missing").exists());
      assertThrows(IllegalArgumentException.class, () -> context.load(null));
    }

    @Test
    void when_nothing_is_decided_nothing_is_appended() {
      final var idle = new CounterContext(eventStore);
      idle.addDomainCommandHandler(new StartCounterHandler());
      idle.addDomainCommandHandler(new NoEventsHandler());
      idle.handle(new StartCounter("c", 5));

      final var result = idle.handle(new Increment("c", 3));

      assertEquals(new CommandResult<>("c", 1, List.of()), result);
      assertEquals(1, eventStore.appendAttempts.get());
    }

    @Test
    void when_client_is_not_allowed_the_stream_is_never_read() {
      final var command =
          new StartCounter(
              UUID.randomUUID(), Instant.now(), AnotherDomainClient.getInstance(), "c", 1);

      assertThrows(UnauthorizedException.class, () -> context.handle(command));
      assertEquals(0, eventStore.reads.get());
      assertEquals(0, eventStore.appendAttempts.get());
    }

    @Test
    void rejected_commands_leave_the_stream_untouched() {
      context.handle(new StartCounter("c", 5));
      final var command = new StartCounter("c", 7);

      assertThrows(AlreadyExistsException.class, () -> context.handle(command));
      assertEquals(StreamState.of(new Counter("c", 5), 1), context.load("c"));
    }
  }

  @Nested
  class Retry {
    @Test
    void when_stream_changes_concurrently_the_command_is_decided_again() {
      context.handle(new StartCounter("c", 5));
      eventStore.race(1, 1);

      final var result = context.handle(new Increment("c", 3));

      assertEquals(3, result.revision());
      assertEquals(StreamState.of(new Counter("c", 9), 3), context.load("c"));
      assertEquals(3, eventStore.appendAttempts.get());
    }

    @Test
    void business_rules_are_checked_against_the_fresh_state() {
      context.handle(new StartCounter("c", 90));
      eventStore.race(1, 5);
      final var command = new Increment("c", 5);

      assertThrows(InvalidOperationException.class, () -> context.handle(command));
      assertEquals(StreamState.of(new Counter("c", 95), 2), context.load("c"));
    }

    @Test
    void when_another_writer_creates_the_stream_first_creation_is_rejected() {
      eventStore.race(1, 1);
      final var command = new StartCounter("c", 5);

      assertThrows(AlreadyExistsException.class, () -> context.handle(command));
    }

    @Test
    void when_attempts_are_exhausted_the_conflict_is_surfaced() {
      final var impatient = new CounterContext(eventStore, EVOLVER, 2);
      impatient.addDomainCommandHandler(new StartCounterHandler());
      impatient.addDomainCommandHandler(new IncrementHandler());
      impatient.handle(new StartCounter("c", 5));
      eventStore.race(10, 1);
      final var command = new Increment("c", 3);

      final var exception =
          assertThrows(ConcurrencyConflictException.class, () -> impatient.handle(command));
      assertEquals(412, exception.getStatusCode());
      assertEquals(3, eventStore.appendAttempts.get());
    }

    @Test
    void single_attempt_never_retries() {
      final var once = new CounterContext(eventStore, EVOLVER, 1);
      once.addDomainCommandHandler(new StartCounterHandler());
      once.addDomainCommandHandler(new IncrementHandler());
      once.handle(new StartCounter("c", 5));
      eventStore.race(1, 1);
      final var command = new Increment("c", 3);

      assertThrows(ConcurrencyConflictException.class, () -> once.handle(command));
      assertEquals(StreamState.of(new Counter("c", 6), 2), once.load("c"));
    }
  }

  @Nested
  class ExpectedRevision {
    @Test
    void when_revision_matches_the_command_is_handled() {
      assertEquals(1, context.handle(new StartCounter("c", 5), 0).revision());
      assertEquals(2, context.handle(new Increment("c", 3), 1).revision());
    }

    @Test
    void when_revision_does_not_match_the_command_is_not_decided() {
      context.handle(new StartCounter("c", 5));
      context.handle(new Increment("c", 3));
      final var command = new Increment("c", 1);

      assertThrows(ConcurrencyConflictException.class, () -> context.handle(command, 1));
      assertEquals(2, eventStore.appendAttempts.get());
    }

    @Test
    void when_stream_changes_concurrently_the_conflict_is_not_retried() {
      context.handle(new StartCounter("c", 5));
      eventStore.race(1, 1);
      final var command = new Increment("c", 3);

      assertThrows(ConcurrencyConflictException.class, () -> context.handle(command, 1));
      assertEquals(StreamState.of(new Counter("c", 6), 2), context.load("c"));
    }

    @Test
    void when_revision_is_negative_illegal_argument_exception_is_thrown() {
      final var command = new StartCounter("c", 5);

      assertThrows(IllegalArgumentException.class, () -> context.handle(command, -1));
    }
  }

  /** Lets another writer append right before each of the next few appends. */
  static final class RacingEventStore implements EventStore<Delta> {
    final InMemoryEventStore<Delta> delegate = new InMemoryEventStore<>();
    final AtomicInteger reads = new AtomicInteger();
    final AtomicInteger appendAttempts = new AtomicInteger();
    final AtomicInteger racesLeft = new AtomicInteger();
    final AtomicInteger racingValue = new AtomicInteger();

    void race(final int times, final int value) {
      racesLeft.set(times);
      racingValue.set(value);
    }

    @Override
    public Optional<EventStream<Delta>> read(final String streamId) {
      reads.incrementAndGet();
      return delegate.read(streamId);
    }

    @Override
    public long append(
        final String streamId, final long expectedRevision, final List<Delta> events) {
      appendAttempts.incrementAndGet();

      if (racesLeft.getAndDecrement() > 0) {
        delegate.append(
            streamId, expectedRevision, List.of(new Delta(streamId, racingValue.get())));
      }

      return delegate.append(streamId, expectedRevision, events);
    }
  }
}
