package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.es.cqrs.TestAggregate.Counter;
import io.github.suppierk.es.cqrs.TestAggregate.Delta;
import io.github.suppierk.es.cqrs.TestAggregate.Increment;
import io.github.suppierk.es.cqrs.TestAggregate.IncrementHandler;
import io.github.suppierk.es.cqrs.TestAggregate.NullElementHandler;
import io.github.suppierk.es.cqrs.TestAggregate.NullEventsHandler;
import io.github.suppierk.es.cqrs.TestAggregate.StartCounter;
import io.github.suppierk.es.cqrs.TestAggregate.StartCounterHandler;
import io.github.suppierk.es.error.AlreadyExistsException;
import io.github.suppierk.es.error.InvalidOperationException;
import io.github.suppierk.es.error.NotFoundException;
import io.github.suppierk.test.AnotherDomainClient;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  static final StreamState<Counter> EXISTING = StreamState.of(new Counter("c", 10), 2);

  @Test
  void when_command_class_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new StartCounterHandler(null));
  }

  @Test
  void command_class_is_exposed() {
    assertSame(StartCounter.class, new StartCounterHandler().getCommandClass());
    assertSame(Increment.class, new IncrementHandler().getCommandClass());
  }

  @Nested
  class Authorize {
    @Test
    void when_command_is_null_illegal_argument_exception_is_thrown() {
      final var handler = new StartCounterHandler();

      assertThrows(IllegalArgumentException.class, () -> handler.authorize(null));
    }

    @Test
    void when_command_has_no_client_illegal_state_exception_is_thrown() {
      final var handler = new StartCounterHandler();
      final var command = new StartCounter(UUID.randomUUID(), Instant.now(), null, "c", 1);

      assertThrows(IllegalStateException.class, () -> handler.authorize(command));
    }

    @Test
    void when_command_has_no_stream_id_illegal_state_exception_is_thrown() {
      final var handler = new StartCounterHandler();
      final var command = new StartCounter(null, 1);

      assertThrows(IllegalStateException.class, () -> handler.authorize(command));
    }

    @Test
    void when_client_is_not_allowed_unauthorized_exception_is_thrown() {
      final var handler = new StartCounterHandler();
      final var command =
          new StartCounter(
              UUID.randomUUID(), Instant.now(), AnotherDomainClient.getInstance(), "c", 1);

      final var exception =
          assertThrows(UnauthorizedException.class, () -> handler.authorize(command));
      assertEquals(403, exception.getStatusCode());
    }
  }

  @Nested
  class Create {
    @Test
    void when_stream_does_not_exist_creation_is_decided() {
      final var handler = new StartCounterHandler();

      assertEquals(
          List.of(new Delta("c", 5)),
          handler.decide(StreamState.notFound(), new StartCounter("c", 5)));
    }

    @Test
    void when_stream_exists_already_exists_exception_is_thrown() {
      final var handler = new StartCounterHandler();
      final var command = new StartCounter("c", 5);

      final var exception =
          assertThrows(AlreadyExistsException.class, () -> handler.decide(EXISTING, command));
      assertEquals(409, exception.getStatusCode());
    }

    @Test
    void when_state_is_null_illegal_argument_exception_is_thrown() {
      final var handler = new StartCounterHandler();
      final var command = new StartCounter("c", 5);

      assertThrows(IllegalArgumentException.class, () -> handler.decide(null, command));
    }

    @Test
    void when_client_is_not_allowed_nothing_is_decided() {
      final var handler = new StartCounterHandler();
      final var command =
          new StartCounter(
              UUID.randomUUID(), Instant.now(), AnotherDomainClient.getInstance(), "c", 1);
      final StreamState<Counter> notFound = StreamState.notFound();

      assertThrows(UnauthorizedException.class, () -> handler.decide(notFound, command));
    }
  }

  @Nested
  class Update {
    @Test
    void when_stream_exists_update_is_decided() {
      final var handler = new IncrementHandler();

      assertEquals(List.of(new Delta("c", 3)), handler.decide(EXISTING, new Increment("c", 3)));
    }

    @Test
    void when_stream_does_not_exist_not_found_exception_is_thrown() {
      final var handler = new IncrementHandler();
      final var command = new Increment("c", 3);
      final StreamState<Counter> notFound = StreamState.notFound();

      final var exception =
          assertThrows(NotFoundException.class, () -> handler.decide(notFound, command));
      assertEquals(404, exception.getStatusCode());
    }

    @Test
    void when_business_rule_is_broken_the_rejection_is_propagated() {
      final var handler = new IncrementHandler();
      final var command = new Increment("c", 90);

      assertThrows(InvalidOperationException.class, () -> handler.decide(EXISTING, command));
    }

    @Test
    void when_decision_returns_null_illegal_state_exception_is_thrown() {
      final var handler = new NullEventsHandler();
      final var command = new Increment("c", 1);

      assertThrows(IllegalStateException.class, () -> handler.decide(EXISTING, command));
    }

    @Test
    void when_decision_contains_null_event_illegal_state_exception_is_thrown() {
      final var handler = new NullElementHandler();
      final var command = new Increment("c", 1);

      assertThrows(IllegalStateException.class, () -> handler.decide(EXISTING, command));
    }

    @Test
    void deciding_is_repeatable() {
      final var handler = new IncrementHandler();
      final var command = new Increment("c", 3);

      assertEquals(handler.decide(EXISTING, command), handler.decide(EXISTING, command));
    }
  }
}
