package io.github.suppierk.es.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.error.ConcurrencyConflictException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryEventStoreTest {
  final InMemoryEventStore<String> eventStore = new InMemoryEventStore<>();

  @Test
  void when_stream_was_never_appended_to_it_is_empty() {
    assertTrue(eventStore.read("missing").isEmpty());
  }

  @Test
  void events_are_read_in_append_order() {
    assertEquals(2, eventStore.append("s", 0, List.of("a", "b")));
    assertEquals(3, eventStore.append("s", 2, List.of("c")));

    final var stream = eventStore.read("s").orElseThrow();
    assertEquals(List.of("a", "b", "c"), stream.events());
    assertEquals(3, stream.revision());
  }

  @Test
  void streams_are_independent() {
    eventStore.append("first", 0, List.of("a"));
    eventStore.append("second", 0, List.of("b"));

    assertEquals(List.of("a"), eventStore.read("first").orElseThrow().events());
    assertEquals(List.of("b"), eventStore.read("second").orElseThrow().events());
  }

  @Test
  void when_revision_is_stale_nothing_is_appended() {
    eventStore.append("s", 0, List.of("a"));

    final var exception =
        assertThrows(
            ConcurrencyConflictException.class, () -> eventStore.append("s", 0, List.of("b")));
    assertEquals(412, exception.getStatusCode());
    assertThrows(
        ConcurrencyConflictException.class, () -> eventStore.append("s", 2, List.of("b")));
    assertEquals(List.of("a"), eventStore.read("s").orElseThrow().events());
  }

  @Test
  void appending_nothing_only_checks_the_revision() {
    eventStore.append("s", 0, List.of("a"));

    assertEquals(1, eventStore.append("s", 1, List.of()));
    assertThrows(ConcurrencyConflictException.class, () -> eventStore.append("s", 0, List.of()));
  }

  @Test
  void when_stream_id_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> eventStore.read(null));
    assertThrows(IllegalArgumentException.class, () -> eventStore.append(null, 0, List.of("a")));
  }

  @Test
  void when_writers_race_from_the_same_revision_exactly_one_wins() throws Exception {
    eventStore.append("s", 0, List.of("opened"));

    final int writers = 8;
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(writers);

    try {
      final List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        final String event = "writer-" + i;
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  try {
                    eventStore.append("s", 1, List.of(event));
                    return true;
                  } catch (ConcurrencyConflictException e) {
                    return false;
                  }
                }));
      }

      start.countDown();

      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }

      assertEquals(1, winners);
      assertEquals(2, eventStore.read("s").orElseThrow().revision());
    } finally {
      executor.shutdownNow();
    }
  }
}
