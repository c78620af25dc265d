package io.github.suppierk.es.store;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class EventStreamTest {
  @Test
  void revision_must_match_the_number_of_events() {
    assertDoesNotThrow(() -> new EventStream<>("s", List.of("a", "b"), 2));
    assertThrows(IllegalArgumentException.class, () -> new EventStream<>("s", List.of("a"), 2));
    assertThrows(IllegalArgumentException.class, () -> new EventStream<>(null, List.of("a"), 1));
  }
}
