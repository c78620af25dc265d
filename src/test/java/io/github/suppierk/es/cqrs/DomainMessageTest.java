package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.suppierk.es.authorization.AnonymousDomainClient;
import io.github.suppierk.es.authorization.DomainClient;
import io.github.suppierk.test.AnotherDomainClient;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DomainMessageTest {
  @Test
  void when_message_has_no_client_it_is_sent_by_anonymous_client() {
    final var message = new Ping(UUID.randomUUID(), Instant.now());

    assertSame(AnonymousDomainClient.getInstance(), message.domainClient());
    assertEquals("ANONYMOUS", message.domainClient().domainRole());
  }

  @Test
  void when_message_has_explicit_client_that_client_is_used() {
    final var message =
        new SignedPing(UUID.randomUUID(), Instant.now(), AnotherDomainClient.getInstance());

    assertEquals("OTHER", message.domainClient().domainRole());
  }

  /**
   * Records implement interface methods by their component names, and may skip components for
   * which the interface has {@code default} methods.
   *
   * @param messageId to fulfill {@link DomainMessage#messageId()} contract
   * @param createdAt to fulfill {@link DomainMessage#createdAt()} contract
   */
  record Ping(UUID messageId, Instant createdAt) implements DomainMessage<UUID> {}

  record SignedPing(UUID messageId, Instant createdAt, DomainClient domainClient)
      implements DomainMessage<UUID> {}
}
