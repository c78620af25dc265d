package io.github.suppierk.es.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Test;

class AnonymousDomainClientTest {
  @Test
  void anonymous_client_has_anonymous_role() {
    assertEquals("ANONYMOUS", AnonymousDomainClient.getInstance().domainRole());
  }

  @Test
  void client_is_a_singleton() {
    assertSame(AnonymousDomainClient.getInstance(), AnonymousDomainClient.getInstance());
  }

  @Test
  void client_stays_a_singleton_after_deserialization() throws Exception {
    final var bytes = new ByteArrayOutputStream();
    try (var out = new ObjectOutputStream(bytes)) {
      out.writeObject(AnonymousDomainClient.getInstance());
    }

    try (var in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      assertSame(AnonymousDomainClient.getInstance(), in.readObject());
    }
  }
}
