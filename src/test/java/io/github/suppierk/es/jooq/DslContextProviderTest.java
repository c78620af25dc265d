package io.github.suppierk.es.jooq;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class DslContextProviderTest {
  @Test
  void when_identity_provider_is_requested_with_null_argument_it_throws_an_exception() {
    assertThrows(IllegalArgumentException.class, () -> DslContextProvider.dslContextIdentity(null));
  }

  @Test
  void identity_provider_returns_the_same_context_for_every_stream() {
    final var dslContext = DSL.using(SQLDialect.DEFAULT);

    final var dslContextProvider =
        assertDoesNotThrow(() -> DslContextProvider.dslContextIdentity(dslContext));

    assertSame(dslContext, dslContextProvider.apply("shopping_cart-1"));
    assertSame(dslContext, dslContextProvider.apply("shopping_cart-2"));
  }
}
