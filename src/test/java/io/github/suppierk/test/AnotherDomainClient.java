package io.github.suppierk.test;

import io.github.suppierk.es.authorization.DomainClient;

/** A client which test handlers refuse to serve. */
public enum AnotherDomainClient implements DomainClient {
  INSTANCE;

  public static AnotherDomainClient getInstance() {
    return INSTANCE;
  }

  @Override
  public String domainRole() {
    return "OTHER";
  }
}
