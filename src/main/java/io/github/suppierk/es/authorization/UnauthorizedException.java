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
package io.github.suppierk.es.authorization;

import io.github.suppierk.es.error.DomainException;
import java.io.Serial;

/**
 * Thrown when a {@link DomainClient} is not allowed to issue a command, before any state is read
 * or any event is decided.
 */
public class UnauthorizedException extends DomainException {
  @Serial private static final long serialVersionUID = -1244006357918367430L;

  public UnauthorizedException() {
    super();
  }

  public UnauthorizedException(String message) {
    super(message);
  }

  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
  }

  public UnauthorizedException(Throwable cause) {
    super(cause);
  }

  /**
   * @param domainClient who issued the command
   * @param commandClass of the refused command
   * @return exception naming both
   */
  public static UnauthorizedException refused(
      final DomainClient domainClient, final Class<?> commandClass) {
    return new UnauthorizedException(
        "Client '%s' is not allowed to issue '%s'"
            .formatted(domainClient.domainRole(), commandClass.getSimpleName()));
  }

  /**
   * @return 403, as the client is known but lacks the rights
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public final int getStatusCode() {
    return 403;
  }
}
