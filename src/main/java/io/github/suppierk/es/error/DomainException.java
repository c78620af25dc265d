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

package io.github.suppierk.es.error;

import java.io.Serial;

/**
 * Base type for every rejection the engine can produce while handling a command.
 *
 * <p>Each subtype maps to a single outcome a caller has to react to, and exposes the most
 * appropriate HTTP status code so that transport layers do not have to maintain their own
 * mapping tables.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3316152442907436284L;

  protected DomainException() {
    super();
  }

  protected DomainException(String message) {
    super(message);
  }

  protected DomainException(String message, Throwable cause) {
    super(message, cause);
  }

  protected DomainException(Throwable cause) {
    super(cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public abstract int getStatusCode();
}
