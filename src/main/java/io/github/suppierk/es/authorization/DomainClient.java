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

import java.io.Serializable;

/**
 * Whoever issues commands: a shopper, a back-office operator, another service.
 *
 * <p>Clients travel inside commands, which is why they must be {@link Serializable}. The engine
 * does not care how clients are stored or authenticated; handlers look at the role to accept or
 * refuse a command, see {@code DomainCommandHandler#canBeUsedBy}.
 */
public interface DomainClient extends Serializable {
  /**
   * @return role of the client, also reported when a command is refused
   */
  String domainRole();
}
