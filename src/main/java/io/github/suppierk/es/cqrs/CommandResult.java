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

package io.github.suppierk.es.cqrs;

import java.util.List;

/**
 * Outcome of an accepted command.
 *
 * @param streamId the events were appended to
 * @param revision of the stream after the append, suitable as an entity tag for the next command
 * @param events appended, in order
 * @param <EVENT> the closed set of events of the aggregate
 */
public record CommandResult<EVENT>(String streamId, long revision, List<EVENT> events) {
  public CommandResult {
    events = List.copyOf(events);
  }
}
