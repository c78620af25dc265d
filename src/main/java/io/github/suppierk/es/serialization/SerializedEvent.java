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

package io.github.suppierk.es.serialization;

/**
 * Storage-neutral representation of an event.
 *
 * @param type tag of the event
 * @param data payload of the event
 */
public record SerializedEvent(String type, String data) {
  public SerializedEvent {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    if (data == null) {
      throw new IllegalArgumentException("Event data cannot be null");
    }
  }
}
