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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.error.FatalModelException;
import java.util.Map;

/**
 * {@link EventSerializer} storing event payloads as JSON.
 *
 * <p>The type tag is not a part of the JSON: it is kept next to it, and the registry passed at
 * construction decides which class the payload is read into.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
public final class JacksonEventSerializer<EVENT extends DomainEvent>
    implements EventSerializer<EVENT> {
  private final ObjectMapper objectMapper;
  private final Map<String, Class<? extends EVENT>> eventTypes;

  /**
   * @param eventTypes every event type tag of the aggregate mapped to its class
   */
  public JacksonEventSerializer(final Map<String, Class<? extends EVENT>> eventTypes) {
    this(defaultObjectMapper(), eventTypes);
  }

  /**
   * @param objectMapper to use
   * @param eventTypes every event type tag of the aggregate mapped to its class
   */
  public JacksonEventSerializer(
      final ObjectMapper objectMapper, final Map<String, Class<? extends EVENT>> eventTypes) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    if (eventTypes == null || eventTypes.isEmpty()) {
      throw new IllegalArgumentException("Event types cannot be empty");
    }

    this.objectMapper = objectMapper;
    this.eventTypes = Map.copyOf(eventTypes);
  }

  /**
   * @return mapper writing {@link java.time} values as ISO-8601 strings and ignoring unknown
   *     payload fields
   */
  public static ObjectMapper defaultObjectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  @Override
  public SerializedEvent serialize(final EVENT event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final String type = event.eventType();
    final Class<? extends EVENT> eventClass = eventTypes.get(type);

    if (eventClass == null || !eventClass.isInstance(event)) {
      throw new FatalModelException(
          "Event '%s' of %s is not registered".formatted(type, event.getClass().getName()));
    }

    try {
      return new SerializedEvent(type, objectMapper.writeValueAsString(event));
    } catch (JsonProcessingException e) {
      throw new FatalModelException("Failed to serialize event '%s'".formatted(type), e);
    }
  }

  @Override
  public EVENT deserialize(final SerializedEvent serializedEvent) {
    if (serializedEvent == null) {
      throw new IllegalArgumentException("Serialized event cannot be null");
    }

    final Class<? extends EVENT> eventClass = eventTypes.get(serializedEvent.type());

    if (eventClass == null) {
      throw new FatalModelException("Unknown event type '%s'".formatted(serializedEvent.type()));
    }

    try {
      return objectMapper.readValue(serializedEvent.data(), eventClass);
    } catch (JsonProcessingException e) {
      throw new FatalModelException(
          "Failed to deserialize event '%s'".formatted(serializedEvent.type()), e);
    }
  }
}
