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
 * Converts events of one aggregate to and from their stored form.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
public interface EventSerializer<EVENT> {
  /**
   * @param event to convert
   * @return stored form of the event
   * @throws io.github.suppierk.es.error.FatalModelException if the event is not a part of the model
   */
  SerializedEvent serialize(final EVENT event);

  /**
   * @param serializedEvent to convert
   * @return event restored from its stored form
   * @throws io.github.suppierk.es.error.FatalModelException if the type is unknown or the data does
   *     not match it
   */
  EVENT deserialize(final SerializedEvent serializedEvent);
}
