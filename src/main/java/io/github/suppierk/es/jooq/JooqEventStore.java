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

package io.github.suppierk.es.jooq;

import io.github.suppierk.es.error.ConcurrencyConflictException;
import io.github.suppierk.es.serialization.EventSerializer;
import io.github.suppierk.es.serialization.SerializedEvent;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping all streams in one relational table:
 *
 * <pre>{@code
 * CREATE TABLE events (
 *   stream_id       VARCHAR(255)             NOT NULL,
 *   stream_position BIGINT                   NOT NULL,
 *   event_type      VARCHAR(255)             NOT NULL,
 *   event_data      TEXT                     NOT NULL,
 *   recorded_at     TIMESTAMP                NOT NULL,
 *   PRIMARY KEY (stream_id, stream_position)
 * );
 * }</pre>
 *
 * <p>Positions start at {@code 1}, so the revision of a stream is the position of its last event.
 * The revision check and the insert run in one transaction; a writer racing past the check is
 * stopped by the primary key.
 *
 * @param <EVENT> the closed set of events of the aggregate
 */
public final class JooqEventStore<EVENT> implements EventStore<EVENT> {
  static final Table<Record> EVENTS = DSL.table(DSL.name("events"));
  static final Field<String> STREAM_ID = DSL.field(DSL.name("stream_id"), SQLDataType.VARCHAR);
  static final Field<Long> STREAM_POSITION =
      DSL.field(DSL.name("stream_position"), SQLDataType.BIGINT);
  static final Field<String> EVENT_TYPE = DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR);
  static final Field<String> EVENT_DATA = DSL.field(DSL.name("event_data"), SQLDataType.VARCHAR);
  static final Field<LocalDateTime> RECORDED_AT =
      DSL.field(DSL.name("recorded_at"), SQLDataType.LOCALDATETIME);

  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  private final DslContextProvider dslContextProvider;
  private final EventSerializer<EVENT> eventSerializer;
  private final Clock clock;

  /**
   * @param dslContextProvider selecting the database of a stream
   * @param eventSerializer converting events to rows and back
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider, final EventSerializer<EVENT> eventSerializer) {
    this(dslContextProvider, eventSerializer, Clock.systemUTC());
  }

  /**
   * @param dslContextProvider selecting the database of a stream
   * @param eventSerializer converting events to rows and back
   * @param clock for {@code recorded_at}, which is informational only and never read back; its
   *     zone decides the zone the timestamps are recorded in
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider,
      final EventSerializer<EVENT> eventSerializer,
      final Clock clock) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (eventSerializer == null) {
      throw new IllegalArgumentException("Event serializer cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.eventSerializer = eventSerializer;
    this.clock = clock;
  }

  @Override
  public Optional<EventStream<EVENT>> read(final String streamId) {
    final DSLContext dsl = dslFor(streamId);

    final List<EVENT> events =
        dsl.select(EVENT_TYPE, EVENT_DATA)
            .from(EVENTS)
            .where(STREAM_ID.eq(streamId))
            .orderBy(STREAM_POSITION.asc())
            .fetch(
                row ->
                    eventSerializer.deserialize(
                        new SerializedEvent(row.get(EVENT_TYPE), row.get(EVENT_DATA))));

    if (events.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(new EventStream<>(streamId, events, events.size()));
  }

  @Override
  public long append(final String streamId, final long expectedRevision, final List<EVENT> events) {
    final DSLContext dsl = dslFor(streamId);
    final List<SerializedEvent> serializedEvents =
        List.copyOf(events).stream().map(eventSerializer::serialize).toList();

    try {
      return dsl.transactionResult(
          (final Configuration trx) ->
              appendInTransaction(trx.dsl(), streamId, expectedRevision, serializedEvents));
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new ConcurrencyConflictException(
            "Stream '%s' was appended to concurrently".formatted(streamId), e);
      }

      throw e;
    }
  }

  private long appendInTransaction(
      final DSLContext trx,
      final String streamId,
      final long expectedRevision,
      final List<SerializedEvent> serializedEvents) {
    final long currentRevision = trx.fetchCount(EVENTS, STREAM_ID.eq(streamId));

    if (currentRevision != expectedRevision) {
      throw ConcurrencyConflictException.revisionMismatch(
          streamId, expectedRevision, currentRevision);
    }

    if (serializedEvents.isEmpty()) {
      return currentRevision;
    }

    final LocalDateTime recordedAt = LocalDateTime.now(clock);
    var insert =
        trx.insertInto(EVENTS, STREAM_ID, STREAM_POSITION, EVENT_TYPE, EVENT_DATA, RECORDED_AT);

    long position = currentRevision;
    for (SerializedEvent serializedEvent : serializedEvents) {
      position++;
      insert =
          insert.values(
              streamId, position, serializedEvent.type(), serializedEvent.data(), recordedAt);
    }

    insert.execute();

    LOG.debug(
        "Appended {} event(s) to stream '{}', now at revision {}",
        serializedEvents.size(),
        streamId,
        position);

    return position;
  }

  private DSLContext dslFor(final String streamId) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    final DSLContext dsl = dslContextProvider.apply(streamId);

    if (dsl == null) {
      throw new IllegalStateException(
          "DSLContext for stream '%s' cannot be null".formatted(streamId));
    }

    return dsl;
  }
}
