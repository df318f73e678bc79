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

package io.github.suppierk.enrollment.eventstore;

import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENTS;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_ID;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_OCCURRED_AT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_PAYLOAD;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_STORED_AT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_STREAM_ID;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_TYPE;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.EVENT_VERSION;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAMS;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_CREATED_AT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_EVENT_COUNT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_FIRST_VERSION;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_ID;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_LAST_MODIFIED_AT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.STREAM_LAST_VERSION;

import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.Result;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.conf.SettingsTools;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} on top of a relational database, see {@code enrollment_event_store.sql}.
 *
 * <p>The primary key {@code (stream_id, version)} is the compare-and-swap: two writers starting
 * from the same version both try to insert the same key and the database lets only one commit.
 * The loser's integrity violation is reported as {@link EnrollmentError.Concurrency}.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqEventStore.class);

  private final DSLContext dsl;
  private final Clock clock;
  private final EventCodec codec;

  /**
   * @param dsl to run statements with, must be able to open transactions
   * @param clock to stamp storage times with
   * @param codec to turn events into JSON and back
   * @param queryTimeout applied to every statement, rounded up to whole seconds
   */
  public JooqEventStore(
      final DSLContext dsl, final Clock clock, final EventCodec codec, final Duration queryTimeout) {
    if (dsl == null || clock == null || codec == null || queryTimeout == null) {
      throw new IllegalArgumentException("DSL, clock, codec and query timeout cannot be null");
    }

    final int timeoutSeconds = (int) Math.max(1, (queryTimeout.toMillis() + 999) / 1000);
    this.dsl =
        DSL.using(
            dsl.configuration()
                .derive(SettingsTools.clone(dsl.settings()).withQueryTimeout(timeoutSeconds)));
    this.clock = clock;
    this.codec = codec;
  }

  /** {@inheritDoc} */
  @Override
  public Result<StreamMetadata, EnrollmentError> append(
      final String streamId, final List<EnrollmentEvent> events, final long expectedVersion) {
    EventStore.checkAppendArguments(streamId, events, expectedVersion);

    try {
      return dsl.transactionResult(
          (final Configuration trx) ->
              appendInTransaction(trx.dsl(), streamId, events, expectedVersion));
    } catch (DataAccessException e) {
      // Only a moved stream version means another writer won the (stream_id, version) key
      final long actualVersion =
          e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION
              ? currentVersion(streamId)
              : expectedVersion;
      if (actualVersion != expectedVersion) {
        LOGGER.debug(
            "Concurrent append to '{}' lost: expected version {}, actual {}",
            streamId,
            expectedVersion,
            actualVersion);
        return Result.failure(
            new EnrollmentError.Concurrency(expectedVersion, actualVersion, streamId));
      }

      throw e;
    }
  }

  private Result<StreamMetadata, EnrollmentError> appendInTransaction(
      final DSLContext trx,
      final String streamId,
      final List<EnrollmentEvent> events,
      final long expectedVersion) {
    final long currentVersion = currentVersion(trx, streamId);
    if (currentVersion != expectedVersion) {
      LOGGER.debug(
          "Rejected append to '{}': expected version {}, actual {}",
          streamId,
          expectedVersion,
          currentVersion);
      return Result.failure(
          new EnrollmentError.Concurrency(expectedVersion, currentVersion, streamId));
    }

    final var stamped = EventStore.restamp(events, expectedVersion);
    final Instant now = clock.instant();
    final OffsetDateTime storedAt = toOffset(now);

    var insert =
        trx.insertInto(
            EVENTS,
            EVENT_STREAM_ID,
            EVENT_VERSION,
            EVENT_ID,
            EVENT_TYPE,
            EVENT_PAYLOAD,
            EVENT_OCCURRED_AT,
            EVENT_STORED_AT);
    for (EnrollmentEvent event : stamped) {
      insert =
          insert.values(
              streamId,
              event.version(),
              event.eventId(),
              event.kind().typeName(),
              codec.encodeEvent(event),
              toOffset(event.occurredAt()),
              storedAt);
    }
    insert.execute();

    final StreamMetadata metadata;
    if (expectedVersion == 0) {
      metadata = StreamMetadata.created(streamId, stamped.size(), now);
      trx.insertInto(
              STREAMS,
              STREAM_ID,
              STREAM_EVENT_COUNT,
              STREAM_FIRST_VERSION,
              STREAM_LAST_VERSION,
              STREAM_CREATED_AT,
              STREAM_LAST_MODIFIED_AT)
          .values(
              streamId,
              metadata.eventCount(),
              metadata.firstVersion(),
              metadata.lastVersion(),
              storedAt,
              storedAt)
          .execute();
    } else {
      metadata =
          readMetadata(trx, streamId)
              .orElseThrow(
                  () ->
                      new IllegalStateException(
                          "Stream '%s' has events but no metadata".formatted(streamId)))
              .advancedBy(stamped.size(), now);
      trx.update(STREAMS)
          .set(STREAM_EVENT_COUNT, metadata.eventCount())
          .set(STREAM_LAST_VERSION, metadata.lastVersion())
          .set(STREAM_LAST_MODIFIED_AT, storedAt)
          .where(STREAM_ID.eq(streamId))
          .execute();
    }

    LOGGER.debug(
        "Appended {} event(s) to '{}', now at version {}",
        stamped.size(),
        streamId,
        metadata.lastVersion());
    return Result.success(metadata);
  }

  /** {@inheritDoc} */
  @Override
  public List<EnrollmentEvent> readEvents(final String streamId, final long fromVersion) {
    return dsl.select(EVENT_PAYLOAD)
        .from(EVENTS)
        .where(EVENT_STREAM_ID.eq(streamId).and(EVENT_VERSION.ge(fromVersion)))
        .orderBy(EVENT_VERSION.asc())
        .fetch(EVENT_PAYLOAD)
        .stream()
        .map(codec::decodeEvent)
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    return currentVersion(dsl, streamId);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<StreamMetadata> metadata(final String streamId) {
    return readMetadata(dsl, streamId);
  }

  /** {@inheritDoc} */
  @Override
  public List<String> streamIds() {
    return dsl.select(STREAM_ID).from(STREAMS).orderBy(STREAM_ID.asc()).fetch(STREAM_ID);
  }

  private static long currentVersion(final DSLContext context, final String streamId) {
    final Long version =
        context
            .select(DSL.max(EVENT_VERSION))
            .from(EVENTS)
            .where(EVENT_STREAM_ID.eq(streamId))
            .fetchSingle()
            .value1();
    return version == null ? 0 : version;
  }

  private static Optional<StreamMetadata> readMetadata(
      final DSLContext context, final String streamId) {
    return context
        .select(
            STREAM_ID,
            STREAM_EVENT_COUNT,
            STREAM_FIRST_VERSION,
            STREAM_LAST_VERSION,
            STREAM_CREATED_AT,
            STREAM_LAST_MODIFIED_AT)
        .from(STREAMS)
        .where(STREAM_ID.eq(streamId))
        .fetchOptional()
        .map(JooqEventStore::toMetadata);
  }

  private static StreamMetadata toMetadata(final Record record) {
    return new StreamMetadata(
        record.get(STREAM_ID),
        record.get(STREAM_EVENT_COUNT),
        record.get(STREAM_FIRST_VERSION),
        record.get(STREAM_LAST_VERSION),
        record.get(STREAM_CREATED_AT).toInstant(),
        record.get(STREAM_LAST_MODIFIED_AT).toInstant());
  }

  private static OffsetDateTime toOffset(final Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }
}
