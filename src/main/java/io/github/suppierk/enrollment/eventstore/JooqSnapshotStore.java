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

import static io.github.suppierk.enrollment.eventstore.EventStoreTables.SNAPSHOTS;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.SNAPSHOT_STATE;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.SNAPSHOT_STREAM_ID;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.SNAPSHOT_TAKEN_AT;
import static io.github.suppierk.enrollment.eventstore.EventStoreTables.SNAPSHOT_VERSION;

import java.time.ZoneOffset;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;

/** {@link SnapshotStore} companion of {@link JooqEventStore}, stores states as JSON. */
public final class JooqSnapshotStore implements SnapshotStore {
  private final DSLContext dsl;
  private final EventCodec codec;

  public JooqSnapshotStore(final DSLContext dsl, final EventCodec codec) {
    if (dsl == null || codec == null) {
      throw new IllegalArgumentException("DSL and codec cannot be null");
    }

    this.dsl = dsl;
    this.codec = codec;
  }

  @Override
  public void save(final Snapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }

    dsl.transaction(
        (final Configuration trx) -> {
          final boolean present =
              trx.dsl()
                  .fetchExists(
                      SNAPSHOTS,
                      SNAPSHOT_STREAM_ID
                          .eq(snapshot.streamId())
                          .and(SNAPSHOT_VERSION.eq(snapshot.version())));
          if (present) {
            return;
          }

          trx.dsl()
              .insertInto(
                  SNAPSHOTS, SNAPSHOT_STREAM_ID, SNAPSHOT_VERSION, SNAPSHOT_STATE, SNAPSHOT_TAKEN_AT)
              .values(
                  snapshot.streamId(),
                  snapshot.version(),
                  codec.encodeState(snapshot.state()),
                  snapshot.takenAt().atOffset(ZoneOffset.UTC))
              .execute();
        });
  }

  @Override
  public Optional<Snapshot> latest(final String streamId) {
    return dsl.select(SNAPSHOT_STREAM_ID, SNAPSHOT_VERSION, SNAPSHOT_STATE, SNAPSHOT_TAKEN_AT)
        .from(SNAPSHOTS)
        .where(SNAPSHOT_STREAM_ID.eq(streamId))
        .orderBy(SNAPSHOT_VERSION.desc())
        .limit(1)
        .fetchOptional()
        .map(
            record ->
                new Snapshot(
                    record.value1(),
                    record.value2(),
                    codec.decodeState(record.value3()),
                    record.value4().toInstant()));
  }

  @Override
  public long count() {
    return dsl.fetchCount(SNAPSHOTS);
  }
}
