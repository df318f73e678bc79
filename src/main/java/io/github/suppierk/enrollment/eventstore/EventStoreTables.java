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

import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Tables of {@code enrollment_event_store.sql}, declared with plain DSL names so that no code
 * generation is needed.
 */
final class EventStoreTables {
  static final Table<Record> EVENTS = DSL.table(DSL.name("enrollment_events"));
  static final Field<String> EVENT_STREAM_ID =
      DSL.field(DSL.name("enrollment_events", "stream_id"), SQLDataType.VARCHAR(255));
  static final Field<Long> EVENT_VERSION =
      DSL.field(DSL.name("enrollment_events", "version"), SQLDataType.BIGINT);
  static final Field<UUID> EVENT_ID =
      DSL.field(DSL.name("enrollment_events", "event_id"), SQLDataType.UUID);
  static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("enrollment_events", "event_type"), SQLDataType.VARCHAR(64));
  static final Field<String> EVENT_PAYLOAD =
      DSL.field(DSL.name("enrollment_events", "payload"), SQLDataType.VARCHAR);
  static final Field<OffsetDateTime> EVENT_OCCURRED_AT =
      DSL.field(
          DSL.name("enrollment_events", "occurred_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  static final Field<OffsetDateTime> EVENT_STORED_AT =
      DSL.field(DSL.name("enrollment_events", "stored_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  static final Table<Record> STREAMS = DSL.table(DSL.name("enrollment_streams"));
  static final Field<String> STREAM_ID =
      DSL.field(DSL.name("enrollment_streams", "stream_id"), SQLDataType.VARCHAR(255));
  static final Field<Long> STREAM_EVENT_COUNT =
      DSL.field(DSL.name("enrollment_streams", "event_count"), SQLDataType.BIGINT);
  static final Field<Long> STREAM_FIRST_VERSION =
      DSL.field(DSL.name("enrollment_streams", "first_version"), SQLDataType.BIGINT);
  static final Field<Long> STREAM_LAST_VERSION =
      DSL.field(DSL.name("enrollment_streams", "last_version"), SQLDataType.BIGINT);
  static final Field<OffsetDateTime> STREAM_CREATED_AT =
      DSL.field(DSL.name("enrollment_streams", "created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
  static final Field<OffsetDateTime> STREAM_LAST_MODIFIED_AT =
      DSL.field(
          DSL.name("enrollment_streams", "last_modified_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  static final Table<Record> SNAPSHOTS = DSL.table(DSL.name("enrollment_snapshots"));
  static final Field<String> SNAPSHOT_STREAM_ID =
      DSL.field(DSL.name("enrollment_snapshots", "stream_id"), SQLDataType.VARCHAR(255));
  static final Field<Long> SNAPSHOT_VERSION =
      DSL.field(DSL.name("enrollment_snapshots", "version"), SQLDataType.BIGINT);
  static final Field<String> SNAPSHOT_STATE =
      DSL.field(DSL.name("enrollment_snapshots", "state"), SQLDataType.VARCHAR);
  static final Field<OffsetDateTime> SNAPSHOT_TAKEN_AT =
      DSL.field(DSL.name("enrollment_snapshots", "taken_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  private EventStoreTables() {
    // Constants only
  }
}
