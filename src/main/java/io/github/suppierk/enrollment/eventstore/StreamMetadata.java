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

import java.time.Instant;

/**
 * Bookkeeping of one stream, updated atomically with every append.
 *
 * @param eventCount number of stored events, equal to {@code lastVersion}
 * @param firstVersion always 1 for a non-empty stream
 */
public record StreamMetadata(
    String streamId,
    long eventCount,
    long firstVersion,
    long lastVersion,
    Instant createdAt,
    Instant lastModifiedAt) {

  /**
   * @param streamId of the new stream
   * @param eventCount events of the first append
   * @param at time of the first append
   * @return metadata of a stream created by its first append
   */
  static StreamMetadata created(final String streamId, final long eventCount, final Instant at) {
    return new StreamMetadata(streamId, eventCount, 1, eventCount, at, at);
  }

  /**
   * @param appended number of events just appended
   * @param at time of the append
   * @return metadata after the append
   */
  StreamMetadata advancedBy(final long appended, final Instant at) {
    return new StreamMetadata(
        streamId, eventCount + appended, firstVersion, lastVersion + appended, createdAt, at);
  }
}
