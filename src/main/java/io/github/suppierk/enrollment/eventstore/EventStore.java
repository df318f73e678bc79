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

import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.Result;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of enrollment events, partitioned into streams.
 *
 * <p>For any stream, {@link #append(String, List, long)} is atomic: either every event is stored
 * with consecutive versions and the metadata reflects them, or nothing changes. Appends to
 * different streams never wait for each other.
 */
public interface EventStore {
  /**
   * Stores events if the stream is still at {@code expectedVersion}. Event {@code i} of the batch
   * is stored with version {@code expectedVersion + i + 1} whatever version it carried.
   *
   * @param streamId target stream
   * @param events to store, not empty
   * @param expectedVersion version the caller based its decision on, 0 for a new stream
   * @return metadata after the append, {@link EnrollmentError.Concurrency} if the stream moved on,
   *     {@link EnrollmentError.Timeout} if the stream could not be acquired in time
   * @throws IllegalArgumentException if the stream id is blank, the batch is empty or the
   *     expected version is negative
   */
  Result<StreamMetadata, EnrollmentError> append(
      final String streamId, final List<EnrollmentEvent> events, final long expectedVersion);

  /**
   * @param streamId to read
   * @param fromVersion first version to include, 1 for the whole stream
   * @return events in ascending version order, empty if the stream does not exist
   */
  List<EnrollmentEvent> readEvents(final String streamId, final long fromVersion);

  default List<EnrollmentEvent> readEvents(final String streamId) {
    return readEvents(streamId, 1);
  }

  /**
   * @param streamId to check
   * @return version of the last stored event, 0 if the stream does not exist
   */
  long currentVersion(final String streamId);

  default boolean exists(final String streamId) {
    return currentVersion(streamId) > 0;
  }

  Optional<StreamMetadata> metadata(final String streamId);

  /**
   * @return identifiers of all non-empty streams, sorted
   */
  List<String> streamIds();

  /**
   * Shared argument checks of {@link #append(String, List, long)}.
   *
   * @throws IllegalArgumentException if any argument is invalid
   */
  static void checkAppendArguments(
      final String streamId, final List<EnrollmentEvent> events, final long expectedVersion) {
    if (streamId == null || streamId.isBlank()) {
      throw new IllegalArgumentException("Stream id cannot be blank");
    }

    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("At least one event must be appended");
    }

    for (EnrollmentEvent event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Events cannot contain null");
      }
    }

    if (expectedVersion < 0) {
      throw new IllegalArgumentException(
          "Expected version cannot be negative, got %d".formatted(expectedVersion));
    }
  }

  /**
   * @param events to re-stamp
   * @param expectedVersion version the stream is at
   * @return copies carrying the versions they will occupy
   */
  static List<EnrollmentEvent> restamp(
      final List<EnrollmentEvent> events, final long expectedVersion) {
    final var stamped = new ArrayList<EnrollmentEvent>(events.size());
    for (int i = 0; i < events.size(); i++) {
      final var event = events.get(i);
      final long version = expectedVersion + i + 1;
      stamped.add(event.version() == version ? event : event.withVersion(version));
    }

    return List.copyOf(stamped);
  }
}
