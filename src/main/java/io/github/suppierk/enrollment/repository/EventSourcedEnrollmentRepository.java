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

package io.github.suppierk.enrollment.repository;

import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.eventstore.EventStore;
import io.github.suppierk.enrollment.eventstore.Snapshot;
import io.github.suppierk.enrollment.eventstore.SnapshotStore;
import io.github.suppierk.enrollment.eventstore.StreamMetadata;
import io.github.suppierk.java.Try;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EnrollmentRepository} composing an {@link EventStore}, the {@link EnrollmentAggregate}
 * fold and, when enabled, a {@link SnapshotStore}.
 */
public final class EventSourcedEnrollmentRepository implements EnrollmentRepository {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(EventSourcedEnrollmentRepository.class);

  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final EnrollmentAggregate aggregate;
  private final EnrollmentConfig.Storage storage;
  private final Clock clock;

  public EventSourcedEnrollmentRepository(
      final EventStore eventStore,
      final SnapshotStore snapshotStore,
      final EnrollmentAggregate aggregate,
      final EnrollmentConfig.Storage storage,
      final Clock clock) {
    if (eventStore == null
        || snapshotStore == null
        || aggregate == null
        || storage == null
        || clock == null) {
      throw new IllegalArgumentException("Repository collaborators cannot be null");
    }

    this.eventStore = eventStore;
    this.snapshotStore = snapshotStore;
    this.aggregate = aggregate;
    this.storage = storage;
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public Result<Optional<Enrollment>, EnrollmentError> findByIdentity(final EnrollmentId id) {
    final String streamId = StreamId.of(id);

    if (storage.snapshotsEnabled()) {
      final Optional<Snapshot> snapshot = snapshotStore.latest(streamId);
      if (snapshot.isPresent()) {
        final long from = snapshot.get().version() + 1;
        LOGGER.debug("Loading '{}' from snapshot at version {}", streamId, from - 1);
        return aggregate.reconstructFrom(
            snapshot.get().state(), eventStore.readEvents(streamId, from));
      }
    }

    return aggregate.reconstruct(eventStore.readEvents(streamId));
  }

  /** {@inheritDoc} */
  @Override
  public Result<StreamMetadata, EnrollmentError> save(
      final Enrollment state, final EnrollmentEvent event) {
    if (state == null || event == null) {
      throw new IllegalArgumentException("State and event cannot be null");
    }

    if (state.version() != event.version() || !state.id().equals(event.enrollmentId())) {
      throw new IllegalArgumentException(
          "Event %s v%d did not produce state %s v%d"
              .formatted(event.enrollmentId(), event.version(), state.id(), state.version()));
    }

    final String streamId = StreamId.of(state.id());
    final Result<StreamMetadata, EnrollmentError> appended =
        eventStore.append(streamId, List.of(event), state.version() - 1);

    appended.ifSuccess(
        metadata -> {
          if (storage.snapshotsEnabled()
              && metadata.lastVersion() % storage.snapshotInterval() == 0) {
            takeSnapshot(streamId, state);
          }
        });

    return appended;
  }

  /** {@inheritDoc} */
  @Override
  public List<EnrollmentEvent> readEventHistory(final EnrollmentId id) {
    return eventStore.readEvents(StreamId.of(id));
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final EnrollmentId id) {
    return eventStore.currentVersion(StreamId.of(id));
  }

  private void takeSnapshot(final String streamId, final Enrollment state) {
    final Try<Long> taken =
        Try.of(
            () -> {
              snapshotStore.save(new Snapshot(streamId, state.version(), state, clock.instant()));
              return state.version();
            });

    taken.ifSuccess(
        version -> LOGGER.debug("Snapshot of '{}' taken at version {}", streamId, version));
    taken.ifFailure(
        reason ->
            LOGGER.warn(
                "Snapshot of '{}' at version {} failed, loading will replay events",
                streamId,
                state.version(),
                reason));
  }
}
