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
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference {@link EventStore} keeping streams in memory.
 *
 * <p>Every stream has its own lock which serializes appends; readers never lock and see either
 * the stream before or after an append, because an append publishes the new immutable event list
 * together with its metadata through a single volatile write.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final ConcurrentHashMap<String, StreamState> streams = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration lockTimeout;

  /**
   * @param clock to stamp metadata with
   * @param lockTimeout how long an append may wait for the stream lock
   */
  public InMemoryEventStore(final Clock clock, final Duration lockTimeout) {
    if (clock == null || lockTimeout == null) {
      throw new IllegalArgumentException("Clock and lock timeout cannot be null");
    }

    this.clock = clock;
    this.lockTimeout = lockTimeout;
  }

  /** {@inheritDoc} */
  @Override
  public Result<StreamMetadata, EnrollmentError> append(
      final String streamId, final List<EnrollmentEvent> events, final long expectedVersion) {
    EventStore.checkAppendArguments(streamId, events, expectedVersion);

    final StreamState stream = streams.computeIfAbsent(streamId, ignored -> new StreamState());

    try {
      if (!stream.lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Timed out waiting {} ms for stream '{}'", lockTimeout.toMillis(), streamId);
        return Result.failure(new EnrollmentError.Timeout("append " + streamId, lockTimeout));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Result.failure(new EnrollmentError.Timeout("append " + streamId, lockTimeout));
    }

    try {
      final Contents contents = stream.contents;
      final long currentVersion = contents.events().size();
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
      final var combined =
          new ArrayList<EnrollmentEvent>(contents.events().size() + stamped.size());
      combined.addAll(contents.events());
      combined.addAll(stamped);

      final var now = clock.instant();
      final StreamMetadata metadata =
          contents.metadata() == null
              ? StreamMetadata.created(streamId, stamped.size(), now)
              : contents.metadata().advancedBy(stamped.size(), now);

      stream.contents = new Contents(List.copyOf(combined), metadata);

      LOGGER.debug(
          "Appended {} event(s) to '{}', now at version {}",
          stamped.size(),
          streamId,
          metadata.lastVersion());
      return Result.success(metadata);
    } finally {
      stream.lock.unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<EnrollmentEvent> readEvents(final String streamId, final long fromVersion) {
    final StreamState stream = streams.get(streamId);
    if (stream == null) {
      return List.of();
    }

    final var events = stream.contents.events();
    final int from = (int) Math.max(0, Math.min(events.size(), fromVersion - 1));
    return events.subList(from, events.size());
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    final StreamState stream = streams.get(streamId);
    return stream == null ? 0 : stream.contents.events().size();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<StreamMetadata> metadata(final String streamId) {
    final StreamState stream = streams.get(streamId);
    return stream == null ? Optional.empty() : Optional.ofNullable(stream.contents.metadata());
  }

  /** {@inheritDoc} */
  @Override
  public List<String> streamIds() {
    return streams.entrySet().stream()
        .filter(entry -> !entry.getValue().contents.events().isEmpty())
        .map(Map.Entry::getKey)
        .sorted()
        .toList();
  }

  /**
   * @return counts over every stream, for diagnostics
   */
  public Statistics statistics() {
    long totalStreams = 0;
    long totalEvents = 0;
    for (StreamState stream : streams.values()) {
      final int size = stream.contents.events().size();
      if (size > 0) {
        totalStreams++;
        totalEvents += size;
      }
    }

    return new Statistics(totalStreams, totalEvents);
  }

  /** Drops every stream. Meant for tests. */
  public void clear() {
    streams.clear();
  }

  public record Statistics(long totalStreams, long totalEvents) {}

  private static final class StreamState {
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Contents contents = Contents.EMPTY;
  }

  /** Events of a stream and the metadata describing exactly them; metadata is null when empty. */
  private record Contents(List<EnrollmentEvent> events, StreamMetadata metadata) {
    private static final Contents EMPTY = new Contents(List.of(), null);
  }
}
