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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** {@link SnapshotStore} companion of {@link InMemoryEventStore}. */
public final class InMemorySnapshotStore implements SnapshotStore {
  private final Map<String, ConcurrentNavigableMap<Long, Snapshot>> snapshots =
      new ConcurrentHashMap<>();

  @Override
  public void save(final Snapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }

    snapshots
        .computeIfAbsent(snapshot.streamId(), ignored -> new ConcurrentSkipListMap<>())
        .putIfAbsent(snapshot.version(), snapshot);
  }

  @Override
  public Optional<Snapshot> latest(final String streamId) {
    final var byVersion = snapshots.get(streamId);
    if (byVersion == null || byVersion.isEmpty()) {
      return Optional.empty();
    }

    return Optional.ofNullable(byVersion.lastEntry()).map(Map.Entry::getValue);
  }

  @Override
  public long count() {
    return snapshots.values().stream().mapToLong(Map::size).sum();
  }

  public void clear() {
    snapshots.clear();
  }
}
