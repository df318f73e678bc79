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

import java.util.Optional;

/** Keeps snapshots next to an {@link EventStore}. Losing a snapshot only costs replay time. */
public interface SnapshotStore {
  /**
   * Stores a snapshot. Saving the same stream and version twice keeps the first one.
   *
   * @param snapshot to store
   */
  void save(final Snapshot snapshot);

  /**
   * @param streamId to look up
   * @return the snapshot with the highest version, if any
   */
  Optional<Snapshot> latest(final String streamId);

  /**
   * @return number of stored snapshots
   */
  long count();
}
