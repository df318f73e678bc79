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

import io.github.suppierk.enrollment.domain.Enrollment;
import java.time.Instant;

/**
 * Folded state of a stream at a given version. Events up to {@code version} need not be replayed
 * when loading from it.
 */
public record Snapshot(String streamId, long version, Enrollment state, Instant takenAt) {
  public Snapshot {
    if (streamId == null || state == null || takenAt == null) {
      throw new IllegalArgumentException("Snapshot parts cannot be null");
    }

    if (version != state.version()) {
      throw new IllegalArgumentException(
          "Snapshot version %d does not match state version %d".formatted(version, state.version()));
    }
  }
}
