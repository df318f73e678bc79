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

package io.github.suppierk.enrollment.domain;

/**
 * A new state together with the event that produced it. Both are persisted together or not at
 * all.
 */
public record StateChange(Enrollment state, EnrollmentEvent event) {
  public StateChange {
    if (state == null || event == null) {
      throw new IllegalArgumentException("State and event cannot be null");
    }

    if (state.version() != event.version()) {
      throw new IllegalArgumentException(
          "State version %d does not match event version %d"
              .formatted(state.version(), event.version()));
    }
  }
}
