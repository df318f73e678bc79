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

import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.eventstore.StreamMetadata;
import java.util.List;
import java.util.Optional;

/** Loads and stores enrollments as event streams. */
public interface EnrollmentRepository {
  /**
   * @param id of the enrollment
   * @return current state, empty if the enrollment was never requested, an error if the stored
   *     stream is not a valid history
   */
  Result<Optional<Enrollment>, EnrollmentError> findByIdentity(final EnrollmentId id);

  /**
   * Appends the event that produced {@code state}.
   *
   * @param state after the event
   * @param event that produced the state, its version equals the state's
   * @return stream metadata after the append, {@link EnrollmentError.Concurrency} if another
   *     writer got there first
   */
  Result<StreamMetadata, EnrollmentError> save(final Enrollment state, final EnrollmentEvent event);

  /**
   * @return every stored event of the enrollment, in version order
   */
  List<EnrollmentEvent> readEventHistory(final EnrollmentId id);

  long currentVersion(final EnrollmentId id);

  default boolean exists(final EnrollmentId id) {
    return currentVersion(id) > 0;
  }
}
