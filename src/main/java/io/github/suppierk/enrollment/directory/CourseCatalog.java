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

package io.github.suppierk.enrollment.directory;

import java.util.Optional;

/** Read-only view of the course catalog. */
@SuppressWarnings("squid:S112")
public interface CourseCatalog {
  boolean exists(final String courseId) throws Exception;

  boolean isOfferedInSemester(final String courseId, final String semester) throws Exception;

  /**
   * @return seats of the course in the semester, empty if the catalog does not track them
   */
  Optional<CourseCapacity> capacity(final String courseId, final String semester) throws Exception;
}
