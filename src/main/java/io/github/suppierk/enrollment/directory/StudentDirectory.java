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

/** Read-only view of the student records system. */
public interface StudentDirectory {
  /**
   * @param studentId to look up
   * @return standing of the student, empty if the student is unknown
   * @throws Exception if the directory could not be reached
   */
  @SuppressWarnings("squid:S112")
  Optional<StudentStatus> status(final String studentId) throws Exception;
}
