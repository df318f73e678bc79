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

import java.io.Serializable;

/**
 * Identity of an enrollment: one student in one course for one semester. Each identity owns
 * exactly one event stream.
 *
 * <p>Construction only rejects missing parts, format rules are checked by {@link
 * EnrollmentAggregate} so that they surface as {@link EnrollmentError.Validation} values.
 *
 * @param studentId such as {@code S12345}
 * @param courseId such as {@code CS101}
 * @param semester such as {@code 2025-fall}
 */
public record EnrollmentId(String studentId, String courseId, String semester)
    implements Serializable {
  public EnrollmentId {
    if (studentId == null || courseId == null || semester == null) {
      throw new IllegalArgumentException("Enrollment identity parts cannot be null");
    }
  }

  /**
   * @return compact public identifier, {@code studentId-courseId-semester}
   */
  public String key() {
    return "%s-%s-%s".formatted(studentId, courseId, semester);
  }

  @Override
  public String toString() {
    return key();
  }
}
