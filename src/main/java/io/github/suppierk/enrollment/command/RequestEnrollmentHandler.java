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

package io.github.suppierk.enrollment.command;

import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.cqrs.CommandDependencies;
import io.github.suppierk.enrollment.cqrs.DomainCommandHandler;
import io.github.suppierk.enrollment.directory.CourseCapacity;
import io.github.suppierk.enrollment.directory.CourseCatalog;
import io.github.suppierk.enrollment.directory.StudentDirectory;
import io.github.suppierk.enrollment.directory.StudentStatus;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import io.github.suppierk.enrollment.domain.Result;
import java.util.Map;
import java.util.Optional;

/**
 * Opens an enrollment once the student is active and the course is offered with free seats in the
 * requested semester.
 */
public final class RequestEnrollmentHandler
    extends DomainCommandHandler.Create<RequestEnrollment> {
  static final String STUDENT_ELIGIBILITY_RULE = "STUDENT_ELIGIBILITY";
  static final String COURSE_AVAILABILITY_RULE = "COURSE_AVAILABILITY";
  static final String COURSE_CAPACITY_RULE = "COURSE_CAPACITY";

  private final StudentDirectory students;
  private final CourseCatalog courses;

  public RequestEnrollmentHandler(
      final CommandDependencies dependencies,
      final EnrollmentConfig.BusinessRules businessRules,
      final StudentDirectory students,
      final CourseCatalog courses) {
    super(RequestEnrollment.class, dependencies, businessRules);
    this.students = throwIllegalArgumentIfNull(students, "Student directory");
    this.courses = throwIllegalArgumentIfNull(courses, "Course catalog");
  }

  /** {@inheritDoc} */
  @Override
  protected Result<EnrollmentId, EnrollmentError> checkPrerequisites(
      final RequestEnrollment command, final EnrollmentId id) throws Exception {
    final Optional<StudentStatus> status = students.status(id.studentId());
    if (status.isEmpty()) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              STUDENT_ELIGIBILITY_RULE,
              ErrorCodes.STUDENT_NOT_FOUND,
              "Student %s does not exist".formatted(id.studentId()),
              Map.of("studentId", id.studentId())));
    }

    if (status.get() != StudentStatus.ACTIVE) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              STUDENT_ELIGIBILITY_RULE,
              ErrorCodes.STUDENT_NOT_ACTIVE,
              "Student %s is not active".formatted(id.studentId()),
              Map.of("studentId", id.studentId(), "status", status.get().name())));
    }

    if (!courses.exists(id.courseId())) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              COURSE_AVAILABILITY_RULE,
              ErrorCodes.COURSE_NOT_FOUND,
              "Course %s does not exist".formatted(id.courseId()),
              Map.of("courseId", id.courseId())));
    }

    if (!courses.isOfferedInSemester(id.courseId(), id.semester())) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              COURSE_AVAILABILITY_RULE,
              ErrorCodes.COURSE_NOT_OFFERED,
              "Course %s is not offered in %s".formatted(id.courseId(), id.semester()),
              Map.of("courseId", id.courseId(), "semester", id.semester())));
    }

    final Optional<CourseCapacity> capacity = courses.capacity(id.courseId(), id.semester());
    if (capacity.isPresent() && capacity.get().isFull()) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              COURSE_CAPACITY_RULE,
              ErrorCodes.CAPACITY_EXCEEDED,
              "Course %s has no free seats in %s".formatted(id.courseId(), id.semester()),
              Map.of(
                  "courseId", id.courseId(),
                  "max", capacity.get().max(),
                  "current", capacity.get().current())));
    }

    return Result.success(id);
  }
}
