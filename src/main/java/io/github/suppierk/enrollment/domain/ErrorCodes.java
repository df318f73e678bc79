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

/** Stable error codes carried by {@link EnrollmentError}s. Callers may branch on them. */
public final class ErrorCodes {
  public static final String INVALID_STUDENT_ID = "INVALID_STUDENT_ID";
  public static final String INVALID_COURSE_ID = "INVALID_COURSE_ID";
  public static final String INVALID_SEMESTER = "INVALID_SEMESTER";
  public static final String INVALID_APPROVER = "INVALID_APPROVER";
  public static final String INVALID_COMMAND_FORMAT = "INVALID_COMMAND_FORMAT";
  public static final String INVALID_QUERY_FORMAT = "INVALID_QUERY_FORMAT";

  public static final String SEMESTER_OUT_OF_RANGE = "SEMESTER_OUT_OF_RANGE";
  public static final String INVALID_STATE_TRANSITION = "INVALID_STATE_TRANSITION";
  public static final String INVALID_EVENT_SEQUENCE = "INVALID_EVENT_SEQUENCE";
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  public static final String STUDENT_NOT_FOUND = "STUDENT_NOT_FOUND";
  public static final String STUDENT_NOT_ACTIVE = "STUDENT_NOT_ACTIVE";
  public static final String COURSE_NOT_FOUND = "COURSE_NOT_FOUND";
  public static final String COURSE_NOT_OFFERED = "COURSE_NOT_OFFERED";
  public static final String CAPACITY_EXCEEDED = "CAPACITY_EXCEEDED";
  public static final String DUPLICATE_REQUEST = "DUPLICATE_REQUEST";

  public static final String ENROLLMENT_NOT_FOUND = "ENROLLMENT_NOT_FOUND";
  public static final String CONCURRENCY_ERROR = "CONCURRENCY_ERROR";
  public static final String OPERATION_TIMED_OUT = "OPERATION_TIMED_OUT";

  private ErrorCodes() {
    // Constants only
  }
}
