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

package io.github.suppierk.enrollment.api;

import io.github.suppierk.enrollment.domain.Enrollment;
import java.time.Instant;

/**
 * Client-facing view of an enrollment. Optional fields are {@code null} unless the enrollment has
 * reached the corresponding state; timestamps are ISO-8601 strings.
 *
 * @param id {@code studentId-courseId-semester}
 * @param status lower-case state name
 */
public record EnrollmentResponse(
    String id,
    String studentId,
    String courseId,
    String semester,
    String status,
    long version,
    String requestedAt,
    String approvedAt,
    String approvedBy,
    String cancelledAt,
    String cancelReason,
    String completedAt,
    String grade,
    String failedAt,
    String failureReason) {

  public static EnrollmentResponse from(final Enrollment state) {
    if (state == null) {
      throw new IllegalArgumentException("State cannot be null");
    }

    final var builder = new Builder(state);
    switch (state.status()) {
      case REQUESTED -> {
        // Nothing beyond the common fields
      }
      case APPROVED -> {
        final var approved = (Enrollment.Approved) state;
        builder.approvedAt = iso(approved.approvedAt());
        builder.approvedBy = approved.approvedBy();
      }
      case CANCELLED -> {
        final var cancelled = (Enrollment.Cancelled) state;
        builder.approvedAt = iso(cancelled.priorApprovedAt());
        builder.approvedBy = cancelled.priorApprovedBy();
        builder.cancelledAt = iso(cancelled.cancelledAt());
        builder.cancelReason = cancelled.reason();
      }
      case COMPLETED -> {
        final var completed = (Enrollment.Completed) state;
        builder.approvedAt = iso(completed.approvedAt());
        builder.approvedBy = completed.approvedBy();
        builder.completedAt = iso(completed.completedAt());
        builder.grade = completed.grade();
      }
      case FAILED -> {
        final var failed = (Enrollment.Failed) state;
        builder.approvedAt = iso(failed.approvedAt());
        builder.approvedBy = failed.approvedBy();
        builder.failedAt = iso(failed.failedAt());
        builder.failureReason = failed.reason();
      }
    }

    return builder.build();
  }

  private static String iso(final Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static final class Builder {
    private final Enrollment state;
    private String approvedAt;
    private String approvedBy;
    private String cancelledAt;
    private String cancelReason;
    private String completedAt;
    private String grade;
    private String failedAt;
    private String failureReason;

    private Builder(final Enrollment state) {
      this.state = state;
    }

    private EnrollmentResponse build() {
      final var id = state.id();
      return new EnrollmentResponse(
          id.key(),
          id.studentId(),
          id.courseId(),
          id.semester(),
          state.status().label(),
          state.version(),
          iso(state.requestedAt()),
          approvedAt,
          approvedBy,
          cancelledAt,
          cancelReason,
          completedAt,
          grade,
          failedAt,
          failureReason);
    }
  }
}
