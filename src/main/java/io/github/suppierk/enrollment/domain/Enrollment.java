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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.io.Serializable;
import java.time.Instant;

/**
 * State of an enrollment as derived from its events. Every variant is immutable, a new event
 * always yields a new instance with {@link #version()} increased by one.
 *
 * <pre>
 * Requested ──► Approved ──► Completed
 *     │            ├───────► Failed
 *     └────────────┴───────► Cancelled
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "state")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Enrollment.Requested.class, name = "requested"),
  @JsonSubTypes.Type(value = Enrollment.Approved.class, name = "approved"),
  @JsonSubTypes.Type(value = Enrollment.Cancelled.class, name = "cancelled"),
  @JsonSubTypes.Type(value = Enrollment.Completed.class, name = "completed"),
  @JsonSubTypes.Type(value = Enrollment.Failed.class, name = "failed")
})
public sealed interface Enrollment extends Serializable
    permits Enrollment.Requested,
        Enrollment.Approved,
        Enrollment.Cancelled,
        Enrollment.Completed,
        Enrollment.Failed {
  EnrollmentId id();

  /**
   * @return number of events applied so far, starting at 1
   */
  long version();

  Instant requestedAt();

  EnrollmentStatus status();

  @JsonIgnore
  default boolean isTerminal() {
    return status().isTerminal();
  }

  record Requested(EnrollmentId id, long version, Instant requestedAt) implements Enrollment {
    @Override
    public EnrollmentStatus status() {
      return EnrollmentStatus.REQUESTED;
    }
  }

  record Approved(
      EnrollmentId id, long version, Instant requestedAt, Instant approvedAt, String approvedBy)
      implements Enrollment {
    @Override
    public EnrollmentStatus status() {
      return EnrollmentStatus.APPROVED;
    }
  }

  /**
   * @param priorApprovedAt set only when the enrollment had been approved before cancellation
   * @param priorApprovedBy set only when the enrollment had been approved before cancellation
   */
  record Cancelled(
      EnrollmentId id,
      long version,
      Instant requestedAt,
      Instant cancelledAt,
      String reason,
      Instant priorApprovedAt,
      String priorApprovedBy)
      implements Enrollment {
    @Override
    public EnrollmentStatus status() {
      return EnrollmentStatus.CANCELLED;
    }
  }

  record Completed(
      EnrollmentId id,
      long version,
      Instant requestedAt,
      Instant approvedAt,
      String approvedBy,
      Instant completedAt,
      String grade)
      implements Enrollment {
    @Override
    public EnrollmentStatus status() {
      return EnrollmentStatus.COMPLETED;
    }
  }

  record Failed(
      EnrollmentId id,
      long version,
      Instant requestedAt,
      Instant approvedAt,
      String approvedBy,
      Instant failedAt,
      String reason)
      implements Enrollment {
    @Override
    public EnrollmentStatus status() {
      return EnrollmentStatus.FAILED;
    }
  }
}
