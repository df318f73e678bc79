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
import io.github.suppierk.enrollment.async.DomainNotification;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable fact recorded in an enrollment stream. Once appended, an event is never changed or
 * removed; {@link #version()} is its 1-based position within the stream.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "eventType")
@JsonSubTypes({
  @JsonSubTypes.Type(value = EnrollmentEvent.Requested.class, name = "EnrollmentRequested"),
  @JsonSubTypes.Type(value = EnrollmentEvent.Approved.class, name = "EnrollmentApproved"),
  @JsonSubTypes.Type(value = EnrollmentEvent.Cancelled.class, name = "EnrollmentCancelled"),
  @JsonSubTypes.Type(value = EnrollmentEvent.Completed.class, name = "EnrollmentCompleted"),
  @JsonSubTypes.Type(value = EnrollmentEvent.Failed.class, name = "EnrollmentFailed")
})
public sealed interface EnrollmentEvent extends DomainNotification<UUID, Instant>
    permits EnrollmentEvent.Requested,
        EnrollmentEvent.Approved,
        EnrollmentEvent.Cancelled,
        EnrollmentEvent.Completed,
        EnrollmentEvent.Failed {
  UUID eventId();

  EnrollmentId enrollmentId();

  Instant occurredAt();

  long version();

  @JsonIgnore
  EventKind kind();

  /**
   * Stores re-stamp events with the version they actually occupy in the stream.
   *
   * @param version to assign
   * @return a copy of this event carrying the given version
   */
  EnrollmentEvent withVersion(long version);

  /** {@inheritDoc} */
  @Override
  default UUID messageId() {
    return eventId();
  }

  /** {@inheritDoc} */
  @Override
  default Instant createdAt() {
    return occurredAt();
  }

  private static void check(
      final UUID eventId,
      final EnrollmentId enrollmentId,
      final Instant occurredAt,
      final long version) {
    if (eventId == null || enrollmentId == null || occurredAt == null) {
      throw new IllegalArgumentException("Event id, enrollment id and timestamp are required");
    }

    if (version < 1) {
      throw new IllegalArgumentException("Event version must be positive, got %d".formatted(version));
    }
  }

  /**
   * Opens a stream.
   *
   * @param metadata free-form attributes supplied with the request
   */
  record Requested(
      UUID eventId,
      EnrollmentId enrollmentId,
      Instant occurredAt,
      long version,
      String correlationId,
      String causationId,
      Instant requestedAt,
      Map<String, String> metadata)
      implements EnrollmentEvent {
    public Requested {
      check(eventId, enrollmentId, occurredAt, version);
      if (requestedAt == null) {
        throw new IllegalArgumentException("Request timestamp is required");
      }
      metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public EventKind kind() {
      return EventKind.REQUESTED;
    }

    @Override
    public Requested withVersion(final long version) {
      return new Requested(
          eventId, enrollmentId, occurredAt, version, correlationId, causationId, requestedAt,
          metadata);
    }
  }

  record Approved(
      UUID eventId,
      EnrollmentId enrollmentId,
      Instant occurredAt,
      long version,
      String correlationId,
      String causationId,
      String approvedBy)
      implements EnrollmentEvent {
    public Approved {
      check(eventId, enrollmentId, occurredAt, version);
    }

    @Override
    public EventKind kind() {
      return EventKind.APPROVED;
    }

    @Override
    public Approved withVersion(final long version) {
      return new Approved(
          eventId, enrollmentId, occurredAt, version, correlationId, causationId, approvedBy);
    }
  }

  record Cancelled(
      UUID eventId,
      EnrollmentId enrollmentId,
      Instant occurredAt,
      long version,
      String correlationId,
      String causationId,
      String reason)
      implements EnrollmentEvent {
    public Cancelled {
      check(eventId, enrollmentId, occurredAt, version);
    }

    @Override
    public EventKind kind() {
      return EventKind.CANCELLED;
    }

    @Override
    public Cancelled withVersion(final long version) {
      return new Cancelled(
          eventId, enrollmentId, occurredAt, version, correlationId, causationId, reason);
    }
  }

  record Completed(
      UUID eventId,
      EnrollmentId enrollmentId,
      Instant occurredAt,
      long version,
      String correlationId,
      String causationId,
      String grade)
      implements EnrollmentEvent {
    public Completed {
      check(eventId, enrollmentId, occurredAt, version);
    }

    @Override
    public EventKind kind() {
      return EventKind.COMPLETED;
    }

    @Override
    public Completed withVersion(final long version) {
      return new Completed(
          eventId, enrollmentId, occurredAt, version, correlationId, causationId, grade);
    }
  }

  record Failed(
      UUID eventId,
      EnrollmentId enrollmentId,
      Instant occurredAt,
      long version,
      String correlationId,
      String causationId,
      String reason)
      implements EnrollmentEvent {
    public Failed {
      check(eventId, enrollmentId, occurredAt, version);
    }

    @Override
    public EventKind kind() {
      return EventKind.FAILED;
    }

    @Override
    public Failed withVersion(final long version) {
      return new Failed(
          eventId, enrollmentId, occurredAt, version, correlationId, causationId, reason);
    }
  }
}
