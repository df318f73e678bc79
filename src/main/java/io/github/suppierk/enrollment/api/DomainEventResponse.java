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

import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an enrollment's history.
 *
 * @param eventType such as {@code EnrollmentApproved}
 * @param data payload specific to the event type, absent values are left out
 */
public record DomainEventResponse(
    String eventId,
    String eventType,
    String studentId,
    String courseId,
    String semester,
    String occurredAt,
    long version,
    String correlationId,
    String causationId,
    Map<String, Object> data) {

  public static DomainEventResponse from(final EnrollmentEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final Map<String, Object> data = new LinkedHashMap<>();
    switch (event.kind()) {
      case REQUESTED -> {
        final var requested = (EnrollmentEvent.Requested) event;
        data.put("semester", requested.enrollmentId().semester());
        data.put("requestedAt", requested.requestedAt().toString());
        if (!requested.metadata().isEmpty()) {
          data.put("metadata", requested.metadata());
        }
      }
      case APPROVED -> putIfPresent(
          data, "approvedBy", ((EnrollmentEvent.Approved) event).approvedBy());
      case CANCELLED -> putIfPresent(data, "reason", ((EnrollmentEvent.Cancelled) event).reason());
      case COMPLETED -> putIfPresent(data, "grade", ((EnrollmentEvent.Completed) event).grade());
      case FAILED -> putIfPresent(data, "reason", ((EnrollmentEvent.Failed) event).reason());
    }

    final var id = event.enrollmentId();
    return new DomainEventResponse(
        event.eventId().toString(),
        event.kind().typeName(),
        id.studentId(),
        id.courseId(),
        id.semester(),
        event.occurredAt().toString(),
        event.version(),
        event.correlationId(),
        event.causationId(),
        Collections.unmodifiableMap(data));
  }

  private static void putIfPresent(
      final Map<String, Object> data, final String key, final Object value) {
    if (value != null) {
      data.put(key, value);
    }
  }
}
