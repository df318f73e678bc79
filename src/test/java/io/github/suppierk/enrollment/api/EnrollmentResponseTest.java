package io.github.suppierk.enrollment.api;

import static io.github.suppierk.test.Fixtures.ID;
import static io.github.suppierk.test.Fixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.test.Fixtures;
import org.junit.jupiter.api.Test;

class EnrollmentResponseTest {
  @Test
  void when_requested_then_only_common_fields_are_set() {
    final var response = EnrollmentResponse.from(new Enrollment.Requested(ID, 1, NOW));

    assertEquals("S12345-CS101-2025-fall", response.id());
    assertEquals("S12345", response.studentId());
    assertEquals("requested", response.status());
    assertEquals("2025-03-01T10:00:00Z", response.requestedAt());
    assertNull(response.approvedAt());
    assertNull(response.cancelledAt());
    assertNull(response.grade());
  }

  @Test
  void when_completed_then_approval_and_grade_are_set() {
    final var response =
        EnrollmentResponse.from(
            new Enrollment.Completed(
                ID, 3, NOW, NOW.plusSeconds(60), "registrar", NOW.plusSeconds(120), "A"));

    assertEquals("completed", response.status());
    assertEquals("2025-03-01T10:01:00Z", response.approvedAt());
    assertEquals("2025-03-01T10:02:00Z", response.completedAt());
    assertEquals("A", response.grade());
  }

  @Test
  void when_cancelled_before_approval_then_no_approval_is_shown() {
    final var response =
        EnrollmentResponse.from(
            new Enrollment.Cancelled(ID, 2, NOW, NOW.plusSeconds(5), "moved", null, null));

    assertEquals("cancelled", response.status());
    assertEquals("moved", response.cancelReason());
    assertNull(response.approvedBy());
  }

  @Test
  void when_event_is_described_then_type_specific_data_is_included() {
    final var requested = DomainEventResponse.from(Fixtures.requested(ID, 1));
    final var cancelled = DomainEventResponse.from(Fixtures.cancelled(ID, 2));

    assertEquals("EnrollmentRequested", requested.eventType());
    assertEquals("2025-fall", requested.data().get("semester"));
    assertEquals("corr-1", requested.correlationId());
    assertFalse(requested.data().containsKey("reason"));
    assertEquals("schedule conflict", cancelled.data().get("reason"));
    assertEquals(2L, cancelled.version());
  }
}
