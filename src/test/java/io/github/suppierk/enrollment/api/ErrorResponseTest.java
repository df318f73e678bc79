package io.github.suppierk.enrollment.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorResponseTest {
  private static final Instant AT = Instant.parse("2025-03-01T10:00:00Z");

  @Test
  void when_validation_error_then_field_and_value_are_exposed() {
    final var response =
        ErrorResponse.from(
            new EnrollmentError.Validation(
                ErrorCodes.INVALID_STUDENT_ID, "studentId", "s1", "bad", AT));

    assertEquals("ValidationError", response.kind());
    assertEquals(ErrorCodes.INVALID_STUDENT_ID, response.code());
    assertEquals("studentId", response.field());
    assertEquals("s1", response.value());
    assertEquals("2025-03-01T10:00:00Z", response.timestamp());
    assertNull(response.rule());
  }

  @Test
  void when_business_rule_error_then_rule_and_context_are_exposed() {
    final var response =
        ErrorResponse.from(
            new EnrollmentError.BusinessRule(
                "COURSE_CAPACITY", ErrorCodes.CAPACITY_EXCEEDED, "full", Map.of("max", 3), AT));

    assertEquals("BusinessRuleError", response.kind());
    assertEquals("COURSE_CAPACITY", response.rule());
    assertEquals(Map.of("max", 3), response.context());
  }

  @Test
  void when_not_found_error_then_entity_is_exposed() {
    final var response =
        ErrorResponse.from(
            new EnrollmentError.NotFound(
                "Enrollment", "S1-C1-2025-fall", ErrorCodes.ENROLLMENT_NOT_FOUND, AT));

    assertEquals("NotFoundError", response.kind());
    assertEquals("Enrollment with id S1-C1-2025-fall not found", response.message());
    assertEquals("S1-C1-2025-fall", response.entityId());
  }

  @Test
  void when_concurrency_error_then_versions_are_exposed() {
    final var response =
        ErrorResponse.from(new EnrollmentError.Concurrency(1, 3, "enrollment-S1-C1-2025-fall", AT));

    assertEquals("ConcurrencyError", response.kind());
    assertEquals(ErrorCodes.CONCURRENCY_ERROR, response.code());
    assertEquals("Optimistic lock failure. Expected version 1, but was 3", response.message());
    assertEquals(1L, response.expectedVersion());
    assertEquals(3L, response.actualVersion());
    assertEquals("enrollment-S1-C1-2025-fall", response.entityId());
  }

  @Test
  void when_timeout_error_then_operation_and_limit_are_exposed() {
    final var response =
        ErrorResponse.from(new EnrollmentError.Timeout("append s", Duration.ofMillis(250), AT));

    assertEquals("TimeoutError", response.kind());
    assertEquals(ErrorCodes.OPERATION_TIMED_OUT, response.code());
    assertEquals("append s", response.context().get("operation"));
    assertEquals(250L, response.context().get("timeoutMs"));
  }

  @Test
  void when_error_is_null_then_throws() {
    assertThrows(IllegalArgumentException.class, () -> ErrorResponse.from(null));
  }
}
