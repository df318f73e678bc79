package io.github.suppierk.enrollment.command;

import static io.github.suppierk.test.Fixtures.CLOCK;
import static io.github.suppierk.test.Fixtures.CONFIG;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.enrollment.EnrollmentContextFactory;
import io.github.suppierk.enrollment.async.DomainNotification;
import io.github.suppierk.enrollment.async.NotificationSink;
import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.cqrs.EnrollmentContext;
import io.github.suppierk.enrollment.directory.CourseCapacity;
import io.github.suppierk.enrollment.directory.StudentStatus;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import io.github.suppierk.test.FakeCourseCatalog;
import io.github.suppierk.test.FakeStudentDirectory;
import io.github.suppierk.test.RecordingEventPublisher;
import io.github.suppierk.test.RecordingNotificationSink;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RequestEnrollmentHandlerTest {
  private FakeStudentDirectory students;
  private FakeCourseCatalog courses;
  private RecordingEventPublisher publisher;
  private RecordingNotificationSink notifications;

  @BeforeEach
  void setUp() {
    students =
        new FakeStudentDirectory()
            .with("S12345", StudentStatus.ACTIVE)
            .with("S20000", StudentStatus.GRADUATED);
    courses =
        new FakeCourseCatalog()
            .offering("CS101", "2025-fall", new CourseCapacity(30, 12))
            .offering("CS999", "2025-fall", new CourseCapacity(20, 20))
            .course("MA201");
    publisher = new RecordingEventPublisher();
    notifications = new RecordingNotificationSink();
  }

  private EnrollmentContext context(final EnrollmentConfig config) {
    return new EnrollmentContextFactory(config, CLOCK, students, courses, publisher, notifications)
        .inMemory();
  }

  private EnrollmentContext context() {
    return context(CONFIG);
  }

  @Nested
  class Accepted {
    @Test
    void when_prerequisites_hold_then_enrollment_is_requested_and_announced() {
      final var response =
          context().execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).orElseThrow();

      assertEquals("S12345-CS101-2025-fall", response.id());
      assertEquals("requested", response.status());
      assertEquals(1L, response.version());
      assertEquals("2025-03-01T10:00:00Z", response.requestedAt());
      assertNull(response.approvedAt());

      assertEquals(1, publisher.published().size());
      assertInstanceOf(EnrollmentEvent.Requested.class, publisher.published().get(0));
      assertEquals(publisher.published(), notifications.delivered());
    }

    @Test
    void when_no_causation_is_given_then_message_id_is_recorded_as_cause() {
      final var messageId = UUID.randomUUID();
      final var command =
          new RequestEnrollment(
              messageId,
              null,
              null,
              "S12345",
              "CS101",
              "2025-fall",
              Map.of("channel", "portal"),
              "corr-42",
              null);

      context().execute(command).orElseThrow();

      final var event = (EnrollmentEvent.Requested) publisher.published().get(0);
      assertEquals(messageId.toString(), event.causationId());
      assertEquals("corr-42", event.correlationId());
      assertEquals(Map.of("channel", "portal"), event.metadata());
    }

    @Test
    void when_capacity_is_unknown_then_request_is_accepted() {
      courses.offering("CS202", "2025-fall", null);

      assertTrue(context().execute(RequestEnrollment.of("S12345", "CS202", "2025-fall")).isSuccess());
    }

    @Test
    void when_publisher_fails_then_command_still_succeeds_and_sink_is_served() {
      publisher.broken();

      final var result = context().execute(RequestEnrollment.of("S12345", "CS101", "2025-fall"));

      assertTrue(result.isSuccess());
      assertEquals(1, notifications.delivered().size());
    }

    @Test
    void when_sink_fails_then_command_still_succeeds() {
      final NotificationSink failing =
          new NotificationSink() {
            @Override
            public <N extends DomainNotification<?, ?>> void deliver(final N notification) {
              throw new IllegalStateException("Mailer unavailable");
            }
          };
      final var context =
          new EnrollmentContextFactory(CONFIG, CLOCK, students, courses, publisher, failing)
              .inMemory();

      assertTrue(context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).isSuccess());
      assertEquals(1, publisher.published().size());
    }
  }

  @Nested
  class Rejected {
    @Test
    void when_student_id_is_blank_then_invalid_command_format() {
      final var error =
          context().execute(RequestEnrollment.of(" ", "CS101", "2025-fall")).errorOrThrow();

      assertEquals("ValidationError", error.kind());
      assertEquals(ErrorCodes.INVALID_COMMAND_FORMAT, error.code());
      assertEquals("studentId", error.field());
      assertTrue(publisher.published().isEmpty());
    }

    @Test
    void when_semester_is_malformed_then_invalid_command_format() {
      final var error =
          context().execute(RequestEnrollment.of("S12345", "CS101", "fall-2025")).errorOrThrow();

      assertEquals(ErrorCodes.INVALID_COMMAND_FORMAT, error.code());
      assertEquals("semester", error.field());
      assertEquals("fall-2025", error.value());
    }

    @Test
    void when_semester_is_out_of_window_then_business_rule_error() {
      courses.offering("CS101", "2020-fall", null);

      final var error =
          context().execute(RequestEnrollment.of("S12345", "CS101", "2020-fall")).errorOrThrow();

      assertEquals(ErrorCodes.SEMESTER_OUT_OF_RANGE, error.code());
    }

    @Test
    void when_student_is_unknown_then_student_not_found() {
      final var error =
          context().execute(RequestEnrollment.of("S77777", "CS101", "2025-fall")).errorOrThrow();

      assertEquals("BusinessRuleError", error.kind());
      assertEquals(ErrorCodes.STUDENT_NOT_FOUND, error.code());
      assertEquals("STUDENT_ELIGIBILITY", error.rule());
    }

    @Test
    void when_student_has_graduated_then_student_not_active() {
      final var error =
          context().execute(RequestEnrollment.of("S20000", "CS101", "2025-fall")).errorOrThrow();

      assertEquals(ErrorCodes.STUDENT_NOT_ACTIVE, error.code());
      assertEquals("GRADUATED", error.context().get("status"));
    }

    @Test
    void when_course_is_unknown_then_course_not_found() {
      assertEquals(
          ErrorCodes.COURSE_NOT_FOUND,
          context().execute(RequestEnrollment.of("S12345", "PH100", "2025-fall")).errorOrThrow()
              .code());
    }

    @Test
    void when_course_is_not_offered_in_semester_then_course_not_offered() {
      assertEquals(
          ErrorCodes.COURSE_NOT_OFFERED,
          context().execute(RequestEnrollment.of("S12345", "MA201", "2025-fall")).errorOrThrow()
              .code());
    }

    @Test
    void when_course_is_full_then_capacity_exceeded() {
      final var error =
          context().execute(RequestEnrollment.of("S12345", "CS999", "2025-fall")).errorOrThrow();

      assertEquals(ErrorCodes.CAPACITY_EXCEEDED, error.code());
      assertEquals("COURSE_CAPACITY", error.rule());
      assertEquals(20, error.context().get("max"));
      assertEquals(20, error.context().get("current"));
    }

    @Test
    void when_enrollment_already_exists_then_duplicate_request_and_nothing_is_appended() {
      final var context = context();
      context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).orElseThrow();

      final var error =
          context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).errorOrThrow();

      assertEquals(ErrorCodes.DUPLICATE_REQUEST, error.code());
      assertEquals("UNIQUE_ENROLLMENT", error.rule());
      assertEquals("requested", error.context().get("existingStatus"));
      assertEquals(1, publisher.published().size());
    }

    @Test
    void when_duplicates_are_allowed_then_store_rejects_second_stream_start() {
      final var context =
          context(CONFIG.withBusinessRules(new EnrollmentConfig.BusinessRules(true)));
      context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).orElseThrow();

      final var error =
          context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).errorOrThrow();

      assertEquals("ConcurrencyError", error.kind());
      assertEquals(ErrorCodes.CONCURRENCY_ERROR, error.code());
      assertEquals(0L, error.expectedVersion());
      assertEquals(1L, error.actualVersion());
    }

    @Test
    void when_student_directory_is_down_then_exception_reaches_caller() {
      students.unreachable();
      final var context = context();

      assertThrows(
          Exception.class,
          () -> context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")));
      assertTrue(publisher.published().isEmpty());
    }
  }
}
