package io.github.suppierk.enrollment;

import static io.github.suppierk.test.Fixtures.CLOCK;
import static io.github.suppierk.test.Fixtures.CONFIG;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.enrollment.api.DomainEventResponse;
import io.github.suppierk.enrollment.api.EnrollmentResponse;
import io.github.suppierk.enrollment.async.NotificationSink;
import io.github.suppierk.enrollment.authorization.StaffDomainClient;
import io.github.suppierk.enrollment.command.ApproveEnrollment;
import io.github.suppierk.enrollment.command.CancelEnrollment;
import io.github.suppierk.enrollment.command.CompleteEnrollment;
import io.github.suppierk.enrollment.command.FailEnrollment;
import io.github.suppierk.enrollment.command.RequestEnrollment;
import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.cqrs.EnrollmentContext;
import io.github.suppierk.enrollment.directory.StudentStatus;
import io.github.suppierk.enrollment.query.GetEnrollment;
import io.github.suppierk.enrollment.query.GetEnrollmentHistory;
import io.github.suppierk.test.FakeCourseCatalog;
import io.github.suppierk.test.FakeStudentDirectory;
import io.github.suppierk.test.RecordingEventPublisher;
import io.github.suppierk.test.TestDatabase;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jooq.DSLContext;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class EnrollmentContextFactoryTest {
  private static final StaffDomainClient REGISTRAR = new StaffDomainClient("registrar");

  private static DSLContext dsl;

  private final RecordingEventPublisher publisher = new RecordingEventPublisher();
  private final EnrollmentContextFactory factory =
      new EnrollmentContextFactory(
          CONFIG.withStorage(new EnrollmentConfig.Storage(true, 2, Duration.ofSeconds(5))),
          CLOCK,
          new FakeStudentDirectory()
              .with("S12345", StudentStatus.ACTIVE)
              .with("S67890", StudentStatus.ACTIVE),
          new FakeCourseCatalog().offering("CS101", "2025-fall", null),
          publisher,
          NotificationSink.empty());

  @BeforeAll
  static void beforeAll() {
    dsl = TestDatabase.create("enrollment_context");
  }

  @AfterEach
  void tearDown() {
    TestDatabase.clean(dsl);
  }

  @Test
  void when_context_is_created_then_every_message_has_a_handler() {
    final EnrollmentContext context = factory.inMemory();

    assertEquals(
        Set.of(
            RequestEnrollment.class,
            ApproveEnrollment.class,
            CancelEnrollment.class,
            CompleteEnrollment.class,
            FailEnrollment.class),
        context.getSupportedDomainCommandClasses());
    assertEquals(
        Set.of(GetEnrollment.class, GetEnrollmentHistory.class),
        context.getSupportedDomainQueryClasses());
  }

  @Test
  void when_lifecycle_runs_against_database_then_state_survives_a_new_context() {
    final EnrollmentContext writer = factory.jooq(dsl);
    writer.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).orElseThrow();
    writer.execute(ApproveEnrollment.by(REGISTRAR, "S12345", "CS101", "2025-fall")).orElseThrow();
    writer
        .execute(CompleteEnrollment.of(REGISTRAR, "S12345", "CS101", "2025-fall", "B"))
        .orElseThrow();
    writer.execute(RequestEnrollment.of("S67890", "CS101", "2025-fall")).orElseThrow();

    final EnrollmentContext reader = factory.jooq(dsl);
    final Optional<EnrollmentResponse> found =
        reader
            .<GetEnrollment, Optional<EnrollmentResponse>>ask(
                GetEnrollment.of("S12345", "CS101", "2025-fall"))
            .orElseThrow();
    final List<DomainEventResponse> history =
        reader
            .<GetEnrollmentHistory, List<DomainEventResponse>>ask(
                GetEnrollmentHistory.of("S12345", "CS101", "2025-fall"))
            .orElseThrow();

    assertEquals("completed", found.orElseThrow().status());
    assertEquals("B", found.orElseThrow().grade());
    assertEquals(3, history.size());
    assertEquals(4, publisher.published().size());
    assertEquals(1, dsl.fetchCount(DSL.table(DSL.name("enrollment_snapshots"))));
  }

  @Test
  void when_second_request_hits_database_then_duplicate_is_rejected() {
    final EnrollmentContext context = factory.jooq(dsl);
    context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).orElseThrow();

    assertEquals(
        "DUPLICATE_REQUEST",
        context.execute(RequestEnrollment.of("S12345", "CS101", "2025-fall")).errorOrThrow().code());
    assertTrue(context.execute(RequestEnrollment.of("S67890", "CS101", "2025-fall")).isSuccess());
  }

  @Test
  void when_collaborator_is_missing_then_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new EnrollmentContextFactory(
                CONFIG, CLOCK, null, new FakeCourseCatalog(), publisher, NotificationSink.empty()));
  }
}
