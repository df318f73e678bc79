package io.github.suppierk.enrollment.domain;

import static io.github.suppierk.test.Fixtures.ID;
import static io.github.suppierk.test.Fixtures.NOW;
import static io.github.suppierk.test.Fixtures.approved;
import static io.github.suppierk.test.Fixtures.cancelled;
import static io.github.suppierk.test.Fixtures.completed;
import static io.github.suppierk.test.Fixtures.failed;
import static io.github.suppierk.test.Fixtures.requested;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.test.Fixtures;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnrollmentAggregateTest {
  private final EnrollmentAggregate aggregate = Fixtures.aggregate();

  private Enrollment requestedState() {
    return aggregate.create(ID, EventOptions.none()).orElseThrow().state();
  }

  private Enrollment approvedState() {
    return aggregate
        .approve(requestedState(), "registrar", EventOptions.none())
        .orElseThrow()
        .state();
  }

  @Nested
  class Create {
    @Test
    void when_identity_is_valid_then_requested_state_at_version_one() {
      final var options = new EventOptions("corr-7", "cause-7", Map.of("channel", "kiosk"));
      final var change = aggregate.create(ID, options).orElseThrow();

      final var state = assertInstanceOf(Enrollment.Requested.class, change.state());
      assertEquals(ID, state.id());
      assertEquals(1L, state.version());
      assertEquals(NOW, state.requestedAt());

      final var event = assertInstanceOf(EnrollmentEvent.Requested.class, change.event());
      assertEquals(1L, event.version());
      assertEquals(NOW, event.occurredAt());
      assertEquals("corr-7", event.correlationId());
      assertEquals("cause-7", event.causationId());
      assertEquals(Map.of("channel", "kiosk"), event.metadata());
    }

    @Test
    void when_student_id_is_lower_case_then_validation_error() {
      final var error =
          aggregate
              .create(new EnrollmentId("s12345", "CS101", "2025-fall"), EventOptions.none())
              .errorOrThrow();

      final var validation = assertInstanceOf(EnrollmentError.Validation.class, error);
      assertEquals(ErrorCodes.INVALID_STUDENT_ID, validation.code());
      assertEquals("studentId", validation.field());
      assertEquals("s12345", validation.value());
    }

    @Test
    void when_course_id_is_too_long_then_validation_error() {
      final var error =
          aggregate
              .create(
                  new EnrollmentId("S12345", "C".repeat(21), "2025-fall"), EventOptions.none())
              .errorOrThrow();

      assertEquals(ErrorCodes.INVALID_COURSE_ID, error.code());
    }

    @Test
    void when_configured_pattern_admits_dash_then_dashed_ids_are_still_rejected() {
      final var defaults = Fixtures.CONFIG.validation();
      final var permissive =
          new EnrollmentAggregate(
              Fixtures.CLOCK,
              new EnrollmentConfig.Validation(
                  "^[A-Z0-9-]+$",
                  "^[A-Z0-9-]+$",
                  defaults.semesterPattern(),
                  defaults.pastYears(),
                  defaults.futureYears()));

      final var student =
          permissive
              .create(new EnrollmentId("S-1", "CS101", "2025-fall"), EventOptions.none())
              .errorOrThrow();
      final var course =
          permissive
              .create(new EnrollmentId("S12345", "CS-101", "2025-fall"), EventOptions.none())
              .errorOrThrow();

      assertEquals(ErrorCodes.INVALID_STUDENT_ID, student.code());
      assertEquals(ErrorCodes.INVALID_COURSE_ID, course.code());
    }

    @Test
    void when_semester_season_is_unknown_then_validation_error() {
      final var error =
          aggregate
              .create(new EnrollmentId("S12345", "CS101", "2025-winter"), EventOptions.none())
              .errorOrThrow();

      assertEquals(ErrorCodes.INVALID_SEMESTER, error.code());
    }

    @Test
    void when_semester_is_too_far_ahead_then_business_rule_error() {
      final var error =
          aggregate
              .create(new EnrollmentId("S12345", "CS101", "2027-spring"), EventOptions.none())
              .errorOrThrow();

      final var rule = assertInstanceOf(EnrollmentError.BusinessRule.class, error);
      assertEquals(ErrorCodes.SEMESTER_OUT_OF_RANGE, rule.code());
      assertEquals("INVALID_SEMESTER_RANGE", rule.rule());
      assertEquals(2025, rule.context().get("currentYear"));
      assertEquals(2027, rule.context().get("requestedYear"));
      assertEquals("2024-2026", rule.context().get("allowedRange"));
    }

    @Test
    void when_semester_is_at_window_edges_then_accepted() {
      assertTrue(
          aggregate
              .create(new EnrollmentId("S12345", "CS101", "2024-spring"), EventOptions.none())
              .isSuccess());
      assertTrue(
          aggregate
              .create(new EnrollmentId("S12345", "CS101", "2026-summer"), EventOptions.none())
              .isSuccess());
    }

    @Test
    void when_id_is_null_then_throws() {
      assertThrows(
          IllegalArgumentException.class, () -> aggregate.create(null, EventOptions.none()));
    }
  }

  @Nested
  class Commands {
    @Test
    void when_requested_is_approved_then_approved_state() {
      final var change =
          aggregate.approve(requestedState(), "registrar", EventOptions.none()).orElseThrow();

      final var state = assertInstanceOf(Enrollment.Approved.class, change.state());
      assertEquals(2L, state.version());
      assertEquals("registrar", state.approvedBy());
      assertEquals(NOW, state.approvedAt());
      assertEquals(2L, change.event().version());
    }

    @Test
    void when_approver_is_blank_then_validation_error() {
      final var error =
          aggregate.approve(requestedState(), "  ", EventOptions.none()).errorOrThrow();

      assertEquals(ErrorCodes.INVALID_APPROVER, error.code());
    }

    @Test
    void when_requested_is_cancelled_then_no_prior_approval() {
      final var state =
          assertInstanceOf(
              Enrollment.Cancelled.class,
              aggregate.cancel(requestedState(), "changed mind", EventOptions.none()).orElseThrow()
                  .state());

      assertEquals("changed mind", state.reason());
      assertNull(state.priorApprovedAt());
      assertNull(state.priorApprovedBy());
    }

    @Test
    void when_approved_is_cancelled_then_prior_approval_is_kept() {
      final var state =
          assertInstanceOf(
              Enrollment.Cancelled.class,
              aggregate.cancel(approvedState(), null, EventOptions.none()).orElseThrow().state());

      assertEquals(3L, state.version());
      assertEquals("registrar", state.priorApprovedBy());
      assertNull(state.reason());
    }

    @Test
    void when_approved_is_completed_then_grade_is_recorded() {
      final var state =
          assertInstanceOf(
              Enrollment.Completed.class,
              aggregate.complete(approvedState(), "B+", EventOptions.none()).orElseThrow().state());

      assertEquals("B+", state.grade());
      assertEquals(3L, state.version());
      assertTrue(state.isTerminal());
    }

    @Test
    void when_approved_is_failed_then_reason_is_recorded() {
      final var state =
          assertInstanceOf(
              Enrollment.Failed.class,
              aggregate.fail(approvedState(), "absent", EventOptions.none()).orElseThrow().state());

      assertEquals("absent", state.reason());
    }

    @Test
    void when_requested_is_completed_then_invalid_transition() {
      final var error =
          aggregate.complete(requestedState(), "A", EventOptions.none()).errorOrThrow();

      final var rule = assertInstanceOf(EnrollmentError.BusinessRule.class, error);
      assertEquals(ErrorCodes.INVALID_STATE_TRANSITION, rule.code());
      assertEquals("STATE_MACHINE", rule.rule());
      assertEquals("requested", rule.context().get("currentState"));
      assertEquals("EnrollmentCompleted", rule.context().get("event"));
    }

    @Test
    void when_approved_is_approved_again_then_invalid_transition() {
      assertEquals(
          ErrorCodes.INVALID_STATE_TRANSITION,
          aggregate.approve(approvedState(), "dean", EventOptions.none()).errorOrThrow().code());
    }

    @Test
    void when_terminal_state_receives_any_command_then_invalid_transition() {
      final var completedState =
          aggregate.complete(approvedState(), "A", EventOptions.none()).orElseThrow().state();

      assertEquals(
          ErrorCodes.INVALID_STATE_TRANSITION,
          aggregate.cancel(completedState, "late", EventOptions.none()).errorOrThrow().code());
      assertEquals(
          ErrorCodes.INVALID_STATE_TRANSITION,
          aggregate.fail(completedState, "late", EventOptions.none()).errorOrThrow().code());
    }
  }

  @Nested
  class ApplyEvent {
    @Test
    void when_state_is_empty_and_event_is_request_then_requested() {
      final var state = aggregate.applyEvent(Optional.empty(), requested(ID, 1)).orElseThrow();

      assertEquals(EnrollmentStatus.REQUESTED, state.status());
    }

    @Test
    void when_state_is_empty_and_event_is_not_request_then_invalid_transition() {
      assertEquals(
          ErrorCodes.INVALID_STATE_TRANSITION,
          aggregate.applyEvent(Optional.empty(), approved(ID, 1)).errorOrThrow().code());
    }

    @Test
    void when_version_skips_then_invalid_sequence() {
      final var error =
          aggregate.applyEvent(Optional.of(requestedState()), approved(ID, 3)).errorOrThrow();

      final var rule = assertInstanceOf(EnrollmentError.BusinessRule.class, error);
      assertEquals(ErrorCodes.INVALID_EVENT_SEQUENCE, rule.code());
      assertEquals("EVENT_ORDERING", rule.rule());
    }

    @Test
    void when_event_belongs_to_other_enrollment_then_invalid_sequence() {
      final var other = new EnrollmentId("S99999", "CS101", "2025-fall");

      assertEquals(
          ErrorCodes.INVALID_EVENT_SEQUENCE,
          aggregate.applyEvent(Optional.of(requestedState()), approved(other, 2)).errorOrThrow()
              .code());
    }

    @Test
    void when_every_state_and_event_pair_is_applied_then_outcome_follows_transition_table() {
      final Map<EnrollmentStatus, Enrollment> states = new EnumMap<>(EnrollmentStatus.class);
      states.put(EnrollmentStatus.REQUESTED, requestedState());
      states.put(EnrollmentStatus.APPROVED, approvedState());
      states.put(
          EnrollmentStatus.CANCELLED,
          aggregate.cancel(requestedState(), null, EventOptions.none()).orElseThrow().state());
      states.put(
          EnrollmentStatus.COMPLETED,
          aggregate.complete(approvedState(), "A", EventOptions.none()).orElseThrow().state());
      states.put(
          EnrollmentStatus.FAILED,
          aggregate.fail(approvedState(), "x", EventOptions.none()).orElseThrow().state());

      final Map<EventKind, BiFunction<EnrollmentId, Long, EnrollmentEvent>> events =
          new EnumMap<>(EventKind.class);
      events.put(EventKind.REQUESTED, Fixtures::requested);
      events.put(EventKind.APPROVED, Fixtures::approved);
      events.put(EventKind.CANCELLED, Fixtures::cancelled);
      events.put(EventKind.COMPLETED, Fixtures::completed);
      events.put(EventKind.FAILED, Fixtures::failed);

      final Map<EnrollmentStatus, Map<EventKind, EnrollmentStatus>> allowed =
          Map.of(
              EnrollmentStatus.REQUESTED,
              Map.of(
                  EventKind.APPROVED, EnrollmentStatus.APPROVED,
                  EventKind.CANCELLED, EnrollmentStatus.CANCELLED),
              EnrollmentStatus.APPROVED,
              Map.of(
                  EventKind.CANCELLED, EnrollmentStatus.CANCELLED,
                  EventKind.COMPLETED, EnrollmentStatus.COMPLETED,
                  EventKind.FAILED, EnrollmentStatus.FAILED));

      for (Map.Entry<EnrollmentStatus, Enrollment> state : states.entrySet()) {
        for (Map.Entry<EventKind, BiFunction<EnrollmentId, Long, EnrollmentEvent>> event :
            events.entrySet()) {
          final var next = state.getValue().version() + 1;
          final var result =
              aggregate.applyEvent(
                  Optional.of(state.getValue()), event.getValue().apply(ID, next));
          final var expected =
              allowed.getOrDefault(state.getKey(), Map.of()).get(event.getKey());

          if (expected == null) {
            assertEquals(
                ErrorCodes.INVALID_STATE_TRANSITION,
                result.errorOrThrow().code(),
                "%s + %s".formatted(state.getKey(), event.getKey()));
          } else {
            assertEquals(
                expected,
                result.orElseThrow().status(),
                "%s + %s".formatted(state.getKey(), event.getKey()));
            assertEquals(next, result.orElseThrow().version());
          }
        }
      }
    }
  }

  @Nested
  class Reconstruct {
    @Test
    void when_no_events_then_empty() {
      assertTrue(aggregate.reconstruct(List.of()).orElseThrow().isEmpty());
    }

    @Test
    void when_events_are_unsorted_then_they_are_folded_by_version() {
      final List<EnrollmentEvent> events =
          List.of(completed(ID, 3), requested(ID, 1), approved(ID, 2));

      final var state = aggregate.reconstruct(events).orElseThrow().orElseThrow();

      final var completedState = assertInstanceOf(Enrollment.Completed.class, state);
      assertEquals(3L, completedState.version());
      assertEquals("registrar", completedState.approvedBy());
      assertEquals("A", completedState.grade());
    }

    @Test
    void when_commands_are_replayed_then_state_equals_live_state() {
      final var history = new ArrayList<EnrollmentEvent>();
      final var created = aggregate.create(ID, EventOptions.none()).orElseThrow();
      history.add(created.event());
      final var approvedChange =
          aggregate.approve(created.state(), "registrar", EventOptions.none()).orElseThrow();
      history.add(approvedChange.event());
      final var failedChange =
          aggregate.fail(approvedChange.state(), "absent", EventOptions.none()).orElseThrow();
      history.add(failedChange.event());

      assertEquals(
          failedChange.state(), aggregate.reconstruct(history).orElseThrow().orElseThrow());
    }

    @Test
    void when_versions_have_gap_then_invalid_sequence() {
      assertEquals(
          ErrorCodes.INVALID_EVENT_SEQUENCE,
          aggregate
              .reconstruct(List.of(requested(ID, 1), cancelled(ID, 3)))
              .errorOrThrow()
              .code());
    }

    @Test
    void when_versions_are_duplicated_then_invalid_sequence() {
      assertEquals(
          ErrorCodes.INVALID_EVENT_SEQUENCE,
          aggregate
              .reconstruct(List.of(requested(ID, 1), approved(ID, 2), cancelled(ID, 2)))
              .errorOrThrow()
              .code());
    }

    @Test
    void when_stream_does_not_start_with_request_then_invalid_sequence() {
      assertEquals(
          ErrorCodes.INVALID_EVENT_SEQUENCE,
          aggregate.reconstruct(List.of(approved(ID, 1))).errorOrThrow().code());
    }

    @Test
    void when_continuing_from_snapshot_then_later_events_are_applied() {
      final var state =
          aggregate
              .reconstructFrom(approvedState(), List.of(failed(ID, 3)))
              .orElseThrow()
              .orElseThrow();

      assertEquals(EnrollmentStatus.FAILED, state.status());
      assertEquals(3L, state.version());
    }

    @Test
    void when_continuing_from_snapshot_without_events_then_snapshot_is_returned() {
      final var snapshot = approvedState();

      assertEquals(
          snapshot, aggregate.reconstructFrom(snapshot, List.of()).orElseThrow().orElseThrow());
    }
  }
}
