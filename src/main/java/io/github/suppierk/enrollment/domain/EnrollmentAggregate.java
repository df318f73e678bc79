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

import io.github.suppierk.enrollment.config.EnrollmentConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State machine of a single enrollment.
 *
 * <p>Every method is a pure function of its arguments, the injected {@link Clock} and the
 * validation settings: nothing is stored or published here. Commands produce a {@link
 * StateChange}, replay goes through {@link #applyEvent(Optional, EnrollmentEvent)}, and both paths
 * share the same transition table:
 *
 * <table>
 *   <caption>Allowed transitions</caption>
 *   <tr><th>State</th><th>Accepted events</th></tr>
 *   <tr><td>none</td><td>Requested</td></tr>
 *   <tr><td>Requested</td><td>Approved, Cancelled</td></tr>
 *   <tr><td>Approved</td><td>Cancelled, Completed, Failed</td></tr>
 *   <tr><td>Cancelled, Completed, Failed</td><td>none</td></tr>
 * </table>
 */
public final class EnrollmentAggregate {
  static final String STATE_MACHINE_RULE = "STATE_MACHINE";
  static final String EVENT_ORDERING_RULE = "EVENT_ORDERING";
  static final String SEMESTER_RANGE_RULE = "INVALID_SEMESTER_RANGE";

  private static final Pattern SEMESTER_YEAR = Pattern.compile("^(\\d{4})");

  // Separates identity parts in stream ids, so it may not appear in student or course ids
  private static final String ID_SEPARATOR = "-";

  private final Clock clock;
  private final Pattern studentIdPattern;
  private final Pattern courseIdPattern;
  private final Pattern semesterPattern;
  private final int pastYears;
  private final int futureYears;

  public EnrollmentAggregate(final Clock clock, final EnrollmentConfig.Validation validation) {
    if (clock == null || validation == null) {
      throw new IllegalArgumentException("Clock and validation settings cannot be null");
    }

    this.clock = clock;
    this.studentIdPattern = Pattern.compile(validation.studentIdPattern());
    this.courseIdPattern = Pattern.compile(validation.courseIdPattern());
    this.semesterPattern = Pattern.compile(validation.semesterPattern());
    this.pastYears = validation.pastYears();
    this.futureYears = validation.futureYears();
  }

  /**
   * Opens a new enrollment at version 1.
   *
   * @param id of the enrollment to open
   * @param options tracing attributes for the produced event
   * @return the requested state and its event, or a validation or semester window error
   */
  public Result<StateChange, EnrollmentError> create(
      final EnrollmentId id, final EventOptions options) {
    requireNonNull(id, "Enrollment id");
    requireNonNull(options, "Event options");

    return validateIdentity(id)
        .flatMap(this::checkSemesterWindow)
        .flatMap(
            valid -> {
              final Instant now = clock.instant();
              final var event =
                  new EnrollmentEvent.Requested(
                      UUID.randomUUID(),
                      valid,
                      now,
                      1,
                      options.correlationId(),
                      options.causationId(),
                      now,
                      options.metadata());
              return applyEvent(Optional.empty(), event)
                  .map(state -> new StateChange(state, event));
            });
  }

  /**
   * @param id to check
   * @return the same id if student, course and semester have the configured formats
   */
  public Result<EnrollmentId, EnrollmentError> validateIdentity(final EnrollmentId id) {
    requireNonNull(id, "Enrollment id");

    if (!studentIdPattern.matcher(id.studentId()).matches()
        || id.studentId().contains(ID_SEPARATOR)) {
      return Result.failure(
          new EnrollmentError.Validation(
              ErrorCodes.INVALID_STUDENT_ID,
              "studentId",
              id.studentId(),
              "Student ID must match %s without '%s'"
                  .formatted(studentIdPattern.pattern(), ID_SEPARATOR)));
    }

    if (!courseIdPattern.matcher(id.courseId()).matches()
        || id.courseId().contains(ID_SEPARATOR)) {
      return Result.failure(
          new EnrollmentError.Validation(
              ErrorCodes.INVALID_COURSE_ID,
              "courseId",
              id.courseId(),
              "Course ID must match %s without '%s'"
                  .formatted(courseIdPattern.pattern(), ID_SEPARATOR)));
    }

    if (!semesterPattern.matcher(id.semester()).matches()
        || !SEMESTER_YEAR.matcher(id.semester()).find()) {
      return Result.failure(
          new EnrollmentError.Validation(
              ErrorCodes.INVALID_SEMESTER,
              "semester",
              id.semester(),
              "Semester must match %s".formatted(semesterPattern.pattern())));
    }

    return Result.success(id);
  }

  public Result<StateChange, EnrollmentError> approve(
      final Enrollment state, final String approvedBy, final EventOptions options) {
    requireNonNull(state, "Enrollment state");
    requireNonNull(options, "Event options");

    if (approvedBy == null || approvedBy.isBlank()) {
      return Result.failure(
          new EnrollmentError.Validation(
              ErrorCodes.INVALID_APPROVER, "approvedBy", approvedBy, "Approver must be named"));
    }

    return advance(
        state,
        new EnrollmentEvent.Approved(
            UUID.randomUUID(),
            state.id(),
            clock.instant(),
            state.version() + 1,
            options.correlationId(),
            options.causationId(),
            approvedBy));
  }

  public Result<StateChange, EnrollmentError> cancel(
      final Enrollment state, final String reason, final EventOptions options) {
    requireNonNull(state, "Enrollment state");
    requireNonNull(options, "Event options");

    return advance(
        state,
        new EnrollmentEvent.Cancelled(
            UUID.randomUUID(),
            state.id(),
            clock.instant(),
            state.version() + 1,
            options.correlationId(),
            options.causationId(),
            reason));
  }

  public Result<StateChange, EnrollmentError> complete(
      final Enrollment state, final String grade, final EventOptions options) {
    requireNonNull(state, "Enrollment state");
    requireNonNull(options, "Event options");

    return advance(
        state,
        new EnrollmentEvent.Completed(
            UUID.randomUUID(),
            state.id(),
            clock.instant(),
            state.version() + 1,
            options.correlationId(),
            options.causationId(),
            grade));
  }

  public Result<StateChange, EnrollmentError> fail(
      final Enrollment state, final String reason, final EventOptions options) {
    requireNonNull(state, "Enrollment state");
    requireNonNull(options, "Event options");

    return advance(
        state,
        new EnrollmentEvent.Failed(
            UUID.randomUUID(),
            state.id(),
            clock.instant(),
            state.version() + 1,
            options.correlationId(),
            options.causationId(),
            reason));
  }

  /**
   * Applies one event on top of the current state. Defined for every combination of state and
   * event kind: combinations outside the transition table yield {@code INVALID_STATE_TRANSITION}.
   *
   * @param current state, empty if the stream has not started yet
   * @param event to apply, its version must be exactly one above the current version
   * @return the next state, or an error describing why the event does not fit
   */
  public Result<Enrollment, EnrollmentError> applyEvent(
      final Optional<Enrollment> current, final EnrollmentEvent event) {
    requireNonNull(current, "Current state");
    requireNonNull(event, "Event");

    final long expectedVersion = current.map(Enrollment::version).orElse(0L) + 1;
    if (event.version() != expectedVersion) {
      return Result.failure(
          sequenceError(
              "Event version %d does not follow current version %d"
                  .formatted(event.version(), expectedVersion - 1),
              Map.of("expectedVersion", expectedVersion, "eventVersion", event.version())));
    }

    if (current.isEmpty()) {
      if (event instanceof EnrollmentEvent.Requested requested) {
        return Result.success(
            new Enrollment.Requested(
                requested.enrollmentId(), requested.version(), requested.requestedAt()));
      }

      return Result.failure(transitionError(null, event));
    }

    final Enrollment state = current.get();
    if (!state.id().equals(event.enrollmentId())) {
      return Result.failure(
          sequenceError(
              "Event of %s cannot be applied to %s".formatted(event.enrollmentId(), state.id()),
              Map.of("eventEnrollment", event.enrollmentId().key())));
    }

    return switch (event.kind()) {
      case REQUESTED -> Result.failure(transitionError(state, event));
      case APPROVED -> onApproved(state, (EnrollmentEvent.Approved) event);
      case CANCELLED -> onCancelled(state, (EnrollmentEvent.Cancelled) event);
      case COMPLETED -> onCompleted(state, (EnrollmentEvent.Completed) event);
      case FAILED -> onFailed(state, (EnrollmentEvent.Failed) event);
    };
  }

  /**
   * Rebuilds a state from its complete stream. Events are ordered by version first; the result is
   * an error rather than a repaired state if versions are not exactly {@code 1..n} or the stream
   * does not start with a request.
   *
   * @param events of one enrollment, in any order
   * @return empty if there are no events, the folded state otherwise
   */
  public Result<Optional<Enrollment>, EnrollmentError> reconstruct(
      final List<EnrollmentEvent> events) {
    requireNonNull(events, "Events");

    if (events.isEmpty()) {
      return Result.success(Optional.empty());
    }

    final var sorted = sortedByVersion(events);
    if (!(sorted.get(0) instanceof EnrollmentEvent.Requested)) {
      return Result.failure(
          sequenceError(
              "Stream must start with %s but starts with %s"
                  .formatted(EventKind.REQUESTED.typeName(), sorted.get(0).kind().typeName()),
              Map.of("firstEvent", sorted.get(0).kind().typeName())));
    }

    return fold(Optional.empty(), sorted);
  }

  /**
   * Continues folding from a previously stored state.
   *
   * @param snapshot state to start from
   * @param laterEvents events after the snapshot, versions must continue from it without gaps
   * @return the folded state
   */
  public Result<Optional<Enrollment>, EnrollmentError> reconstructFrom(
      final Enrollment snapshot, final List<EnrollmentEvent> laterEvents) {
    requireNonNull(snapshot, "Snapshot state");
    requireNonNull(laterEvents, "Events");

    return fold(Optional.of(snapshot), sortedByVersion(laterEvents));
  }

  private Result<Optional<Enrollment>, EnrollmentError> fold(
      final Optional<Enrollment> start, final List<EnrollmentEvent> sorted) {
    Optional<Enrollment> state = start;
    for (EnrollmentEvent event : sorted) {
      final var applied = applyEvent(state, event);
      if (applied instanceof Result.Failure<Enrollment, EnrollmentError> failure) {
        return Result.failure(failure.error());
      }

      state = Optional.of(applied.orElseThrow());
    }

    return Result.success(state);
  }

  private Result<StateChange, EnrollmentError> advance(
      final Enrollment state, final EnrollmentEvent event) {
    return applyEvent(Optional.of(state), event).map(next -> new StateChange(next, event));
  }

  private Result<Enrollment, EnrollmentError> onApproved(
      final Enrollment state, final EnrollmentEvent.Approved event) {
    if (state instanceof Enrollment.Requested requested) {
      return Result.success(
          new Enrollment.Approved(
              requested.id(),
              event.version(),
              requested.requestedAt(),
              event.occurredAt(),
              event.approvedBy()));
    }

    return Result.failure(transitionError(state, event));
  }

  private Result<Enrollment, EnrollmentError> onCancelled(
      final Enrollment state, final EnrollmentEvent.Cancelled event) {
    if (state instanceof Enrollment.Requested requested) {
      return Result.success(
          new Enrollment.Cancelled(
              requested.id(),
              event.version(),
              requested.requestedAt(),
              event.occurredAt(),
              event.reason(),
              null,
              null));
    }

    if (state instanceof Enrollment.Approved approved) {
      return Result.success(
          new Enrollment.Cancelled(
              approved.id(),
              event.version(),
              approved.requestedAt(),
              event.occurredAt(),
              event.reason(),
              approved.approvedAt(),
              approved.approvedBy()));
    }

    return Result.failure(transitionError(state, event));
  }

  private Result<Enrollment, EnrollmentError> onCompleted(
      final Enrollment state, final EnrollmentEvent.Completed event) {
    if (state instanceof Enrollment.Approved approved) {
      return Result.success(
          new Enrollment.Completed(
              approved.id(),
              event.version(),
              approved.requestedAt(),
              approved.approvedAt(),
              approved.approvedBy(),
              event.occurredAt(),
              event.grade()));
    }

    return Result.failure(transitionError(state, event));
  }

  private Result<Enrollment, EnrollmentError> onFailed(
      final Enrollment state, final EnrollmentEvent.Failed event) {
    if (state instanceof Enrollment.Approved approved) {
      return Result.success(
          new Enrollment.Failed(
              approved.id(),
              event.version(),
              approved.requestedAt(),
              approved.approvedAt(),
              approved.approvedBy(),
              event.occurredAt(),
              event.reason()));
    }

    return Result.failure(transitionError(state, event));
  }

  private Result<EnrollmentId, EnrollmentError> checkSemesterWindow(final EnrollmentId id) {
    final Matcher matcher = SEMESTER_YEAR.matcher(id.semester());
    if (!matcher.find()) {
      return Result.failure(
          new EnrollmentError.Validation(
              ErrorCodes.INVALID_SEMESTER, "semester", id.semester(), "Semester has no year"));
    }

    final int requestedYear = Integer.parseInt(matcher.group(1));
    final int currentYear = Year.now(clock).getValue();
    final int earliest = currentYear - pastYears;
    final int latest = currentYear + futureYears;

    if (requestedYear < earliest || requestedYear > latest) {
      return Result.failure(
          new EnrollmentError.BusinessRule(
              SEMESTER_RANGE_RULE,
              ErrorCodes.SEMESTER_OUT_OF_RANGE,
              "Semester year %d is outside of the allowed range %d-%d"
                  .formatted(requestedYear, earliest, latest),
              Map.of(
                  "currentYear", currentYear,
                  "requestedYear", requestedYear,
                  "allowedRange", "%d-%d".formatted(earliest, latest))));
    }

    return Result.success(id);
  }

  private static List<EnrollmentEvent> sortedByVersion(final List<EnrollmentEvent> events) {
    final var sorted = new ArrayList<EnrollmentEvent>(events.size());
    for (EnrollmentEvent event : events) {
      sorted.add(requireNonNull(event, "Event"));
    }

    sorted.sort(Comparator.comparingLong(EnrollmentEvent::version));
    return sorted;
  }

  private static EnrollmentError transitionError(
      final Enrollment state, final EnrollmentEvent event) {
    final String from = state == null ? "none" : state.status().label();
    return new EnrollmentError.BusinessRule(
        STATE_MACHINE_RULE,
        ErrorCodes.INVALID_STATE_TRANSITION,
        "Cannot apply %s to enrollment in state '%s'".formatted(event.kind().typeName(), from),
        Map.of("currentState", from, "event", event.kind().typeName()));
  }

  private static EnrollmentError sequenceError(
      final String message, final Map<String, Object> context) {
    return new EnrollmentError.BusinessRule(
        EVENT_ORDERING_RULE, ErrorCodes.INVALID_EVENT_SEQUENCE, message, context);
  }

  private static <T> T requireNonNull(final T value, final String what) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(what));
    }

    return value;
  }
}
