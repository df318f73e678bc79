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

package io.github.suppierk.enrollment.cqrs;

import io.github.suppierk.enrollment.api.EnrollmentResponse;
import io.github.suppierk.enrollment.api.ErrorResponse;
import io.github.suppierk.enrollment.async.EventPublisher;
import io.github.suppierk.enrollment.async.NotificationSink;
import io.github.suppierk.enrollment.authorization.DomainClient;
import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import io.github.suppierk.enrollment.domain.EventOptions;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.domain.StateChange;
import io.github.suppierk.enrollment.repository.EnrollmentRepository;
import io.github.suppierk.java.Try;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ol>
 *   <li>Validate the enrollment the command refers to.
 *   <li>Assert that the {@link DomainClient} can invoke the {@link DomainCommand}.
 *   <li>Decide on the next state, see {@link Create} and {@link Transition}.
 *   <li>Persist the produced event with an optimistic version check.
 *   <li>Publish the event and hand it to the {@link NotificationSink}, best-effort.
 * </ol>
 *
 * <p>The first failing step ends the pipeline and its error is returned; nothing is written before
 * the persist step, so an abandoned command leaves no trace.
 *
 * <p><b>Design note</b>: exceptions thrown by collaborators while deciding are not converted into
 * errors, they propagate to the caller once logged. Publishing failures are only logged because
 * the event is already part of the stream at that point.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?, ?>
>
extends
        DomainHandler<COMMAND>
permits
  DomainCommandHandler.Create, DomainCommandHandler.Transition
{
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(DomainCommandHandler.class);

  static final String UNIQUE_ENROLLMENT_RULE = "UNIQUE_ENROLLMENT";

  private final Class<COMMAND> commandClass;
  private final EnrollmentRepository repository;
  private final EventPublisher publisher;
  private final NotificationSink notifications;

  /**
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @param dependencies shared collaborators
   * @throws IllegalArgumentException if any argument is null
   */
  protected DomainCommandHandler(
      final Class<COMMAND> commandClass, final CommandDependencies dependencies) {
    super(dependencies == null ? null : dependencies.aggregate());
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
    this.repository = dependencies.repository();
    this.publisher = dependencies.publisher();
    this.notifications = dependencies.notifications();
  }

  /**
   * @return the class type of the command handled by this handler
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  protected final EnrollmentRepository repository() {
    return repository;
  }

  /**
   * Decides the next state of the enrollment.
   *
   * @param command being executed
   * @param id validated identity the command refers to
   * @param options tracing attributes for the produced event
   * @return the state change to persist, or the reason the command is rejected
   */
  protected abstract Result<StateChange, EnrollmentError> internalRunContract(
      final COMMAND command, final EnrollmentId id, final EventOptions options);

  /**
   * Runs the whole pipeline for a command.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link
   * EnrollmentContext} only.
   *
   * @param command to be executed
   * @return the enrollment after the command, or the error that stopped it
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if the command carries no client
   */
  final Result<EnrollmentResponse, ErrorResponse> runInContext(final COMMAND command) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");
    final String commandName = getCommandClass().getSimpleName();

    final Result<StateChange, EnrollmentError> outcome =
        validate(nonNullCommand, ErrorCodes.INVALID_COMMAND_FORMAT)
            .flatMap(id -> authorize(nonNullDomainClient, getCommandClass(), id))
            .flatMap(id -> decide(nonNullCommand, id))
            .flatMap(this::persist);

    outcome.ifSuccess(
        change -> {
          LOGGER.info(
              "{} accepted for {}, now {} at version {}",
              commandName,
              change.state().id(),
              change.state().status().label(),
              change.state().version());
          publish(change.event());
        });
    outcome.ifFailure(
        error ->
            LOGGER.debug("{} rejected with {}: {}", commandName, error.code(), error.message()));

    return outcome
        .map(change -> EnrollmentResponse.from(change.state()))
        .mapError(ErrorResponse::from);
  }

  private Result<StateChange, EnrollmentError> decide(
      final COMMAND command, final EnrollmentId id) {
    final Try<Result<StateChange, EnrollmentError>> decision =
        Try.of(
            () ->
                throwIllegalStateIfNull(
                    internalRunContract(command, id, eventOptions(command)),
                    "Command handler result"));

    decision.ifFailure(
        reason ->
            LOGGER.warn(
                "{} for {} failed unexpectedly", getCommandClass().getSimpleName(), id, reason));

    return decision.get();
  }

  private Result<StateChange, EnrollmentError> persist(final StateChange change) {
    return repository.save(change.state(), change.event()).map(metadata -> change);
  }

  private void publish(final EnrollmentEvent event) {
    final Try<EnrollmentEvent> published =
        Try.of(
            () -> {
              publisher.publish(List.of(event));
              return event;
            });
    published.ifFailure(
        reason ->
            LOGGER.warn(
                "Publishing {} v{} of {} failed",
                event.kind().typeName(),
                event.version(),
                event.enrollmentId(),
                reason));

    final Try<EnrollmentEvent> delivered =
        Try.of(
            () -> {
              notifications.deliver(event);
              return event;
            });
    delivered.ifFailure(
        reason ->
            LOGGER.warn(
                "Notification about {} v{} of {} failed",
                event.kind().typeName(),
                event.version(),
                event.enrollmentId(),
                reason));
  }

  private EventOptions eventOptions(final COMMAND command) {
    final String causationId =
        command.causationId() != null ? command.causationId() : String.valueOf(command.messageId());
    final Map<String, String> metadata =
        command instanceof DomainCommand.Create<?, ?> create ? create.metadata() : Map.of();
    return new EventOptions(command.correlationId(), causationId, metadata);
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}: the
   * enrollment must not exist yet.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>
  > extends DomainCommandHandler<CREATE> {
  // @formatter:on
    private final boolean allowDuplicateRequests;

    protected Create(
        final Class<CREATE> commandClass,
        final CommandDependencies dependencies,
        final EnrollmentConfig.BusinessRules businessRules) {
      super(commandClass, dependencies);
      this.allowDuplicateRequests =
          throwIllegalArgumentIfNull(businessRules, "Business rules").allowDuplicateRequests();
    }

    /**
     * Checks whatever must hold outside of the enrollment itself before it may be opened.
     *
     * @param command being executed
     * @param id validated identity
     * @return the id if every prerequisite holds, the first violated one otherwise
     * @throws Exception if an external system could not be consulted
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract Result<EnrollmentId, EnrollmentError> checkPrerequisites(
        final CREATE command, final EnrollmentId id) throws Exception;

    /** {@inheritDoc} */
    @Override
    protected final Result<StateChange, EnrollmentError> internalRunContract(
        final CREATE command, final EnrollmentId id, final EventOptions options) {
      final Try<Result<EnrollmentId, EnrollmentError>> prerequisites =
          Try.of(
              () ->
                  throwIllegalStateIfNull(
                      checkPrerequisites(command, id), "Prerequisite check result"));

      return prerequisites
          .get()
          .flatMap(this::checkDuplicate)
          .flatMap(valid -> aggregate().create(valid, options));
    }

    private Result<EnrollmentId, EnrollmentError> checkDuplicate(final EnrollmentId id) {
      if (allowDuplicateRequests) {
        return Result.success(id);
      }

      return repository()
          .findByIdentity(id)
          .flatMap(
              existing -> {
                if (existing.isEmpty()) {
                  return Result.success(id);
                }

                final Enrollment found = existing.get();
                return Result.failure(
                    new EnrollmentError.BusinessRule(
                        UNIQUE_ENROLLMENT_RULE,
                        ErrorCodes.DUPLICATE_REQUEST,
                        "Enrollment %s already exists".formatted(id),
                        Map.of(
                            "existingStatus", found.status().label(),
                            "existingVersion", found.version())));
              });
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Transition}: the
   * enrollment must exist and is loaded before the transition is decided.
   *
   * @param <TRANSITION> the type of the particular {@link DomainCommand.Transition}
   */
  // @formatter:off
  public abstract static non-sealed class Transition<
    TRANSITION extends DomainCommand.Transition<?, ?>
  > extends DomainCommandHandler<TRANSITION> {
  // @formatter:on
    protected Transition(
        final Class<TRANSITION> commandClass, final CommandDependencies dependencies) {
      super(commandClass, dependencies);
    }

    /**
     * @param command being executed
     * @param current state of the enrollment
     * @param options tracing attributes for the produced event
     * @return the state change produced by {@link #aggregate()}
     */
    protected abstract Result<StateChange, EnrollmentError> transition(
        final TRANSITION command, final Enrollment current, final EventOptions options);

    /** {@inheritDoc} */
    @Override
    protected final Result<StateChange, EnrollmentError> internalRunContract(
        final TRANSITION command, final EnrollmentId id, final EventOptions options) {
      return repository()
          .findByIdentity(id)
          .flatMap(
              existing -> {
                if (existing.isEmpty()) {
                  return Result.failure(
                      new EnrollmentError.NotFound(
                          "Enrollment", id.key(), ErrorCodes.ENROLLMENT_NOT_FOUND));
                }

                return transition(command, existing.get(), options);
              });
    }
  }
}
