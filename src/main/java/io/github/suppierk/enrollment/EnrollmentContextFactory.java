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

package io.github.suppierk.enrollment;

import io.github.suppierk.enrollment.async.EventPublisher;
import io.github.suppierk.enrollment.async.NotificationSink;
import io.github.suppierk.enrollment.command.ApproveEnrollmentHandler;
import io.github.suppierk.enrollment.command.CancelEnrollmentHandler;
import io.github.suppierk.enrollment.command.CompleteEnrollmentHandler;
import io.github.suppierk.enrollment.command.FailEnrollmentHandler;
import io.github.suppierk.enrollment.command.RequestEnrollmentHandler;
import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.cqrs.CommandDependencies;
import io.github.suppierk.enrollment.cqrs.EnrollmentContext;
import io.github.suppierk.enrollment.directory.CourseCatalog;
import io.github.suppierk.enrollment.directory.StudentDirectory;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.eventstore.EventCodec;
import io.github.suppierk.enrollment.eventstore.EventStore;
import io.github.suppierk.enrollment.eventstore.InMemoryEventStore;
import io.github.suppierk.enrollment.eventstore.InMemorySnapshotStore;
import io.github.suppierk.enrollment.eventstore.JooqEventStore;
import io.github.suppierk.enrollment.eventstore.JooqSnapshotStore;
import io.github.suppierk.enrollment.eventstore.SnapshotStore;
import io.github.suppierk.enrollment.query.GetEnrollmentHandler;
import io.github.suppierk.enrollment.query.GetEnrollmentHistoryHandler;
import io.github.suppierk.enrollment.repository.EventSourcedEnrollmentRepository;
import java.time.Clock;
import org.jooq.DSLContext;

/**
 * Wires an {@link EnrollmentContext} with every command and query handler of this library.
 *
 * <p>Use {@link #inMemory} for tests and single-process deployments, {@link #jooq} for a
 * relational database with the schema of {@code enrollment_event_store.sql}.
 */
public final class EnrollmentContextFactory {
  private final EnrollmentConfig config;
  private final Clock clock;
  private final StudentDirectory students;
  private final CourseCatalog courses;
  private final EventPublisher publisher;
  private final NotificationSink notifications;

  public EnrollmentContextFactory(
      final EnrollmentConfig config,
      final Clock clock,
      final StudentDirectory students,
      final CourseCatalog courses,
      final EventPublisher publisher,
      final NotificationSink notifications) {
    if (config == null
        || clock == null
        || students == null
        || courses == null
        || publisher == null
        || notifications == null) {
      throw new IllegalArgumentException("Context collaborators cannot be null");
    }

    this.config = config;
    this.clock = clock;
    this.students = students;
    this.courses = courses;
    this.publisher = publisher;
    this.notifications = notifications;
  }

  /**
   * @return context backed by {@link InMemoryEventStore} and {@link InMemorySnapshotStore}
   */
  public EnrollmentContext inMemory() {
    return create(
        new InMemoryEventStore(clock, config.storage().operationTimeout()),
        new InMemorySnapshotStore());
  }

  /**
   * @param dsl connected to a database holding the event store tables
   * @return context backed by {@link JooqEventStore} and {@link JooqSnapshotStore}
   */
  public EnrollmentContext jooq(final DSLContext dsl) {
    final var codec = new EventCodec();
    return create(
        new JooqEventStore(dsl, clock, codec, config.storage().operationTimeout()),
        new JooqSnapshotStore(dsl, codec));
  }

  /**
   * @param eventStore to persist events in
   * @param snapshotStore to persist snapshots in, used only if enabled in the configuration
   * @return context with all handlers registered
   */
  public EnrollmentContext create(final EventStore eventStore, final SnapshotStore snapshotStore) {
    final var aggregate = new EnrollmentAggregate(clock, config.validation());
    final var repository =
        new EventSourcedEnrollmentRepository(
            eventStore, snapshotStore, aggregate, config.storage(), clock);
    final var dependencies =
        new CommandDependencies(aggregate, repository, publisher, notifications);

    final var context = new EnrollmentContext();
    context.addDomainCommandHandler(
        new RequestEnrollmentHandler(dependencies, config.businessRules(), students, courses));
    context.addDomainCommandHandler(new ApproveEnrollmentHandler(dependencies));
    context.addDomainCommandHandler(new CancelEnrollmentHandler(dependencies));
    context.addDomainCommandHandler(new CompleteEnrollmentHandler(dependencies));
    context.addDomainCommandHandler(new FailEnrollmentHandler(dependencies));
    context.addDomainQueryHandler(new GetEnrollmentHandler(aggregate, repository));
    context.addDomainQueryHandler(new GetEnrollmentHistoryHandler(aggregate, repository));
    return context;
  }
}
