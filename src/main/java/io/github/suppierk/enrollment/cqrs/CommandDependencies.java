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

import io.github.suppierk.enrollment.async.EventPublisher;
import io.github.suppierk.enrollment.async.NotificationSink;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.repository.EnrollmentRepository;

/** Collaborators every {@link DomainCommandHandler} works with. */
public record CommandDependencies(
    EnrollmentAggregate aggregate,
    EnrollmentRepository repository,
    EventPublisher publisher,
    NotificationSink notifications) {
  public CommandDependencies {
    if (aggregate == null || repository == null || publisher == null || notifications == null) {
      throw new IllegalArgumentException("Command handler dependencies cannot be null");
    }
  }
}
