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

package io.github.suppierk.enrollment.command;

import io.github.suppierk.enrollment.authorization.DomainClient;
import io.github.suppierk.enrollment.cqrs.CommandDependencies;
import io.github.suppierk.enrollment.cqrs.DomainCommandHandler;
import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EventOptions;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.domain.StateChange;

public final class CompleteEnrollmentHandler
    extends DomainCommandHandler.Transition<CompleteEnrollment> {
  public CompleteEnrollmentHandler(final CommandDependencies dependencies) {
    super(CompleteEnrollment.class, dependencies);
  }

  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return StaffOnly.allows(domainClient);
  }

  @Override
  protected Result<StateChange, EnrollmentError> transition(
      final CompleteEnrollment command, final Enrollment current, final EventOptions options) {
    return aggregate().complete(current, command.grade(), options);
  }
}
