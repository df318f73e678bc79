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

package io.github.suppierk.enrollment.query;

import io.github.suppierk.enrollment.api.EnrollmentResponse;
import io.github.suppierk.enrollment.cqrs.DomainQueryHandler;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.repository.EnrollmentRepository;
import java.util.Optional;

public final class GetEnrollmentHandler
    extends DomainQueryHandler.One<GetEnrollment, EnrollmentResponse> {
  public GetEnrollmentHandler(
      final EnrollmentAggregate aggregate, final EnrollmentRepository repository) {
    super(GetEnrollment.class, aggregate, repository);
  }

  @Override
  protected Result<Optional<EnrollmentResponse>, EnrollmentError> run(
      final GetEnrollment query, final EnrollmentId id) {
    return repository().findByIdentity(id).map(found -> found.map(EnrollmentResponse::from));
  }
}
