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

import io.github.suppierk.enrollment.authorization.DomainClient;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import io.github.suppierk.enrollment.domain.Result;
import java.util.AbstractMap;
import java.util.Map;

/**
 * Steps every handler runs before its own logic: turning the raw {@link EnrollmentReference} into
 * a valid {@link EnrollmentId} and checking that the {@link DomainClient} may use the handler.
 *
 * @param <OPERATION> the command or query type
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION extends EnrollmentReference> extends Suspicious
    permits DomainCommandHandler, DomainQueryHandler {
  static final String AUTHORIZATION_RULE = "CLIENT_NOT_AUTHORIZED";

  private final EnrollmentAggregate aggregate;

  DomainHandler(final EnrollmentAggregate aggregate) {
    this.aggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
  }

  protected final EnrollmentAggregate aggregate() {
    return aggregate;
  }

  /**
   * Defines whether the client can invoke this handler. Open to everyone unless overridden.
   *
   * @param domainClient to check
   * @return {@code true} if client can use this handler
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return true;
  }

  /**
   * @param operation to read identity parts from
   * @param code reported for any malformed part
   * @return valid identity or a validation error naming the offending field
   */
  final Result<EnrollmentId, EnrollmentError> validate(
      final OPERATION operation, final String code) {
    final var missing = firstBlank(operation);
    if (missing != null) {
      return Result.failure(
          new EnrollmentError.Validation(
              code,
              missing.getKey(),
              missing.getValue(),
              "%s is required".formatted(missing.getKey())));
    }

    final var id =
        new EnrollmentId(operation.studentId(), operation.courseId(), operation.semester());
    return aggregate
        .validateIdentity(id)
        .mapError(
            error -> {
              if (error instanceof EnrollmentError.Validation validation) {
                return new EnrollmentError.Validation(
                    code, validation.field(), validation.value(), validation.message());
              }

              return error;
            });
  }

  /**
   * @param domainClient sending the message
   * @param messageClass for error reporting
   * @param id passed through on success
   * @return the id, or an authorization error
   * @throws IllegalStateException if the client has no role
   */
  final Result<EnrollmentId, EnrollmentError> authorize(
      final DomainClient domainClient, final Class<?> messageClass, final EnrollmentId id) {
    final String role = throwIllegalStateIfNull(domainClient.domainRole(), "Client role");
    if (canBeUsedBy(domainClient)) {
      return Result.success(id);
    }

    return Result.failure(
        new EnrollmentError.BusinessRule(
            AUTHORIZATION_RULE,
            ErrorCodes.UNAUTHORIZED,
            "Client '%s' is not allowed to use '%s'"
                .formatted(role, messageClass.getSimpleName()),
            Map.of("role", role)));
  }

  private static Map.Entry<String, String> firstBlank(final EnrollmentReference reference) {
    if (isBlank(reference.studentId())) {
      return entry("studentId", reference.studentId());
    }

    if (isBlank(reference.courseId())) {
      return entry("courseId", reference.courseId());
    }

    if (isBlank(reference.semester())) {
      return entry("semester", reference.semester());
    }

    return null;
  }

  private static Map.Entry<String, String> entry(final String field, final String value) {
    return new AbstractMap.SimpleImmutableEntry<>(field, value);
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
