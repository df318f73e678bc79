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

package io.github.suppierk.enrollment.api;

import io.github.suppierk.enrollment.domain.EnrollmentError;
import java.util.Map;

/**
 * Flat, client-facing form of an {@link EnrollmentError}. Only the fields of the matching error
 * kind are set, the rest are {@code null}.
 *
 * @param kind {@code ValidationError}, {@code BusinessRuleError}, {@code NotFoundError}, {@code
 *     ConcurrencyError} or {@code TimeoutError}
 */
public record ErrorResponse(
    String kind,
    String message,
    String code,
    String timestamp,
    String field,
    String value,
    String rule,
    Map<String, Object> context,
    String entity,
    String entityId,
    Long expectedVersion,
    Long actualVersion) {

  public static ErrorResponse from(final EnrollmentError error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null");
    }

    final String timestamp = error.timestamp().toString();

    if (error instanceof EnrollmentError.Validation validation) {
      return new ErrorResponse(
          "ValidationError",
          validation.message(),
          validation.code(),
          timestamp,
          validation.field(),
          validation.value(),
          null,
          null,
          null,
          null,
          null,
          null);
    }

    if (error instanceof EnrollmentError.BusinessRule businessRule) {
      return new ErrorResponse(
          "BusinessRuleError",
          businessRule.message(),
          businessRule.code(),
          timestamp,
          null,
          null,
          businessRule.rule(),
          businessRule.context(),
          null,
          null,
          null,
          null);
    }

    if (error instanceof EnrollmentError.NotFound notFound) {
      return new ErrorResponse(
          "NotFoundError",
          notFound.message(),
          notFound.code(),
          timestamp,
          null,
          null,
          null,
          null,
          notFound.entity(),
          notFound.id(),
          null,
          null);
    }

    if (error instanceof EnrollmentError.Concurrency concurrency) {
      return new ErrorResponse(
          "ConcurrencyError",
          concurrency.message(),
          concurrency.code(),
          timestamp,
          null,
          null,
          null,
          null,
          "Enrollment",
          concurrency.streamId(),
          concurrency.expectedVersion(),
          concurrency.actualVersion());
    }

    final var timeout = (EnrollmentError.Timeout) error;
    return new ErrorResponse(
        "TimeoutError",
        timeout.message(),
        timeout.code(),
        timestamp,
        null,
        null,
        null,
        Map.of("operation", timeout.operation(), "timeoutMs", timeout.timeout().toMillis()),
        null,
        null,
        null,
        null);
  }
}
