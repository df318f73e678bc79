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

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Expected failure of an enrollment operation. Errors are returned inside a {@link Result}, never
 * thrown: exceptions are reserved for programming mistakes such as {@code null} arguments.
 */
public sealed interface EnrollmentError extends Serializable
    permits EnrollmentError.Validation,
        EnrollmentError.BusinessRule,
        EnrollmentError.NotFound,
        EnrollmentError.Concurrency,
        EnrollmentError.Timeout {

  /**
   * @return one of {@link ErrorCodes}
   */
  String code();

  String message();

  Instant timestamp();

  /** Input is malformed. */
  record Validation(String code, String field, String value, String message, Instant timestamp)
      implements EnrollmentError {
    public Validation(
        final String code, final String field, final String value, final String message) {
      this(code, field, value, message, Instant.now());
    }
  }

  /**
   * Input is well-formed but violates a rule of the domain.
   *
   * @param rule name of the violated rule
   * @param context values that led to the violation, for diagnostics
   */
  record BusinessRule(
      String rule, String code, String message, Map<String, Object> context, Instant timestamp)
      implements EnrollmentError {
    public BusinessRule {
      context = context == null ? Map.of() : Map.copyOf(context);
    }

    public BusinessRule(
        final String rule,
        final String code,
        final String message,
        final Map<String, Object> context) {
      this(rule, code, message, context, Instant.now());
    }
  }

  record NotFound(String entity, String id, String code, Instant timestamp)
      implements EnrollmentError {
    public NotFound(final String entity, final String id, final String code) {
      this(entity, id, code, Instant.now());
    }

    @Override
    public String message() {
      return "%s with id %s not found".formatted(entity, id);
    }
  }

  /** Stream version did not match what the writer expected. */
  record Concurrency(long expectedVersion, long actualVersion, String streamId, Instant timestamp)
      implements EnrollmentError {
    public Concurrency(final long expectedVersion, final long actualVersion, final String streamId) {
      this(expectedVersion, actualVersion, streamId, Instant.now());
    }

    @Override
    public String code() {
      return ErrorCodes.CONCURRENCY_ERROR;
    }

    @Override
    public String message() {
      return "Optimistic lock failure. Expected version %d, but was %d"
          .formatted(expectedVersion, actualVersion);
    }
  }

  /** A blocking operation did not finish within its configured limit. */
  record Timeout(String operation, Duration timeout, Instant timestamp)
      implements EnrollmentError {
    public Timeout(final String operation, final Duration timeout) {
      this(operation, timeout, Instant.now());
    }

    @Override
    public String code() {
      return ErrorCodes.OPERATION_TIMED_OUT;
    }

    @Override
    public String message() {
      return "Operation '%s' did not complete within %d ms"
          .formatted(operation, timeout.toMillis());
    }
  }
}
