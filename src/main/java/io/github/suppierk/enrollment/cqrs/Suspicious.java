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

/**
 * Argument checks shared by the context and its handlers. Anything a caller hands in is
 * suspicious until checked: a missing argument is a programming error and fails fast with an
 * exception instead of becoming an {@code EnrollmentError}.
 */
abstract sealed class Suspicious permits EnrollmentContext, DomainHandler {
  /**
   * @throws IllegalStateException if value is null
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @throws IllegalArgumentException if value is null
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @throws UnsupportedOperationException if value is null, i.e. nothing can handle the request
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatIsMissing)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is not supported".formatted(whatIsMissing));
    }

    return value;
  }
}
