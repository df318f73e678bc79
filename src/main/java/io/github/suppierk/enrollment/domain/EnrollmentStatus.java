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

import java.util.Locale;

/** Lifecycle position of an {@link Enrollment}. */
public enum EnrollmentStatus {
  REQUESTED(false),
  APPROVED(false),
  CANCELLED(true),
  COMPLETED(true),
  FAILED(true);

  private final boolean terminal;

  EnrollmentStatus(final boolean terminal) {
    this.terminal = terminal;
  }

  /**
   * @return {@code true} if no event may follow this status
   */
  public boolean isTerminal() {
    return terminal;
  }

  /**
   * @return lower-case name used in responses
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
