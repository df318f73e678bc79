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

/** Kinds of {@link EnrollmentEvent}, named the way they are stored and published. */
public enum EventKind {
  REQUESTED("EnrollmentRequested"),
  APPROVED("EnrollmentApproved"),
  CANCELLED("EnrollmentCancelled"),
  COMPLETED("EnrollmentCompleted"),
  FAILED("EnrollmentFailed");

  private final String typeName;

  EventKind(final String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  /**
   * @param typeName as returned by {@link #typeName()}
   * @return matching kind
   * @throws IllegalArgumentException if the name is unknown
   */
  public static EventKind fromTypeName(final String typeName) {
    for (EventKind kind : values()) {
      if (kind.typeName.equals(typeName)) {
        return kind;
      }
    }

    throw new IllegalArgumentException("Unknown event type '%s'".formatted(typeName));
  }
}
