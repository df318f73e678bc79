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

package io.github.suppierk.enrollment.repository;

import io.github.suppierk.enrollment.domain.EnrollmentId;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps an {@link EnrollmentId} to the name of its stream, {@code enrollment-S1-C1-2025-fall}.
 *
 * <p>Student and course ids never contain {@code -}, so the mapping is injective and {@link
 * #parse(String)} can invert it; everything after the course id is the semester.
 */
public final class StreamId {
  public static final String PREFIX = "enrollment";

  private static final Pattern FORMAT = Pattern.compile("^" + PREFIX + "-([^-]+)-([^-]+)-(.+)$");

  private StreamId() {
    // Utility class
  }

  public static String of(final EnrollmentId id) {
    if (id == null) {
      throw new IllegalArgumentException("Enrollment id cannot be null");
    }

    if (id.studentId().contains("-") || id.courseId().contains("-")) {
      throw new IllegalArgumentException(
          "Student and course ids cannot contain '-', got %s".formatted(id));
    }

    return "%s-%s-%s-%s".formatted(PREFIX, id.studentId(), id.courseId(), id.semester());
  }

  /**
   * @param streamId produced by {@link #of(EnrollmentId)}
   * @return the enrollment id, empty if the stream id has a different format
   */
  public static Optional<EnrollmentId> parse(final String streamId) {
    if (streamId == null) {
      return Optional.empty();
    }

    final var matcher = FORMAT.matcher(streamId);
    if (!matcher.matches()) {
      return Optional.empty();
    }

    return Optional.of(new EnrollmentId(matcher.group(1), matcher.group(2), matcher.group(3)));
  }
}
