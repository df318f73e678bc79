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

package io.github.suppierk.enrollment.config;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Settings of the enrollment context. Instances are immutable and passed explicitly to the
 * components that need them; use {@link EnrollmentConfigLoader} to build one from the environment.
 *
 * @param environment preset the settings started from
 * @param validation identity format and semester window rules
 * @param businessRules switches for optional business rules
 * @param storage event store and snapshot settings
 */
public record EnrollmentConfig(
    Environment environment,
    Validation validation,
    BusinessRules businessRules,
    Storage storage) {
  public static final String DEFAULT_STUDENT_ID_PATTERN = "^[A-Z0-9]{1,20}$";
  public static final String DEFAULT_COURSE_ID_PATTERN = "^[A-Z0-9]{1,20}$";
  public static final String DEFAULT_SEMESTER_PATTERN = "^\\d{4}-(spring|summer|fall)$";

  public EnrollmentConfig {
    if (environment == null || validation == null || businessRules == null || storage == null) {
      throw new IllegalArgumentException("Configuration sections cannot be null");
    }
  }

  /**
   * @return development preset
   */
  public static EnrollmentConfig defaults() {
    return forEnvironment(Environment.DEVELOPMENT);
  }

  /**
   * @param environment to get the preset for
   * @return preset settings of the given environment
   */
  public static EnrollmentConfig forEnvironment(final Environment environment) {
    final var validation =
        new Validation(
            DEFAULT_STUDENT_ID_PATTERN, DEFAULT_COURSE_ID_PATTERN, DEFAULT_SEMESTER_PATTERN, 1, 1);
    final var businessRules = new BusinessRules(false);

    return switch (environment) {
      case DEVELOPMENT -> new EnrollmentConfig(
          environment, validation, businessRules, new Storage(false, 10, Duration.ofSeconds(10)));
      case TEST -> new EnrollmentConfig(
          environment, validation, businessRules, new Storage(false, 10, Duration.ofSeconds(1)));
      case PRODUCTION -> new EnrollmentConfig(
          environment, validation, businessRules, new Storage(true, 50, Duration.ofSeconds(10)));
    };
  }

  public EnrollmentConfig withValidation(final Validation validation) {
    return new EnrollmentConfig(environment, validation, businessRules, storage);
  }

  public EnrollmentConfig withBusinessRules(final BusinessRules businessRules) {
    return new EnrollmentConfig(environment, validation, businessRules, storage);
  }

  public EnrollmentConfig withStorage(final Storage storage) {
    return new EnrollmentConfig(environment, validation, businessRules, storage);
  }

  public enum Environment {
    DEVELOPMENT,
    TEST,
    PRODUCTION
  }

  /**
   * @param pastYears how many years before the current one a semester may lie, 0 to 5
   * @param futureYears how many years after the current one a semester may lie, 0 to 5
   */
  public record Validation(
      String studentIdPattern,
      String courseIdPattern,
      String semesterPattern,
      int pastYears,
      int futureYears) {
    public Validation {
      // Pattern.compile throws PatternSyntaxException, an IllegalArgumentException
      Pattern.compile(requireText(studentIdPattern, "Student id pattern"));
      Pattern.compile(requireText(courseIdPattern, "Course id pattern"));
      Pattern.compile(requireText(semesterPattern, "Semester pattern"));
      requireRange(pastYears, 0, 5, "Past years");
      requireRange(futureYears, 0, 5, "Future years");
    }
  }

  /**
   * @param allowDuplicateRequests when set, a second request for an existing enrollment is not
   *     rejected up front
   */
  public record BusinessRules(boolean allowDuplicateRequests) {}

  /**
   * @param snapshotsEnabled whether the repository stores snapshots
   * @param snapshotInterval a snapshot is taken whenever the stream version is a multiple of it
   * @param operationTimeout upper bound for waiting on a stream lock or a database statement
   */
  public record Storage(boolean snapshotsEnabled, int snapshotInterval, Duration operationTimeout) {
    public Storage {
      requireRange(snapshotInterval, 1, 1000, "Snapshot interval");
      if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
        throw new IllegalArgumentException("Operation timeout must be positive");
      }
    }
  }

  private static String requireText(final String value, final String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("%s cannot be blank".formatted(what));
    }

    return value;
  }

  private static void requireRange(final int value, final int min, final int max, final String what) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          "%s must be between %d and %d, got %d".formatted(what, min, max, value));
    }
  }
}
