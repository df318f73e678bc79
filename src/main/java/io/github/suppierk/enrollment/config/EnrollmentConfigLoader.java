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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link EnrollmentConfig} in three layers, later ones winning:
 *
 * <ol>
 *   <li>the preset of the environment named by {@code ENROLLMENT_ENVIRONMENT}
 *   <li>an optional classpath properties file, keys like {@code enrollment.snapshot.interval}
 *   <li>environment variables, keys like {@code ENROLLMENT_SNAPSHOT_INTERVAL}
 * </ol>
 */
public final class EnrollmentConfigLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(EnrollmentConfigLoader.class);

  public static final String ENV_PREFIX = "ENROLLMENT_";
  public static final String PROPERTY_PREFIX = "enrollment.";
  public static final String DEFAULT_RESOURCE = "enrollment.properties";

  static final String ENVIRONMENT = "ENVIRONMENT";
  static final String STUDENT_ID_PATTERN = "STUDENT_ID_PATTERN";
  static final String COURSE_ID_PATTERN = "COURSE_ID_PATTERN";
  static final String SEMESTER_PATTERN = "SEMESTER_PATTERN";
  static final String SEMESTER_PAST_YEARS = "SEMESTER_PAST_YEARS";
  static final String SEMESTER_FUTURE_YEARS = "SEMESTER_FUTURE_YEARS";
  static final String ALLOW_DUPLICATE_REQUESTS = "ALLOW_DUPLICATE_REQUESTS";
  static final String SNAPSHOT_ENABLED = "SNAPSHOT_ENABLED";
  static final String SNAPSHOT_INTERVAL = "SNAPSHOT_INTERVAL";
  static final String OPERATION_TIMEOUT_MS = "OPERATION_TIMEOUT_MS";

  private final Map<String, String> environment;
  private final Properties properties;

  /**
   * @param environment variables, usually {@link System#getenv()}
   * @param properties file contents, may be empty
   */
  public EnrollmentConfigLoader(final Map<String, String> environment, final Properties properties) {
    if (environment == null || properties == null) {
      throw new IllegalArgumentException("Environment and properties cannot be null");
    }

    this.environment = Map.copyOf(environment);
    this.properties = properties;
  }

  /**
   * @return loader reading process environment and {@value #DEFAULT_RESOURCE}
   */
  public static EnrollmentConfigLoader fromSystem() {
    return fromClasspath(DEFAULT_RESOURCE, System.getenv());
  }

  /**
   * @param resource name of a properties file on the classpath, ignored if missing
   * @param environment variables to overlay on top of the file
   * @return configured loader
   * @throws IllegalStateException if the resource exists but cannot be read
   */
  public static EnrollmentConfigLoader fromClasspath(
      final String resource, final Map<String, String> environment) {
    final var properties = new Properties();
    final var classLoader = EnrollmentConfigLoader.class.getClassLoader();

    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in != null) {
        properties.load(in);
        LOGGER.debug("Loaded enrollment settings from classpath resource '{}'", resource);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read '%s'".formatted(resource), e);
    }

    return new EnrollmentConfigLoader(environment, properties);
  }

  /**
   * @return resolved configuration
   * @throws IllegalArgumentException if any supplied value is malformed or out of range
   */
  public EnrollmentConfig load() {
    final var preset =
        EnrollmentConfig.forEnvironment(
            lookup(ENVIRONMENT)
                .map(value -> parseEnvironment(value))
                .orElse(EnrollmentConfig.Environment.DEVELOPMENT));

    final var defaultValidation = preset.validation();
    final var validation =
        new EnrollmentConfig.Validation(
            lookup(STUDENT_ID_PATTERN).orElse(defaultValidation.studentIdPattern()),
            lookup(COURSE_ID_PATTERN).orElse(defaultValidation.courseIdPattern()),
            lookup(SEMESTER_PATTERN).orElse(defaultValidation.semesterPattern()),
            intSetting(SEMESTER_PAST_YEARS, defaultValidation.pastYears()),
            intSetting(SEMESTER_FUTURE_YEARS, defaultValidation.futureYears()));

    final var businessRules =
        new EnrollmentConfig.BusinessRules(
            booleanSetting(
                ALLOW_DUPLICATE_REQUESTS, preset.businessRules().allowDuplicateRequests()));

    final var defaultStorage = preset.storage();
    final var storage =
        new EnrollmentConfig.Storage(
            booleanSetting(SNAPSHOT_ENABLED, defaultStorage.snapshotsEnabled()),
            intSetting(SNAPSHOT_INTERVAL, defaultStorage.snapshotInterval()),
            Duration.ofMillis(
                intSetting(OPERATION_TIMEOUT_MS, (int) defaultStorage.operationTimeout().toMillis())));

    final var config =
        preset.withValidation(validation).withBusinessRules(businessRules).withStorage(storage);
    LOGGER.info(
        "Enrollment settings resolved for {} environment: snapshots={}, interval={}",
        config.environment(),
        storage.snapshotsEnabled(),
        storage.snapshotInterval());
    return config;
  }

  private Optional<String> lookup(final String setting) {
    final var fromEnvironment = environment.get(ENV_PREFIX + setting);
    if (fromEnvironment != null && !fromEnvironment.isBlank()) {
      return Optional.of(fromEnvironment.trim());
    }

    final var propertyKey = PROPERTY_PREFIX + setting.toLowerCase(Locale.ROOT).replace('_', '.');
    return Optional.ofNullable(properties.getProperty(propertyKey))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  private int intSetting(final String setting, final int fallback) {
    final var value = lookup(setting);
    if (value.isEmpty()) {
      return fallback;
    }

    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Setting %s expects an integer, got '%s'".formatted(setting, value.get()), e);
    }
  }

  private boolean booleanSetting(final String setting, final boolean fallback) {
    return lookup(setting)
        .map(
            value -> {
              if ("true".equalsIgnoreCase(value)) {
                return true;
              }

              if ("false".equalsIgnoreCase(value)) {
                return false;
              }

              throw new IllegalArgumentException(
                  "Setting %s expects true or false, got '%s'".formatted(setting, value));
            })
        .orElse(fallback);
  }

  private static EnrollmentConfig.Environment parseEnvironment(final String value) {
    try {
      return EnrollmentConfig.Environment.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown environment '%s'".formatted(value), e);
    }
  }
}
