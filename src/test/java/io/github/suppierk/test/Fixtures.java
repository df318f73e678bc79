package io.github.suppierk.test;

import io.github.suppierk.enrollment.config.EnrollmentConfig;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/** Shared values of the tests: a clock frozen in March 2025 and a valid enrollment. */
public final class Fixtures {
  public static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
  public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  public static final EnrollmentConfig CONFIG =
      EnrollmentConfig.forEnvironment(EnrollmentConfig.Environment.TEST);
  public static final EnrollmentId ID = new EnrollmentId("S12345", "CS101", "2025-fall");
  public static final String STREAM = "enrollment-S12345-CS101-2025-fall";

  private Fixtures() {
    // No instance
  }

  public static EnrollmentAggregate aggregate() {
    return new EnrollmentAggregate(CLOCK, CONFIG.validation());
  }

  public static EnrollmentEvent.Requested requested(final EnrollmentId id, final long version) {
    return new EnrollmentEvent.Requested(
        UUID.randomUUID(), id, NOW, version, "corr-1", null, NOW, Map.of("channel", "web"));
  }

  public static EnrollmentEvent.Approved approved(final EnrollmentId id, final long version) {
    return new EnrollmentEvent.Approved(
        UUID.randomUUID(), id, NOW.plusSeconds(60), version, null, null, "registrar");
  }

  public static EnrollmentEvent.Cancelled cancelled(final EnrollmentId id, final long version) {
    return new EnrollmentEvent.Cancelled(
        UUID.randomUUID(), id, NOW.plusSeconds(120), version, null, null, "schedule conflict");
  }

  public static EnrollmentEvent.Completed completed(final EnrollmentId id, final long version) {
    return new EnrollmentEvent.Completed(
        UUID.randomUUID(), id, NOW.plusSeconds(180), version, null, null, "A");
  }

  public static EnrollmentEvent.Failed failed(final EnrollmentId id, final long version) {
    return new EnrollmentEvent.Failed(
        UUID.randomUUID(), id, NOW.plusSeconds(180), version, null, null, "attendance");
  }
}
