package io.github.suppierk.enrollment.async;

import static io.github.suppierk.test.Fixtures.ID;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.suppierk.test.Fixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class NoOpCollaboratorsTest {
  @Test
  void when_empty_publisher_is_used_then_nothing_happens() {
    assertSame(EventPublisher.empty(), EventPublisher.empty());
    assertDoesNotThrow(() -> EventPublisher.empty().publish(List.of(Fixtures.requested(ID, 1))));
  }

  @Test
  void when_empty_sink_is_used_then_nothing_happens() {
    assertSame(NotificationSink.empty(), NotificationSink.empty());
    assertDoesNotThrow(() -> NotificationSink.empty().deliver(Fixtures.approved(ID, 2)));
  }

  @Test
  void when_event_is_seen_as_notification_then_its_identity_is_exposed() {
    final var event = Fixtures.requested(ID, 1);
    final DomainNotification<?, ?> notification = event;

    assertEquals(event.eventId(), notification.messageId());
    assertEquals(event.occurredAt(), notification.createdAt());
    assertEquals("corr-1", notification.correlationId());
  }
}
