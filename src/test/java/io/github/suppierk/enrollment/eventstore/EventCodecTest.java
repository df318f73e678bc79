package io.github.suppierk.enrollment.eventstore;

import static io.github.suppierk.test.Fixtures.ID;
import static io.github.suppierk.test.Fixtures.NOW;
import static io.github.suppierk.test.Fixtures.requested;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import org.junit.jupiter.api.Test;

class EventCodecTest {
  private final EventCodec codec = new EventCodec();

  @Test
  void when_event_is_encoded_then_type_and_iso_timestamps_are_written() {
    final var json = codec.encodeEvent(requested(ID, 1));

    assertTrue(json.contains("\"eventType\":\"EnrollmentRequested\""), json);
    assertTrue(json.contains("\"occurredAt\":\"2025-03-01T10:00:00Z\""), json);
    assertFalse(json.contains("\"kind\""), json);
  }

  @Test
  void when_event_is_decoded_then_it_equals_the_original() {
    final var event = requested(ID, 1);

    final var decoded = codec.decodeEvent(codec.encodeEvent(event));

    final var requested = assertInstanceOf(EnrollmentEvent.Requested.class, decoded);
    assertEquals(event, requested);
    assertEquals("web", requested.metadata().get("channel"));
  }

  @Test
  void when_state_is_decoded_then_it_equals_the_original() {
    final var state = new Enrollment.Approved(ID, 2, NOW, NOW.plusSeconds(5), "registrar");

    final var json = codec.encodeState(state);

    assertTrue(json.contains("\"state\":\"approved\""), json);
    assertFalse(json.contains("\"terminal\""), json);
    assertEquals(state, codec.decodeState(json));
  }

  @Test
  void when_payload_has_unknown_fields_then_they_are_ignored() {
    final var json =
        codec.encodeEvent(requested(ID, 1)).replaceFirst("\\{", "{\"schemaRevision\":2,");

    assertEquals(ID, codec.decodeEvent(json).enrollmentId());
  }

  @Test
  void when_payload_is_corrupted_then_codec_exception() {
    assertThrows(EventCodec.CodecException.class, () -> codec.decodeEvent("{\"eventType\":"));
    assertThrows(
        EventCodec.CodecException.class, () -> codec.decodeEvent("{\"eventType\":\"Unknown\"}"));
  }
}
