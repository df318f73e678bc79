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

package io.github.suppierk.enrollment.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.enrollment.domain.Enrollment;
import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import java.io.Serial;

/**
 * JSON form of events and snapshot states as stored by the relational stores. Timestamps are
 * written as ISO-8601 strings, the concrete type goes into {@code eventType} or {@code state}.
 */
public final class EventCodec {
  private final ObjectMapper mapper;

  public EventCodec() {
    this(defaultMapper());
  }

  /**
   * @param mapper configured with {@link JavaTimeModule}
   */
  public EventCodec(final ObjectMapper mapper) {
    if (mapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.mapper = mapper;
  }

  /**
   * @return mapper used when none is supplied
   */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encodeEvent(final EnrollmentEvent event) {
    try {
      return mapper.writerFor(EnrollmentEvent.class).writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to serialize event %s".formatted(event.eventId()), e);
    }
  }

  public EnrollmentEvent decodeEvent(final String json) {
    try {
      return mapper.readValue(json, EnrollmentEvent.class);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to deserialize event", e);
    }
  }

  public String encodeState(final Enrollment state) {
    try {
      return mapper.writerFor(Enrollment.class).writeValueAsString(state);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to serialize state of %s".formatted(state.id()), e);
    }
  }

  public Enrollment decodeState(final String json) {
    try {
      return mapper.readValue(json, Enrollment.class);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to deserialize state", e);
    }
  }

  /** Stored data cannot be converted. Points at a corrupted row or an incompatible schema. */
  public static class CodecException extends RuntimeException {
    @Serial private static final long serialVersionUID = -6094310857745329102L;

    public CodecException(final String message, final Throwable cause) {
      super(message, cause);
    }
  }
}
