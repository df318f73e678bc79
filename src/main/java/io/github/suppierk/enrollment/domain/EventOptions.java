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

import java.util.Map;

/**
 * Tracing attributes copied onto a newly created event.
 *
 * @param correlationId ties all messages of one interaction together, may be {@code null}
 * @param causationId identifier of the message that caused the event, may be {@code null}
 * @param metadata free-form attributes, only stored with {@link EnrollmentEvent.Requested}
 */
public record EventOptions(String correlationId, String causationId, Map<String, String> metadata) {
  private static final EventOptions NONE = new EventOptions(null, null, Map.of());

  public EventOptions {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static EventOptions none() {
    return NONE;
  }
}
