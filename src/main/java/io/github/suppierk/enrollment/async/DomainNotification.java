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

package io.github.suppierk.enrollment.async;

import io.github.suppierk.enrollment.cqrs.DomainMessage;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * A message that leaves the context after a command succeeded. Domain events are the only
 * notifications this library emits.
 */
// @formatter:off
public interface DomainNotification<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T> {

  /**
   * @return identifier of the message that caused this notification, if known
   */
  default String causationId() {
    return null;
  }

  /**
   * @return identifier tying together every message of one business interaction, if known
   */
  default String correlationId() {
    return null;
  }
}
// @formatter:on
