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

package io.github.suppierk.enrollment.cqrs;

import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.Map;

/**
 * Request to change an enrollment. {@link Create} opens a new stream, {@link Transition} moves an
 * existing one along.
 *
 * @param <I> type of the message identifier
 * @param <T> type of the creation timestamp
 */
// @formatter:off
public sealed interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>, EnrollmentReference
permits
  DomainCommand.Create, DomainCommand.Transition
{
// @formatter:on

  /**
   * @return identifier shared by all messages of one interaction, may be {@code null}
   */
  String correlationId();

  /**
   * @return identifier of the message that caused this command, may be {@code null} in which case
   *     the command's own {@link #messageId()} is recorded as the cause of its event
   */
  String causationId();

  // @formatter:off
  non-sealed interface Create<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return free-form attributes stored with the opening event
     */
    default Map<String, String> metadata() {
      return Map.of();
    }
  }

  // @formatter:off
  non-sealed interface Transition<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {}
  // @formatter:on
}
