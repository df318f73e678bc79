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

/** Delivers human-facing notifications, e.g. an e-mail to the student, about an event. */
public interface NotificationSink {
  static NotificationSink empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param notification to deliver
   * @param <N> is a generic {@link DomainNotification} type
   * @throws Exception if delivery failed
   */
  @SuppressWarnings("squid:S112")
  <N extends DomainNotification<?, ?>> void deliver(final N notification) throws Exception;

  final class NoOp implements NotificationSink {
    private static final NotificationSink INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public <N extends DomainNotification<?, ?>> void deliver(final N notification) {
      // Do nothing
    }
  }
}
