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

import io.github.suppierk.enrollment.domain.EnrollmentEvent;
import java.util.List;

/**
 * Hands persisted events to whatever transports them onwards. Called only after the events were
 * appended; a failure here is logged by the caller and does not undo the append.
 */
public interface EventPublisher {
  /**
   * @return an instance of publisher which does not perform any operations
   */
  static EventPublisher empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param events to publish, in stream order
   * @throws Exception if delivery failed
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void publish(final List<EnrollmentEvent> events) throws Exception;

  /** Default implementation of the fake publisher */
  final class NoOp implements EventPublisher {
    private static final EventPublisher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final List<EnrollmentEvent> events) {
      // Do nothing
    }
  }
}
