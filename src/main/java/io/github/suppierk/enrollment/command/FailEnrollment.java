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

package io.github.suppierk.enrollment.command;

import io.github.suppierk.enrollment.authorization.AnonymousDomainClient;
import io.github.suppierk.enrollment.authorization.DomainClient;
import io.github.suppierk.enrollment.cqrs.DomainCommand;
import java.time.Instant;
import java.util.UUID;

/**
 * An approved enrollment is finished unsuccessfully.
 *
 * @param reason optional explanation
 */
public record FailEnrollment(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    String studentId,
    String courseId,
    String semester,
    String reason,
    String correlationId,
    String causationId)
    implements DomainCommand.Transition<UUID, Instant> {
  public FailEnrollment {
    messageId = messageId == null ? UUID.randomUUID() : messageId;
    createdAt = createdAt == null ? Instant.now() : createdAt;
    domainClient = domainClient == null ? AnonymousDomainClient.getInstance() : domainClient;
  }

  public static FailEnrollment of(
      final DomainClient domainClient,
      final String studentId,
      final String courseId,
      final String semester,
      final String reason) {
    return new FailEnrollment(
        null, null, domainClient, studentId, courseId, semester, reason, null, null);
  }
}
