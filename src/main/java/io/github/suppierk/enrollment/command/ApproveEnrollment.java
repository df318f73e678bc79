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
import io.github.suppierk.enrollment.authorization.StaffDomainClient;
import io.github.suppierk.enrollment.cqrs.DomainCommand;
import java.time.Instant;
import java.util.UUID;

/**
 * Registrar staff approves a requested enrollment.
 *
 * @param approvedBy name recorded as the approver
 */
public record ApproveEnrollment(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    String studentId,
    String courseId,
    String semester,
    String approvedBy,
    String correlationId,
    String causationId)
    implements DomainCommand.Transition<UUID, Instant> {
  public ApproveEnrollment {
    messageId = messageId == null ? UUID.randomUUID() : messageId;
    createdAt = createdAt == null ? Instant.now() : createdAt;
    domainClient = domainClient == null ? AnonymousDomainClient.getInstance() : domainClient;
  }

  public static ApproveEnrollment of(
      final DomainClient domainClient,
      final String studentId,
      final String courseId,
      final String semester,
      final String approvedBy) {
    return new ApproveEnrollment(
        null, null, domainClient, studentId, courseId, semester, approvedBy, null, null);
  }

  /**
   * Approval recorded under the staff member's own name.
   *
   * @param staff approving the enrollment
   * @return command approved by {@link StaffDomainClient#principal()}
   */
  public static ApproveEnrollment by(
      final StaffDomainClient staff,
      final String studentId,
      final String courseId,
      final String semester) {
    return of(staff, studentId, courseId, semester, staff.principal());
  }
}
