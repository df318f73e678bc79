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

package io.github.suppierk.enrollment.authorization;

/**
 * Registrar staff member allowed to approve, complete and fail enrollments.
 *
 * @param principal name of the staff member, recorded as the approver where relevant
 */
public record StaffDomainClient(String principal) implements DomainClient {
  public static final String ROLE = "STAFF";

  public StaffDomainClient {
    if (principal == null || principal.isBlank()) {
      throw new IllegalArgumentException("Staff principal cannot be blank");
    }
  }

  /** {@inheritDoc} */
  @Override
  public String domainRole() {
    return ROLE;
  }
}
