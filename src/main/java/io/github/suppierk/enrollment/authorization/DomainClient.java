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

import java.io.Serializable;

/** Whoever sends commands and queries to the enrollment context. */
public interface DomainClient extends Serializable {
  /**
   * @return role under which the client acts, checked by handlers before any work is done
   */
  String domainRole();

  /**
   * @return {@code true} if the client did not identify itself
   */
  default boolean isAnonymous() {
    return AnonymousDomainClient.ROLE.equals(domainRole());
  }
}
