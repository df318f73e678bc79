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

import io.github.suppierk.enrollment.authorization.AnonymousDomainClient;
import io.github.suppierk.enrollment.authorization.DomainClient;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Anything travelling through the enrollment context: commands, queries and the events they
 * produce.
 *
 * @param <I> type of the message identifier
 * @param <T> type of the creation timestamp
 */
// @formatter:off
public interface DomainMessage<
  I extends Serializable,
  T extends Temporal & Serializable
> extends Serializable {
// @formatter:on

  /**
   * Named {@code messageId()} rather than {@code id()} so that records can still use {@code id}
   * for the enrollment they talk about.
   *
   * @return identifier of this particular message
   */
  I messageId();

  /**
   * @return when the message was created
   */
  T createdAt();

  /**
   * @return the client who sent the message
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
