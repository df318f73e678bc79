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

/**
 * Read-only request about an enrollment, answered either with at most {@link One} result or with
 * {@link Many}.
 */
// @formatter:off
public sealed interface DomainQuery<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>, EnrollmentReference
permits
  DomainQuery.One, DomainQuery.Many
{
// @formatter:on

  // @formatter:off
  non-sealed interface One<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainQuery<I, T> {}
  // @formatter:on

  // @formatter:off
  non-sealed interface Many<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainQuery<I, T> {}
  // @formatter:on
}
