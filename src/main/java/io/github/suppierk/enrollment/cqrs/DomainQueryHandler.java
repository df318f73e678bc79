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

import io.github.suppierk.enrollment.api.ErrorResponse;
import io.github.suppierk.enrollment.authorization.DomainClient;
import io.github.suppierk.enrollment.domain.EnrollmentAggregate;
import io.github.suppierk.enrollment.domain.EnrollmentError;
import io.github.suppierk.enrollment.domain.EnrollmentId;
import io.github.suppierk.enrollment.domain.ErrorCodes;
import io.github.suppierk.enrollment.domain.Result;
import io.github.suppierk.enrollment.repository.EnrollmentRepository;
import io.github.suppierk.java.Try;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to answer a specific {@link DomainQuery} without side effects.
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <OUTPUT> the answer, {@link Optional} or {@link List}
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainQueryHandler<
  QUERY extends DomainQuery<?, ?>,
  OUTPUT
>
extends
        DomainHandler<QUERY>
permits
  DomainQueryHandler.One,
  DomainQueryHandler.Many
{
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(DomainQueryHandler.class);

  private final Class<QUERY> queryClass;
  private final EnrollmentRepository repository;

  /**
   * Default constructor.
   *
   * @param queryClass this handler is intended for
   * @param aggregate to validate identities with
   * @param repository to read enrollments from
   */
  protected DomainQueryHandler(
      final Class<QUERY> queryClass,
      final EnrollmentAggregate aggregate,
      final EnrollmentRepository repository) {
    super(aggregate);
    this.queryClass = throwIllegalArgumentIfNull(queryClass, "Query class");
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
  }

  /**
   * @return specific {@link DomainQuery} class
   */
  public final Class<QUERY> getQueryClass() {
    return queryClass;
  }

  protected final EnrollmentRepository repository() {
    return repository;
  }

  /**
   * Defines business logic of this particular {@link DomainQueryHandler}.
   *
   * @param query being invoked
   * @param id validated identity the query refers to
   * @return the answer, or an error if stored data cannot be interpreted
   * @throws Exception if any happened during invocation
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract Result<OUTPUT, EnrollmentError> run(final QUERY query, final EnrollmentId id)
      throws Exception;

  /**
   * General business logic invocation to be used and exposed via {@link EnrollmentContext}.
   *
   * <p>The usage of {@link Try} will "hide" the exception that can be thrown by {@link
   * #run(DomainQuery, EnrollmentId)} - but not get rid of it. The exception is logged and then
   * rethrown to the caller of {@link EnrollmentContext}.
   *
   * @param query being invoked
   * @return a result of query invocation
   */
  final Result<OUTPUT, ErrorResponse> runInContext(final QUERY query) {
    final QUERY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullQuery.domainClient(), "Query's client");

    return validate(nonNullQuery, ErrorCodes.INVALID_QUERY_FORMAT)
        .flatMap(id -> authorize(nonNullDomainClient, getQueryClass(), id))
        .flatMap(id -> answer(nonNullQuery, id))
        .mapError(ErrorResponse::from);
  }

  private Result<OUTPUT, EnrollmentError> answer(final QUERY query, final EnrollmentId id) {
    final Try<Result<OUTPUT, EnrollmentError>> output =
        Try.of(() -> throwIllegalStateIfNull(run(query, id), "Query handler result"));

    output.ifFailure(
        reason ->
            LOGGER.warn("{} for {} failed", getQueryClass().getSimpleName(), id, reason));

    return output.get();
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.One}.
   *
   * @param <ONE> the type of the particular {@link DomainQuery.One}
   * @param <VIEW> the answer type
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends DomainQuery.One<?,  ?>,
    VIEW
  > extends DomainQueryHandler<ONE, Optional<VIEW>> {
  // @formatter:on
    protected One(
        final Class<ONE> queryClass,
        final EnrollmentAggregate aggregate,
        final EnrollmentRepository repository) {
      super(queryClass, aggregate, repository);
    }
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.Many}.
   *
   * @param <MANY> the type of the particular {@link DomainQuery.Many}
   * @param <VIEW> the type of each answer element
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends DomainQuery.Many<?,  ?>,
    VIEW
  > extends DomainQueryHandler<MANY, List<VIEW>> {
  // @formatter:on
    protected Many(
        final Class<MANY> queryClass,
        final EnrollmentAggregate aggregate,
        final EnrollmentRepository repository) {
      super(queryClass, aggregate, repository);
    }
  }
}
