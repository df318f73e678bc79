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

import io.github.suppierk.enrollment.api.EnrollmentResponse;
import io.github.suppierk.enrollment.api.ErrorResponse;
import io.github.suppierk.enrollment.domain.Result;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point of the enrollment bounded context: routes each {@link DomainCommand} and {@link
 * DomainQuery} to the single handler registered for its class.
 *
 * <p>Handlers are usually registered once at start-up, but registration is guarded so that it may
 * also happen while messages are being dispatched.
 */
public final class EnrollmentContext extends Suspicious {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Class<?>, DomainCommandHandler<?>> commandHandlers = new HashMap<>();
  private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers = new HashMap<>();

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public void addDomainCommandHandler(final DomainCommandHandler<?> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Command handler");
    register(commandHandlers, nonNullHandler.getCommandClass(), nonNullHandler);
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if a handler for the same query class is already registered
   */
  public void addDomainQueryHandler(final DomainQueryHandler<?, ?> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Query handler");
    register(queryHandlers, nonNullHandler.getQueryClass(), nonNullHandler);
  }

  public Set<Class<?>> getSupportedDomainCommandClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(commandHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Set<Class<?>> getSupportedDomainQueryClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(queryHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Runs a command through its handler.
   *
   * @param command to execute
   * @param <C> type of the command
   * @return the enrollment after the command, or why it was rejected
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command's class
   */
  @SuppressWarnings("unchecked")
  public <C extends DomainCommand<?, ?>> Result<EnrollmentResponse, ErrorResponse> execute(
      final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final var handler =
        (DomainCommandHandler<C>)
            throwUnsupportedOperationIfNull(
                lookup(commandHandlers, nonNullCommand.getClass()),
                "Command '%s'".formatted(nonNullCommand.getClass().getSimpleName()));
    return handler.runInContext(nonNullCommand);
  }

  /**
   * Answers a query through its handler.
   *
   * @param query to answer
   * @param <Q> type of the query
   * @param <O> type of the answer, as declared by the handler of {@code Q}
   * @return the answer, or why the query was rejected
   * @throws IllegalArgumentException if the query is null
   * @throws UnsupportedOperationException if no handler is registered for the query's class
   */
  @SuppressWarnings("unchecked")
  public <Q extends DomainQuery<?, ?>, O> Result<O, ErrorResponse> ask(final Q query) {
    final Q nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final var handler =
        (DomainQueryHandler<Q, O>)
            throwUnsupportedOperationIfNull(
                lookup(queryHandlers, nonNullQuery.getClass()),
                "Query '%s'".formatted(nonNullQuery.getClass().getSimpleName()));
    return handler.runInContext(nonNullQuery);
  }

  /**
   * @return {@code true} if handler registration is in progress, used by tests
   */
  boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  private <H> void register(
      final Map<Class<?>, H> handlers, final Class<?> messageClass, final H handler) {
    lock.writeLock().lock();
    try {
      if (handlers.containsKey(messageClass)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(messageClass.getSimpleName()));
      }

      handlers.put(messageClass, handler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private <H> H lookup(final Map<Class<?>, H> handlers, final Class<?> messageClass) {
    lock.readLock().lock();
    try {
      return handlers.get(messageClass);
    } finally {
      lock.readLock().unlock();
    }
  }
}
