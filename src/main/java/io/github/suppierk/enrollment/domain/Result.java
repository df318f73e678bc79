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

package io.github.suppierk.enrollment.domain;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail in an expected way. Unlike {@code Try}, a failure holds a
 * typed error value instead of an exception, so callers can match on it exhaustively.
 *
 * @param <T> type of the successful value
 * @param <E> type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {
  static <T, E> Result<T, E> success(final T value) {
    return new Success<>(value);
  }

  static <T, E> Result<T, E> failure(final E error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  default boolean isFailure() {
    return !isSuccess();
  }

  <U> Result<U, E> map(final Function<? super T, ? extends U> mapper);

  <U> Result<U, E> flatMap(final Function<? super T, Result<U, E>> mapper);

  <F> Result<T, F> mapError(final Function<? super E, ? extends F> mapper);

  <R> R fold(
      final Function<? super T, ? extends R> onSuccess,
      final Function<? super E, ? extends R> onFailure);

  /**
   * @return the value
   * @throws IllegalStateException if this is a failure
   */
  T orElseThrow();

  /**
   * @return the error
   * @throws IllegalStateException if this is a success
   */
  E errorOrThrow();

  default Result<T, E> ifSuccess(final Consumer<? super T> consumer) {
    if (this instanceof Success<T, E> success) {
      consumer.accept(success.value());
    }

    return this;
  }

  default Result<T, E> ifFailure(final Consumer<? super E> consumer) {
    if (this instanceof Failure<T, E> failure) {
      consumer.accept(failure.error());
    }

    return this;
  }

  record Success<T, E>(T value) implements Result<T, E> {
    public Success {
      if (value == null) {
        throw new IllegalArgumentException("Successful value cannot be null");
      }
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public <U> Result<U, E> map(final Function<? super T, ? extends U> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <U> Result<U, E> flatMap(final Function<? super T, Result<U, E>> mapper) {
      return mapper.apply(value);
    }

    @Override
    public <F> Result<T, F> mapError(final Function<? super E, ? extends F> mapper) {
      return new Success<>(value);
    }

    @Override
    public <R> R fold(
        final Function<? super T, ? extends R> onSuccess,
        final Function<? super E, ? extends R> onFailure) {
      return onSuccess.apply(value);
    }

    @Override
    public T orElseThrow() {
      return value;
    }

    @Override
    public E errorOrThrow() {
      throw new IllegalStateException("Result is successful: %s".formatted(value));
    }
  }

  record Failure<T, E>(E error) implements Result<T, E> {
    public Failure {
      if (error == null) {
        throw new IllegalArgumentException("Error cannot be null");
      }
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public <U> Result<U, E> map(final Function<? super T, ? extends U> mapper) {
      return new Failure<>(error);
    }

    @Override
    public <U> Result<U, E> flatMap(final Function<? super T, Result<U, E>> mapper) {
      return new Failure<>(error);
    }

    @Override
    public <F> Result<T, F> mapError(final Function<? super E, ? extends F> mapper) {
      return new Failure<>(mapper.apply(error));
    }

    @Override
    public <R> R fold(
        final Function<? super T, ? extends R> onSuccess,
        final Function<? super E, ? extends R> onFailure) {
      return onFailure.apply(error);
    }

    @Override
    public T orElseThrow() {
      throw new IllegalStateException("Result is a failure: %s".formatted(error));
    }

    @Override
    public E errorOrThrow() {
      return error;
    }
  }
}
