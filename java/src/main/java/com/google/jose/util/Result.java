//
// Copyright 2024 The Project Oak Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.google.jose.util;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an operation that either produced a value of type {@code R} or failed with an error
 * of type {@code E}.
 *
 * <p>Exactly one of the two is present; both are nonnull.
 */
public final class Result<R, E> {
  private final R value;
  private final E error;

  /**
   * Creates a successful {@code Result}.
   *
   * @param value nonnull success value
   */
  public static <R, E> Result<R, E> success(final R value) {
    return new Result<>(Objects.requireNonNull(value), null);
  }

  /**
   * Creates a failed {@code Result}.
   *
   * @param error nonnull error value
   */
  public static <R, E> Result<R, E> error(final E error) {
    return new Result<>(null, Objects.requireNonNull(error));
  }

  public boolean isSuccess() {
    return value != null;
  }

  public boolean isError() {
    return error != null;
  }

  /** @return the success value, or an empty Optional if this is an error */
  public Optional<R> success() {
    return Optional.ofNullable(value);
  }

  /** @return the error value, or an empty Optional if this is a success */
  public Optional<E> error() {
    return Optional.ofNullable(error);
  }

  private Result(R value, E error) {
    this.value = value;
    this.error = error;
  }
}
