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

package com.google.jose.crypto;

/** A required byte array argument was null or empty. */
public final class MissingArgumentException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String argumentName;

  public MissingArgumentException(String argumentName) {
    super(String.format("'%s' must be non-null and non-empty", argumentName));
    this.argumentName = argumentName;
  }

  public String getArgumentName() {
    return argumentName;
  }

  /**
   * Returns {@code value} if it holds at least one byte.
   *
   * @throws MissingArgumentException if {@code value} is null or empty
   */
  static byte[] checkNotEmpty(byte[] value, String argumentName) {
    if (value == null || value.length == 0) {
      throw new MissingArgumentException(argumentName);
    }
    return value;
  }
}
