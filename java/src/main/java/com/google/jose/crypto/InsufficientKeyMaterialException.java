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

/** The composite key is shorter than the algorithm requires. */
public final class InsufficientKeyMaterialException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  private final int actualKeyBits;
  private final int requiredKeyBits;

  public InsufficientKeyMaterialException(
      String algorithm, int actualKeyBits, int requiredKeyBits) {
    super(String.format("Algorithm '%s' requires a key of at least %d bits, got %d bits",
        algorithm, requiredKeyBits, actualKeyBits));
    this.actualKeyBits = actualKeyBits;
    this.requiredKeyBits = requiredKeyBits;
  }

  public int getActualKeyBits() {
    return actualKeyBits;
  }

  public int getRequiredKeyBits() {
    return requiredKeyBits;
  }
}
