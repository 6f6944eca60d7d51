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

import java.security.GeneralSecurityException;

/**
 * Keyed hash bound to one key and one hash function.
 *
 * <p>A provider is created once per {@code AuthenticatedEncryptionProvider} and then shared by
 * every encrypt and decrypt call on it, so implementations must be safe for concurrent use.
 */
public interface SymmetricSignatureProvider {
  /**
   * Computes the keyed hash of {@code input}.
   *
   * @return the full, untruncated hash output
   */
  byte[] sign(byte[] input) throws GeneralSecurityException;

  /**
   * Checks {@code signature} against the keyed hash of {@code input} in time independent of where
   * the two differ.
   *
   * @return true if {@code signature} is the full hash output of {@code input}
   */
  boolean verify(byte[] input, byte[] signature);
}
