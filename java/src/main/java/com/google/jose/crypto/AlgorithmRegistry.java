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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.crypto.tink.subtle.Enums.HashType;
import java.util.Optional;

/** Table of the supported AES-CBC-HMAC composite algorithms, keyed by JOSE identifier. */
public final class AlgorithmRegistry {
  /** AES-128 in CBC mode with HMAC-SHA-256, 16 byte tag. */
  public static final String AES_128_CBC_HMAC_SHA256 = "A128CBC-HS256";
  /** AES-256 in CBC mode with HMAC-SHA-512, 32 byte tag. */
  public static final String AES_256_CBC_HMAC_SHA512 = "A256CBC-HS512";

  private static final ImmutableMap<String, AlgorithmDescriptor> DESCRIPTORS =
      ImmutableMap.of(AES_128_CBC_HMAC_SHA256,
          new AlgorithmDescriptor(AES_128_CBC_HMAC_SHA256, HashType.SHA256, 128),
          AES_256_CBC_HMAC_SHA512,
          new AlgorithmDescriptor(AES_256_CBC_HMAC_SHA512, HashType.SHA512, 256));

  /**
   * Looks up the descriptor for {@code identifier}. Matching is exact and case sensitive.
   *
   * @throws AlgorithmNotSupportedException if {@code identifier} is not registered
   */
  public static AlgorithmDescriptor resolve(String identifier)
      throws AlgorithmNotSupportedException {
    Optional<AlgorithmDescriptor> descriptor = find(identifier);
    if (descriptor.isEmpty()) {
      throw new AlgorithmNotSupportedException(identifier);
    }
    return descriptor.get();
  }

  /** @return the descriptor for {@code identifier}, or empty if it is not registered */
  public static Optional<AlgorithmDescriptor> find(String identifier) {
    return identifier == null ? Optional.empty() : Optional.ofNullable(DESCRIPTORS.get(identifier));
  }

  public static boolean isSupported(String identifier) {
    return identifier != null && DESCRIPTORS.containsKey(identifier);
  }

  public static ImmutableSet<String> identifiers() {
    return DESCRIPTORS.keySet();
  }

  private AlgorithmRegistry() {}
}
