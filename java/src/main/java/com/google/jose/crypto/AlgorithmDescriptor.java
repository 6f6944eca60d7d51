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

import com.google.common.base.MoreObjects;
import com.google.crypto.tink.subtle.Enums.HashType;
import java.util.Objects;

/**
 * Parameters of one AES-CBC-HMAC composite algorithm.
 * <https://datatracker.ietf.org/doc/html/rfc7518#section-5.2>
 *
 * <p>The composite key is twice the AES key size. Its first half keys the HMAC, its second half
 * keys AES. The authentication tag is the leading half of the HMAC output.
 */
public final class AlgorithmDescriptor {
  private final String identifier;
  private final HashType hashType;
  private final int cipherKeyBits;

  AlgorithmDescriptor(String identifier, HashType hashType, int cipherKeyBits) {
    this.identifier = identifier;
    this.hashType = hashType;
    this.cipherKeyBits = cipherKeyBits;
  }

  /** JOSE {@code enc} identifier, e.g. {@code A128CBC-HS256}. */
  public String getIdentifier() {
    return identifier;
  }

  public HashType getHashType() {
    return hashType;
  }

  /** JCA name of the HMAC keyed with the MAC half, in the form Tink's {@code PrfHmacJce} takes. */
  public String getHmacAlgorithm() {
    return hmacAlgorithm(hashType);
  }

  public int getCipherKeyBits() {
    return cipherKeyBits;
  }

  public int getRequiredKeyBits() {
    return 2 * cipherKeyBits;
  }

  public int getTagLengthBytes() {
    return macOutputBytes(hashType) / 2;
  }

  static String hmacAlgorithm(HashType hashType) {
    switch (hashType) {
      case SHA256:
        return "HMACSHA256";
      case SHA512:
        return "HMACSHA512";
      default:
        throw new IllegalArgumentException("Unsupported hash type: " + hashType);
    }
  }

  static int macOutputBytes(HashType hashType) {
    switch (hashType) {
      case SHA256:
        return 32;
      case SHA512:
        return 64;
      default:
        throw new IllegalArgumentException("Unsupported hash type: " + hashType);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof AlgorithmDescriptor)) {
      return false;
    }
    AlgorithmDescriptor that = (AlgorithmDescriptor) other;
    return identifier.equals(that.identifier) && hashType == that.hashType
        && cipherKeyBits == that.cipherKeyBits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, hashType, cipherKeyBits);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("identifier", identifier)
        .add("hashType", hashType)
        .add("cipherKeyBits", cipherKeyBits)
        .toString();
  }
}
