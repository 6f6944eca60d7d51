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

import com.google.crypto.tink.subtle.Enums.HashType;
import com.google.crypto.tink.subtle.PrfHmacJce;
import com.google.crypto.tink.subtle.PrfMac;
import java.security.GeneralSecurityException;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC signature provider built on the JCA.
 * https://datatracker.ietf.org/doc/html/rfc2104
 */
public final class HmacSignatureProvider implements SymmetricSignatureProvider {
  private final HashType hashType;
  // Thread-safe: PrfHmacJce keeps one JCA Mac per thread.
  private final PrfMac mac;

  /**
   * Creates an HMAC over {@code key}. The key is copied.
   *
   * @param key at least 16 bytes
   * @param hashType SHA256 or SHA512
   */
  public HmacSignatureProvider(byte[] key, HashType hashType) throws GeneralSecurityException {
    PrfHmacJce prf = new PrfHmacJce(
        AlgorithmDescriptor.hmacAlgorithm(hashType), new SecretKeySpec(key, "HMAC"));
    this.hashType = hashType;
    this.mac = new PrfMac(prf, prf.getMaxOutputLength());
  }

  public HashType getHashType() {
    return hashType;
  }

  @Override
  public byte[] sign(byte[] input) throws GeneralSecurityException {
    return mac.computeMac(input);
  }

  @Override
  public boolean verify(byte[] input, byte[] signature) {
    try {
      mac.verifyMac(signature, input);
      return true;
    } catch (GeneralSecurityException e) {
      return false;
    }
  }
}
