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
import java.util.Optional;

/**
 * Supplies custom signature providers, e.g. backed by an HSM, for a {@code SymmetricKey}.
 *
 * <p>A factory that returns false from {@link #isSupportedAlgorithm} is skipped and the platform
 * HMAC is used. A factory that returns true takes responsibility for the combination: if it then
 * yields no signer or no verifier, building the {@code AuthenticatedEncryptionProvider} fails.
 */
public interface CryptoProviderFactory {
  /**
   * @param key the MAC half of the composite key
   * @param hashType the hash function of the composite algorithm
   * @return true if this factory provides signers and verifiers for {@code key} and
   *     {@code hashType}
   */
  boolean isSupportedAlgorithm(SymmetricKey key, HashType hashType);

  /** @return a provider used to compute authentication tags, or empty if none is available */
  Optional<SymmetricSignatureProvider> tryCreateSigner(SymmetricKey key, HashType hashType);

  /** @return a provider used to check authentication tags, or empty if none is available */
  Optional<SymmetricSignatureProvider> tryCreateVerifier(SymmetricKey key, HashType hashType);
}
