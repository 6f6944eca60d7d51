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
import java.security.GeneralSecurityException;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Obtains the signer and verifier for the MAC half of a composite key.
 *
 * <p>The key's {@code CryptoProviderFactory}, if any, is asked first. When there is no factory or
 * the factory does not claim the hash function, the platform HMAC is used for both.
 */
public final class SignatureProviderResolver {
  private static final Logger logger = Logger.getLogger(SignatureProviderResolver.class.getName());

  /** Signer and verifier bound to the same MAC key. */
  public static final class SignatureProviders {
    public final SymmetricSignatureProvider signer;
    public final SymmetricSignatureProvider verifier;

    SignatureProviders(SymmetricSignatureProvider signer, SymmetricSignatureProvider verifier) {
      this.signer = signer;
      this.verifier = verifier;
    }
  }

  /**
   * @param macKey the MAC half of the composite key, carrying the composite key's factory
   * @param descriptor the composite algorithm
   * @throws ProviderCreationException if a factory claims the algorithm but yields no provider, or
   *     the platform HMAC cannot be initialized
   */
  public static SignatureProviders resolve(SymmetricKey macKey, AlgorithmDescriptor descriptor)
      throws ProviderCreationException {
    HashType hashType = descriptor.getHashType();
    Optional<CryptoProviderFactory> factory = macKey.getCryptoProviderFactory();
    if (factory.isPresent() && claims(factory.get(), macKey, descriptor)) {
      logger.log(Level.FINE, "Using custom signature providers for " + descriptor.getIdentifier());
      SymmetricSignatureProvider signer = createCustom(
          factory.get()::tryCreateSigner, "signer", macKey, descriptor);
      SymmetricSignatureProvider verifier = createCustom(
          factory.get()::tryCreateVerifier, "verifier", macKey, descriptor);
      return new SignatureProviders(signer, verifier);
    }

    try {
      HmacSignatureProvider provider = new HmacSignatureProvider(macKey.getKeyBytes(), hashType);
      return new SignatureProviders(provider, provider);
    } catch (GeneralSecurityException e) {
      throw new ProviderCreationException(
          "Couldn't create " + descriptor.getHmacAlgorithm() + " signature provider", e);
    }
  }

  private static boolean claims(CryptoProviderFactory factory, SymmetricKey macKey,
      AlgorithmDescriptor descriptor) throws ProviderCreationException {
    try {
      return factory.isSupportedAlgorithm(macKey, descriptor.getHashType());
    } catch (RuntimeException e) {
      throw new ProviderCreationException(
          "CryptoProviderFactory failed to check support for '" + descriptor.getIdentifier() + "'",
          e);
    }
  }

  private static SymmetricSignatureProvider createCustom(
      BiFunction<SymmetricKey, HashType, Optional<SymmetricSignatureProvider>> create,
      String role, SymmetricKey macKey, AlgorithmDescriptor descriptor)
      throws ProviderCreationException {
    Optional<SymmetricSignatureProvider> provider;
    try {
      provider = create.apply(macKey, descriptor.getHashType());
    } catch (RuntimeException e) {
      throw new ProviderCreationException(
          String.format("CryptoProviderFactory failed to create a %s for '%s'", role,
              descriptor.getIdentifier()),
          e);
    }
    if (provider == null || provider.isEmpty()) {
      logger.warning(String.format(
          "CryptoProviderFactory claims '%s' but returned no %s", descriptor.getIdentifier(), role));
      throw new ProviderCreationException(
          String.format("CryptoProviderFactory returned no %s for '%s'", role,
              descriptor.getIdentifier()));
    }
    return provider.get();
  }

  private SignatureProviderResolver() {}
}
