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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.jose.crypto.MissingArgumentException.checkNotEmpty;

import com.google.common.primitives.Longs;
import com.google.crypto.tink.subtle.Bytes;
import com.google.crypto.tink.subtle.EngineFactory;
import com.google.crypto.tink.subtle.Random;
import com.google.jose.crypto.SignatureProviderResolver.SignatureProviders;
import com.google.jose.util.Result;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated Encryption with Associated Data (AEAD) using AES in CBC mode and HMAC, as used for
 * JWE content encryption.
 * <https://datatracker.ietf.org/doc/html/rfc7518#section-5.2>
 *
 * <p>The composite key is split once, at construction, into an HMAC key and an AES key; the
 * signature providers for the HMAC key are resolved at the same time. Instances are immutable and
 * {@code encrypt} and {@code decrypt} may be called concurrently.
 */
public final class AuthenticatedEncryptionProvider {
  private static final Logger logger =
      Logger.getLogger(AuthenticatedEncryptionProvider.class.getName());

  private static final String CIPHER_TRANSFORMATION = "AES/CBC/PKCS5Padding";
  // AES block size.
  private static final int IV_SIZE_BYTES = 16;

  private final SymmetricKey key;
  private final AlgorithmDescriptor descriptor;
  private final Optional<String> context;
  private final SecretKeySpec encryptionKey;
  private final SymmetricSignatureProvider signer;
  private final SymmetricSignatureProvider verifier;

  /**
   * Creates a provider for {@code algorithm} over {@code key}.
   *
   * @param key composite key of at least the algorithm's required size; surplus bytes are ignored
   * @param algorithm {@code A128CBC-HS256} or {@code A256CBC-HS512}
   * @throws AlgorithmNotSupportedException if {@code algorithm} is not registered
   * @throws InsufficientKeyMaterialException if {@code key} is too short for {@code algorithm}
   * @throws ProviderCreationException if no signature provider could be obtained
   */
  public AuthenticatedEncryptionProvider(SymmetricKey key, String algorithm)
      throws ConfigurationException {
    this(key, algorithm, null);
  }

  /**
   * Same as {@link #AuthenticatedEncryptionProvider(SymmetricKey, String)}, attaching a free-form
   * {@code context} label, which may be null.
   */
  public AuthenticatedEncryptionProvider(SymmetricKey key, String algorithm, String context)
      throws ConfigurationException {
    this.key = checkNotNull(key, "key");
    this.descriptor = AlgorithmRegistry.resolve(checkNotNull(algorithm, "algorithm"));
    this.context = Optional.ofNullable(context);

    KeySplitter.DerivedKeys derivedKeys = KeySplitter.split(key.getKeyBytes(), descriptor);
    SignatureProviders providers =
        SignatureProviderResolver.resolve(key.derive(derivedKeys.getMacKey()), descriptor);
    this.encryptionKey = new SecretKeySpec(derivedKeys.getEncryptionKey(), "AES");
    this.signer = providers.signer;
    this.verifier = providers.verifier;

    logger.log(Level.FINE,
        String.format("Created %s provider for %s, context: %s", algorithm, key, context));
  }

  /**
   * Creates a provider without throwing on configuration errors.
   *
   * @return the provider, or the {@code ConfigurationException} that prevented its creation,
   *     wrapped in a {@code Result}
   */
  public static Result<AuthenticatedEncryptionProvider, Exception> create(
      SymmetricKey key, String algorithm) {
    return create(key, algorithm, null);
  }

  /** Same as {@link #create(SymmetricKey, String)}, attaching a {@code context} label. */
  public static Result<AuthenticatedEncryptionProvider, Exception> create(
      SymmetricKey key, String algorithm, String context) {
    try {
      return Result.success(new AuthenticatedEncryptionProvider(key, algorithm, context));
    } catch (ConfigurationException e) {
      return Result.error(e);
    }
  }

  /**
   * @return true if {@code algorithm} is registered and {@code key} holds enough bits for it
   */
  public static boolean isSupportedAlgorithm(SymmetricKey key, String algorithm) {
    Optional<AlgorithmDescriptor> descriptor = AlgorithmRegistry.find(algorithm);
    return key != null && descriptor.isPresent()
        && key.getKeySize() >= descriptor.get().getRequiredKeyBits();
  }

  /**
   * Encrypts {@code plaintext} under a fresh random IV and authenticates it together with
   * {@code associatedData}.
   *
   * @param plaintext non-empty data to encrypt
   * @param associatedData non-empty data to authenticate but not encrypt
   * @throws MissingArgumentException if either argument is null or empty
   * @throws EncryptionFailedException if the cipher or the signature provider failed
   */
  public AuthenticatedEncryptionResult encrypt(byte[] plaintext, byte[] associatedData)
      throws EncryptionFailedException {
    checkNotEmpty(plaintext, "plaintext");
    checkNotEmpty(associatedData, "associatedData");
    return encrypt(plaintext, associatedData, Random.randBytes(IV_SIZE_BYTES));
  }

  // Fixed-IV variant for known-answer tests.
  AuthenticatedEncryptionResult encrypt(byte[] plaintext, byte[] associatedData, byte[] iv)
      throws EncryptionFailedException {
    checkNotEmpty(plaintext, "plaintext");
    checkNotEmpty(associatedData, "associatedData");
    try {
      Cipher cipher = EngineFactory.CIPHER.getInstance(CIPHER_TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(plaintext);
      byte[] tag = computeTag(signer, associatedData, iv, ciphertext);
      return new AuthenticatedEncryptionResult(key, ciphertext, iv, tag);
    } catch (GeneralSecurityException | RuntimeException e) {
      logger.log(Level.SEVERE, "Encryption with " + descriptor.getIdentifier() + " failed", e);
      throw new EncryptionFailedException(descriptor.getIdentifier(), e);
    }
  }

  /**
   * Checks the authentication tag and, only if it matches, decrypts {@code ciphertext}.
   *
   * @throws MissingArgumentException if any argument is null or empty
   * @throws DecryptionFailedException if the tag does not match or the ciphertext does not decrypt
   */
  public byte[] decrypt(byte[] ciphertext, byte[] associatedData, byte[] iv,
      byte[] authenticationTag) throws DecryptionFailedException {
    checkNotEmpty(ciphertext, "ciphertext");
    checkNotEmpty(associatedData, "associatedData");
    checkNotEmpty(iv, "iv");
    checkNotEmpty(authenticationTag, "authenticationTag");
    try {
      byte[] expectedTag = computeTag(verifier, associatedData, iv, ciphertext);
      if (!Bytes.equal(expectedTag, authenticationTag)) {
        throw new AEADBadTagException();
      }
      Cipher cipher = EngineFactory.CIPHER.getInstance(CIPHER_TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      return cipher.doFinal(ciphertext);
    } catch (GeneralSecurityException | RuntimeException e) {
      // The cause is not logged or chained: tag and padding failures must look identical.
      logger.log(Level.FINE, "Decryption with " + descriptor.getIdentifier() + " failed");
      throw new DecryptionFailedException(descriptor.getIdentifier());
    }
  }

  /**
   * Computes the tag over {@code AAD || IV || ciphertext || AL}, where AL is the bit length of the
   * AAD as a 64-bit big-endian integer, truncated to the algorithm's tag length.
   * https://datatracker.ietf.org/doc/html/rfc7518#section-5.2.2.1
   */
  private byte[] computeTag(SymmetricSignatureProvider provider, byte[] associatedData,
      byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
    byte[] associatedDataLength = Longs.toByteArray((long) associatedData.length * 8);
    byte[] signature =
        provider.sign(Bytes.concat(associatedData, iv, ciphertext, associatedDataLength));
    int tagLength = descriptor.getTagLengthBytes();
    if (signature == null || signature.length < tagLength) {
      throw new GeneralSecurityException("Signature shorter than the " + tagLength + " byte tag");
    }
    return Arrays.copyOf(signature, tagLength);
  }

  /** @return the algorithm identifier this provider was created with */
  public String getAlgorithm() {
    return descriptor.getIdentifier();
  }

  public AlgorithmDescriptor getDescriptor() {
    return descriptor;
  }

  public Optional<String> getContext() {
    return context;
  }

  /** @return the composite key this provider was created with, by reference */
  public SymmetricKey getKey() {
    return key;
  }
}
