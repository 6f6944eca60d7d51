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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThrows;

import com.google.crypto.tink.subtle.Random;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/** Round trips and tampering for every supported algorithm over every key large enough for it. */
@RunWith(Parameterized.class)
public class AuthenticatedEncryptionRoundTripTest {
  private static final int[] PLAINTEXT_SIZES = {1, 15, 16, 17, 64, 1000};

  private final String algorithm;
  private final SymmetricKey key;

  private AuthenticatedEncryptionProvider provider;
  private byte[] plaintext;
  private byte[] associatedData;
  private AuthenticatedEncryptionResult result;

  @Parameters(name = "{0} with {1}")
  public static Collection<Object[]> parameters() {
    List<Object[]> parameters = new ArrayList<>();
    for (SymmetricKey key : KeyFixtures.KEYS_FOR_128) {
      parameters.add(new Object[] {AlgorithmRegistry.AES_128_CBC_HMAC_SHA256, key});
    }
    for (SymmetricKey key : KeyFixtures.KEYS_FOR_256) {
      parameters.add(new Object[] {AlgorithmRegistry.AES_256_CBC_HMAC_SHA512, key});
    }
    return parameters;
  }

  public AuthenticatedEncryptionRoundTripTest(String algorithm, SymmetricKey key) {
    this.algorithm = algorithm;
    this.key = key;
  }

  @Before
  public void setUp() throws Exception {
    provider = new AuthenticatedEncryptionProvider(key, algorithm);
    plaintext = Random.randBytes(16);
    associatedData = Random.randBytes(16);
    result = provider.encrypt(plaintext, associatedData);
  }

  @Test
  public void testRoundTrip() throws Exception {
    // A second provider over the same key checks that nothing depends on per-instance state.
    AuthenticatedEncryptionProvider decryptor = new AuthenticatedEncryptionProvider(key, algorithm);
    assertArrayEquals(plaintext, decrypt(decryptor, result, associatedData));
  }

  @Test
  public void testRoundTripPlaintextSizes() throws Exception {
    for (int size : PLAINTEXT_SIZES) {
      byte[] data = Random.randBytes(size);
      byte[] aad = Random.randBytes(size);
      assertArrayEquals(data, decrypt(provider, provider.encrypt(data, aad), aad));
    }
  }

  @Test
  public void testTamperedIv() {
    byte[] iv = result.getIv();
    for (int bit = 0; bit < iv.length * 8; bit++) {
      byte[] tampered = flipBit(iv, bit);
      assertThrows(DecryptionFailedException.class,
          ()
              -> provider.decrypt(result.getCiphertext(), associatedData, tampered,
                  result.getAuthenticationTag()));
    }
  }

  @Test
  public void testTamperedAuthenticationTag() {
    byte[] tag = result.getAuthenticationTag();
    for (int bit = 0; bit < tag.length * 8; bit++) {
      byte[] tampered = flipBit(tag, bit);
      assertThrows(DecryptionFailedException.class,
          () -> provider.decrypt(result.getCiphertext(), associatedData, result.getIv(), tampered));
    }
  }

  @Test
  public void testTamperedCiphertext() {
    byte[] ciphertext = result.getCiphertext();
    for (int bit = 0; bit < ciphertext.length * 8; bit++) {
      byte[] tampered = flipBit(ciphertext, bit);
      assertThrows(DecryptionFailedException.class,
          ()
              -> provider.decrypt(
                  tampered, associatedData, result.getIv(), result.getAuthenticationTag()));
    }
  }

  @Test
  public void testTamperedAssociatedData() {
    for (int bit = 0; bit < associatedData.length * 8; bit++) {
      byte[] tampered = flipBit(associatedData, bit);
      assertThrows(DecryptionFailedException.class,
          ()
              -> provider.decrypt(result.getCiphertext(), tampered, result.getIv(),
                  result.getAuthenticationTag()));
    }
  }

  @Test
  public void testTruncatedAuthenticationTag() {
    byte[] tag = result.getAuthenticationTag();
    byte[] truncated = new byte[tag.length - 1];
    System.arraycopy(tag, 0, truncated, 0, truncated.length);
    assertThrows(DecryptionFailedException.class,
        () -> provider.decrypt(result.getCiphertext(), associatedData, result.getIv(), truncated));
  }

  @Test
  public void testOtherKeysAreRejected() throws Exception {
    List<SymmetricKey> candidates = new ArrayList<>(KeyFixtures.KEYS_FOR_128);
    for (SymmetricKey other : candidates) {
      if (other == key) {
        continue;
      }
      AuthenticatedEncryptionProvider decryptor =
          new AuthenticatedEncryptionProvider(other, AlgorithmRegistry.AES_128_CBC_HMAC_SHA256);
      assertThrows(
          DecryptionFailedException.class, () -> decrypt(decryptor, result, associatedData));
    }
  }

  @Test
  public void testOtherAlgorithmIsRejected() throws Exception {
    for (String other : AlgorithmRegistry.identifiers()) {
      if (other.equals(algorithm)
          || !AuthenticatedEncryptionProvider.isSupportedAlgorithm(key, other)) {
        continue;
      }
      AuthenticatedEncryptionProvider decryptor = new AuthenticatedEncryptionProvider(key, other);
      assertThrows(
          DecryptionFailedException.class, () -> decrypt(decryptor, result, associatedData));
    }
  }

  private static byte[] decrypt(AuthenticatedEncryptionProvider provider,
      AuthenticatedEncryptionResult result, byte[] associatedData) throws Exception {
    return provider.decrypt(result.getCiphertext(), associatedData, result.getIv(),
        result.getAuthenticationTag());
  }

  private static byte[] flipBit(byte[] bytes, int bit) {
    byte[] flipped = bytes.clone();
    flipped[bit / 8] ^= (byte) (1 << (bit % 8));
    return flipped;
  }
}
