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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.crypto.tink.subtle.Enums.HashType;
import com.google.crypto.tink.subtle.Hex;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HmacSignatureProviderTest {
  // RFC 4231 test case 2.
  private static final byte[] KEY = "Jefe".getBytes(UTF_8);
  private static final byte[] DATA = "what do ya want for nothing?".getBytes(UTF_8);
  private static final String HMAC_SHA256 =
      "5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843";

  private static final byte[] KEY_16 = KeyFixtures.sequentialBytes(16);

  @Test
  public void testSignLength() throws Exception {
    assertEquals(32, new HmacSignatureProvider(KEY_16, HashType.SHA256).sign(DATA).length);
    assertEquals(64,
        new HmacSignatureProvider(KeyFixtures.sequentialBytes(32), HashType.SHA512)
            .sign(DATA)
            .length);
  }

  @Test
  public void testSignIsDeterministic() throws Exception {
    HmacSignatureProvider provider = new HmacSignatureProvider(KEY_16, HashType.SHA256);
    byte[] first = provider.sign(DATA);
    assertArrayEquals(first, provider.sign(DATA));
    assertArrayEquals(first, new HmacSignatureProvider(KEY_16, HashType.SHA256).sign(DATA));
  }

  @Test
  public void testVerify() throws Exception {
    HmacSignatureProvider provider = new HmacSignatureProvider(KEY_16, HashType.SHA512);
    byte[] signature = provider.sign(DATA);
    assertTrue(provider.verify(DATA, signature));

    byte[] tampered = signature.clone();
    tampered[tampered.length - 1] ^= 1;
    assertFalse(provider.verify(DATA, tampered));
    assertFalse(provider.verify(DATA, Arrays.copyOf(signature, 32)));
    assertFalse(provider.verify("other".getBytes(UTF_8), signature));
  }

  @Test
  public void testDifferentKeysGiveDifferentSignatures() throws Exception {
    byte[] otherKey = KEY_16.clone();
    otherKey[0] ^= 1;
    assertFalse(Arrays.equals(new HmacSignatureProvider(KEY_16, HashType.SHA256).sign(DATA),
        new HmacSignatureProvider(otherKey, HashType.SHA256).sign(DATA)));
  }

  @Test
  public void testKnownAnswer() throws Exception {
    // Tink rejects keys under 16 bytes. HMAC zero-pads the key, so "Jefe" padded to 16 bytes
    // yields the same output.
    byte[] paddedKey = Arrays.copyOf(KEY, 16);
    assertEquals(HMAC_SHA256,
        Hex.encode(new HmacSignatureProvider(paddedKey, HashType.SHA256).sign(DATA)));
  }
}
