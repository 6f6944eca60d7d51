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

import com.google.common.collect.ImmutableList;
import com.google.crypto.tink.subtle.Random;

/** Random composite keys shared by the tests, one per size. */
final class KeyFixtures {
  static final SymmetricKey KEY_128 = randomKey(128, "key-128");
  static final SymmetricKey KEY_256 = randomKey(256, "key-256");
  static final SymmetricKey KEY_384 = randomKey(384, "key-384");
  static final SymmetricKey KEY_512 = randomKey(512, "key-512");
  static final SymmetricKey KEY_768 = randomKey(768, "key-768");
  static final SymmetricKey KEY_1024 = randomKey(1024, "key-1024");

  /** Keys large enough for A128CBC-HS256. */
  static final ImmutableList<SymmetricKey> KEYS_FOR_128 =
      ImmutableList.of(KEY_256, KEY_384, KEY_512, KEY_768, KEY_1024);
  /** Keys large enough for A256CBC-HS512. */
  static final ImmutableList<SymmetricKey> KEYS_FOR_256 =
      ImmutableList.of(KEY_512, KEY_768, KEY_1024);

  static SymmetricKey randomKey(int bits, String keyId) {
    return SymmetricKey.newBuilder(Random.randBytes(bits / 8)).setKeyId(keyId).build();
  }

  static byte[] sequentialBytes(int length) {
    byte[] bytes = new byte[length];
    for (int i = 0; i < length; i++) {
      bytes[i] = (byte) i;
    }
    return bytes;
  }

  private KeyFixtures() {}
}
