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

import java.util.Arrays;

/**
 * Splits a composite key into its MAC and encryption halves.
 * https://datatracker.ietf.org/doc/html/rfc7518#section-5.2.2.1
 */
final class KeySplitter {
  /** The two halves of a composite key. */
  static final class DerivedKeys {
    private final byte[] macKey;
    private final byte[] encryptionKey;

    DerivedKeys(byte[] macKey, byte[] encryptionKey) {
      this.macKey = macKey;
      this.encryptionKey = encryptionKey;
    }

    byte[] getMacKey() {
      return macKey.clone();
    }

    byte[] getEncryptionKey() {
      return encryptionKey.clone();
    }
  }

  /**
   * Takes the leading {@code descriptor.getRequiredKeyBits()} of {@code keyBytes}: the first half
   * becomes the MAC key and the second half the AES key. Trailing bytes are ignored.
   *
   * @throws InsufficientKeyMaterialException if {@code keyBytes} is shorter than required
   */
  static DerivedKeys split(byte[] keyBytes, AlgorithmDescriptor descriptor)
      throws InsufficientKeyMaterialException {
    int requiredKeyBits = descriptor.getRequiredKeyBits();
    if (keyBytes.length * 8 < requiredKeyBits) {
      throw new InsufficientKeyMaterialException(
          descriptor.getIdentifier(), keyBytes.length * 8, requiredKeyBits);
    }
    int halfLength = requiredKeyBits / 16;
    return new DerivedKeys(Arrays.copyOfRange(keyBytes, 0, halfLength),
        Arrays.copyOfRange(keyBytes, halfLength, 2 * halfLength));
  }

  private KeySplitter() {}
}
