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

/**
 * Output of {@code AuthenticatedEncryptionProvider.encrypt}: the ciphertext, the IV it was
 * encrypted under and the authentication tag, together with the key that produced them.
 *
 * <p>Arrays are copied on the way in and out.
 */
public final class AuthenticatedEncryptionResult {
  private final SymmetricKey key;
  private final byte[] ciphertext;
  private final byte[] iv;
  private final byte[] authenticationTag;

  public AuthenticatedEncryptionResult(
      SymmetricKey key, byte[] ciphertext, byte[] iv, byte[] authenticationTag) {
    this.key = checkNotNull(key, "key");
    this.ciphertext = checkNotNull(ciphertext, "ciphertext").clone();
    this.iv = checkNotNull(iv, "iv").clone();
    this.authenticationTag = checkNotNull(authenticationTag, "authenticationTag").clone();
  }

  public SymmetricKey getKey() {
    return key;
  }

  public byte[] getCiphertext() {
    return ciphertext.clone();
  }

  public byte[] getIv() {
    return iv.clone();
  }

  public byte[] getAuthenticationTag() {
    return authenticationTag.clone();
  }
}
