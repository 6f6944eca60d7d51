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

import java.security.GeneralSecurityException;

/**
 * Decryption did not yield a plaintext.
 *
 * <p>Raised with the same message and without a cause for a tag mismatch, a padding error and any
 * other cipher failure, so that callers cannot tell them apart.
 */
public final class DecryptionFailedException extends GeneralSecurityException {
  private static final long serialVersionUID = 1L;

  public DecryptionFailedException(String algorithm) {
    super(String.format("Decryption with '%s' failed", algorithm));
  }
}
