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
 * An underlying cipher or MAC primitive failed while encrypting. This points at a broken
 * environment or a programming error; retrying with the same provider is not expected to help.
 */
public final class EncryptionFailedException extends GeneralSecurityException {
  private static final long serialVersionUID = 1L;

  public EncryptionFailedException(String algorithm, Throwable cause) {
    super(String.format("Encryption with '%s' failed", algorithm), cause);
  }
}
