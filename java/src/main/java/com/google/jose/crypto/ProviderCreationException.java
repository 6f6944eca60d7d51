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

/**
 * No usable {@code SymmetricSignatureProvider} could be obtained for the MAC half of the key,
 * either because a custom {@code CryptoProviderFactory} claimed the algorithm and returned nothing,
 * or because the platform HMAC could not be initialized.
 */
public final class ProviderCreationException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  public ProviderCreationException(String message) {
    super(message);
  }

  public ProviderCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}
