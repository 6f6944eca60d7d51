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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Arrays;
import java.util.Optional;

/**
 * Raw symmetric key material, optionally carrying a {@code CryptoProviderFactory} that supplies
 * custom signature providers for it.
 *
 * <p>The bytes are copied in and out, so instances are immutable.
 */
public final class SymmetricKey {
  private final byte[] keyBytes;
  private final Optional<String> keyId;
  private final Optional<CryptoProviderFactory> cryptoProviderFactory;

  public SymmetricKey(byte[] keyBytes) {
    this(newBuilder(keyBytes));
  }

  public static Builder newBuilder(byte[] keyBytes) {
    return new Builder(keyBytes);
  }

  private SymmetricKey(Builder builder) {
    this.keyBytes = builder.keyBytes;
    this.keyId = Optional.ofNullable(builder.keyId);
    this.cryptoProviderFactory = Optional.ofNullable(builder.cryptoProviderFactory);
  }

  /** @return a copy of the key bytes */
  public byte[] getKeyBytes() {
    return keyBytes.clone();
  }

  /** @return the key size in bits */
  public int getKeySize() {
    return keyBytes.length * 8;
  }

  public Optional<String> getKeyId() {
    return keyId;
  }

  public Optional<CryptoProviderFactory> getCryptoProviderFactory() {
    return cryptoProviderFactory;
  }

  /**
   * Creates a key over {@code keyBytes} that keeps this key's id and provider factory. Used to hand
   * a derived sub-key to the factory.
   */
  SymmetricKey derive(byte[] derivedKeyBytes) {
    return new Builder(derivedKeyBytes)
        .setKeyId(keyId.orElse(null))
        .setCryptoProviderFactory(cryptoProviderFactory.orElse(null))
        .build();
  }

  // Key bytes are deliberately left out.
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("keyId", keyId.orElse(null))
        .add("keySize", getKeySize())
        .toString();
  }

  /** Builder for {@code SymmetricKey}. */
  public static final class Builder {
    private final byte[] keyBytes;
    private String keyId;
    private CryptoProviderFactory cryptoProviderFactory;

    private Builder(byte[] keyBytes) {
      checkNotNull(keyBytes, "keyBytes");
      checkArgument(keyBytes.length > 0, "keyBytes must not be empty");
      this.keyBytes = Arrays.copyOf(keyBytes, keyBytes.length);
    }

    public Builder setKeyId(String keyId) {
      this.keyId = keyId;
      return this;
    }

    /**
     * Sets the factory asked first for signature providers over this key. Pass {@code null} to use
     * the platform HMAC.
     */
    public Builder setCryptoProviderFactory(CryptoProviderFactory cryptoProviderFactory) {
      this.cryptoProviderFactory = cryptoProviderFactory;
      return this;
    }

    public SymmetricKey build() {
      return new SymmetricKey(this);
    }
  }
}
