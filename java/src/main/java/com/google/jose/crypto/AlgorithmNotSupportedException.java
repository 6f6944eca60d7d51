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

/** The algorithm identifier is not one of the registered composite algorithms. */
public final class AlgorithmNotSupportedException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  private final String algorithm;

  public AlgorithmNotSupportedException(String algorithm) {
    super(String.format("Algorithm '%s' is not a supported AES-CBC-HMAC algorithm", algorithm));
    this.algorithm = algorithm;
  }

  public String getAlgorithm() {
    return algorithm;
  }
}
