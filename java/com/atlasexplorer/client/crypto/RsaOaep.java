/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.atlasexplorer.client.crypto;

import java.security.spec.MGF1ParameterSpec;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

/** RSA-OAEP parameters shared by {@link RsaOaepKeyWrapper} and {@link RsaOaepKeyUnwrapper}. */
final class RsaOaep {

  static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";
  static final int MIN_MODULUS_BITS = 2048;

  private RsaOaep() {}

  /** SHA-256 for both the label hash and MGF1; the associated data becomes the OAEP label. */
  static OAEPParameterSpec parameters(byte[] associatedData) {
    return new OAEPParameterSpec(
        "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, new PSource.PSpecified(associatedData));
  }
}
