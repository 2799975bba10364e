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

import com.atlasexplorer.client.crypto.model.ErrorReason;
import com.atlasexplorer.client.envelope.WrapScheme;
import com.google.crypto.tink.HybridEncrypt;
import com.google.crypto.tink.KeysetHandle;
import java.security.GeneralSecurityException;

/** Wraps content secrets with Tink HPKE. Each call generates a fresh ephemeral key. */
public final class TinkHybridKeyWrapper implements KeyWrapper {

  private final HybridEncrypt hybridEncrypt;

  private TinkHybridKeyWrapper(HybridEncrypt hybridEncrypt) {
    this.hybridEncrypt = hybridEncrypt;
  }

  /**
   * @param publicKeysetHandle public hybrid keyset
   * @throws KeyException if the keyset is not a hybrid encryption keyset
   */
  public static TinkHybridKeyWrapper create(KeysetHandle publicKeysetHandle) throws KeyException {
    try {
      return new TinkHybridKeyWrapper(publicKeysetHandle.getPrimitive(HybridEncrypt.class));
    } catch (GeneralSecurityException e) {
      throw new KeyException(
          "Keyset is not a hybrid public keyset", ErrorReason.UNSUPPORTED_KEY_TYPE, e);
    }
  }

  @Override
  public WrapScheme scheme() {
    return WrapScheme.TINK_HYBRID;
  }

  @Override
  public byte[] wrap(byte[] secret, byte[] associatedData) throws KeyException {
    try {
      return hybridEncrypt.encrypt(secret, associatedData);
    } catch (GeneralSecurityException e) {
      throw new KeyException("HPKE key wrap failed", ErrorReason.KEY_WRAP_FAILED, e);
    }
  }
}
