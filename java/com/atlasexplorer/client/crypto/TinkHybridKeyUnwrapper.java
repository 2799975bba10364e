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
import com.google.crypto.tink.HybridDecrypt;
import com.google.crypto.tink.KeysetHandle;
import java.security.GeneralSecurityException;

/** Unwraps content secrets with a Tink HPKE private keyset. */
public final class TinkHybridKeyUnwrapper implements KeyUnwrapper {

  private final HybridDecrypt hybridDecrypt;

  private TinkHybridKeyUnwrapper(HybridDecrypt hybridDecrypt) {
    this.hybridDecrypt = hybridDecrypt;
  }

  /**
   * @param privateKeysetHandle private hybrid keyset
   * @throws KeyException if the keyset is not a hybrid decryption keyset
   */
  public static TinkHybridKeyUnwrapper create(KeysetHandle privateKeysetHandle)
      throws KeyException {
    try {
      return new TinkHybridKeyUnwrapper(privateKeysetHandle.getPrimitive(HybridDecrypt.class));
    } catch (GeneralSecurityException e) {
      throw new KeyException(
          "Keyset is not a hybrid private keyset", ErrorReason.UNSUPPORTED_KEY_TYPE, e);
    }
  }

  @Override
  public WrapScheme scheme() {
    return WrapScheme.TINK_HYBRID;
  }

  @Override
  public byte[] unwrap(byte[] wrapped, byte[] associatedData) throws IntegrityException {
    try {
      return hybridDecrypt.decrypt(wrapped, associatedData);
    } catch (GeneralSecurityException e) {
      throw new IntegrityException("HPKE key unwrap failed", ErrorReason.KEY_UNWRAP_FAILED, e);
    }
  }
}
