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
import java.security.GeneralSecurityException;
import java.security.interfaces.RSAPrivateKey;
import javax.crypto.Cipher;

/** Unwraps content secrets with an RSA private key. */
public final class RsaOaepKeyUnwrapper implements KeyUnwrapper {

  private final RSAPrivateKey privateKey;

  private RsaOaepKeyUnwrapper(RSAPrivateKey privateKey) {
    this.privateKey = privateKey;
  }

  /**
   * @throws KeyException if the modulus is shorter than 2048 bits
   */
  public static RsaOaepKeyUnwrapper create(RSAPrivateKey privateKey) throws KeyException {
    if (privateKey.getModulus().bitLength() < RsaOaep.MIN_MODULUS_BITS) {
      throw new KeyException(
          "RSA key has " + privateKey.getModulus().bitLength() + " bit modulus",
          ErrorReason.WEAK_KEY);
    }
    return new RsaOaepKeyUnwrapper(privateKey);
  }

  @Override
  public WrapScheme scheme() {
    return WrapScheme.RSA_OAEP_SHA256;
  }

  @Override
  public byte[] unwrap(byte[] wrapped, byte[] associatedData) throws IntegrityException {
    try {
      Cipher cipher = Cipher.getInstance(RsaOaep.TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, privateKey, RsaOaep.parameters(associatedData));
      return cipher.doFinal(wrapped);
    } catch (GeneralSecurityException e) {
      throw new IntegrityException("RSA-OAEP key unwrap failed", ErrorReason.KEY_UNWRAP_FAILED, e);
    }
  }
}
