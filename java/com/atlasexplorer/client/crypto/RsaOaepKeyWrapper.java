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
import java.security.SecureRandom;
import java.security.interfaces.RSAPublicKey;
import javax.crypto.Cipher;

/** Wraps content secrets with RSA-OAEP (SHA-256, MGF1-SHA-256). */
public final class RsaOaepKeyWrapper implements KeyWrapper {

  private final RSAPublicKey publicKey;
  private final SecureRandom random;

  private RsaOaepKeyWrapper(RSAPublicKey publicKey, SecureRandom random) {
    this.publicKey = publicKey;
    this.random = random;
  }

  /**
   * @throws KeyException if the modulus is shorter than 2048 bits
   */
  public static RsaOaepKeyWrapper create(RSAPublicKey publicKey) throws KeyException {
    if (publicKey.getModulus().bitLength() < RsaOaep.MIN_MODULUS_BITS) {
      throw new KeyException(
          "RSA key has " + publicKey.getModulus().bitLength() + " bit modulus",
          ErrorReason.WEAK_KEY);
    }
    return new RsaOaepKeyWrapper(publicKey, new SecureRandom());
  }

  @Override
  public WrapScheme scheme() {
    return WrapScheme.RSA_OAEP_SHA256;
  }

  @Override
  public byte[] wrap(byte[] secret, byte[] associatedData) throws KeyException {
    try {
      Cipher cipher = Cipher.getInstance(RsaOaep.TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, publicKey, RsaOaep.parameters(associatedData), random);
      return cipher.doFinal(secret);
    } catch (GeneralSecurityException e) {
      throw new KeyException("RSA-OAEP key wrap failed", ErrorReason.KEY_WRAP_FAILED, e);
    }
  }
}
