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
import com.atlasexplorer.client.envelope.Envelope;
import com.atlasexplorer.client.envelope.EnvelopeCodec;
import com.atlasexplorer.client.envelope.KdfParams;
import com.google.inject.Inject;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.crypto.generators.SCrypt;

/**
 * Produces and opens {@link Envelope}s.
 *
 * <p>Every {@link #encrypt} call draws a fresh 32 byte content secret, salt and nonce from the
 * injected {@link SecureRandom}. The AES-256-GCM key is derived from the secret with scrypt using
 * that salt, and the envelope header is authenticated both by AES-GCM and by the key wrap.
 */
public final class HybridEnvelopeEncryptor {

  static final int SECRET_LENGTH = 32;
  static final int NONCE_LENGTH = 12;
  private static final int AES_KEY_LENGTH = 32;
  private static final String AES_GCM = "AES/GCM/NoPadding";

  private final SecureRandom random;
  private final KdfParams kdfParams;

  @Inject
  public HybridEnvelopeEncryptor(SecureRandom random, KdfParams kdfParams) {
    this.random = random;
    this.kdfParams = kdfParams;
  }

  /**
   * Encrypts {@code plaintext} for {@code recipient}.
   *
   * @throws KeyException if the content secret cannot be wrapped with the recipient key
   */
  public Envelope encrypt(byte[] plaintext, KeyWrapper recipient) throws KeyException {
    byte[] secret = randomBytes(SECRET_LENGTH);
    byte[] salt = randomBytes(Envelope.SALT_LENGTH);
    byte[] nonce = randomBytes(NONCE_LENGTH);
    byte[] header = EnvelopeCodec.header(Envelope.CURRENT_VERSION, recipient.scheme(), kdfParams);
    byte[] key = deriveKey(secret, salt, kdfParams);
    try {
      byte[] sealed = aesGcm(Cipher.ENCRYPT_MODE, key, nonce, header, plaintext);
      int ciphertextLength = sealed.length - Envelope.TAG_LENGTH;
      return Envelope.builder()
          .setWrapScheme(recipient.scheme())
          .setKdfParams(kdfParams)
          .setSalt(salt)
          .setNonce(nonce)
          .setWrappedKey(recipient.wrap(secret, header))
          .setCiphertext(Arrays.copyOfRange(sealed, 0, ciphertextLength))
          .setTag(Arrays.copyOfRange(sealed, ciphertextLength, sealed.length))
          .build();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM is unavailable", e);
    } finally {
      Arrays.fill(secret, (byte) 0);
      Arrays.fill(key, (byte) 0);
    }
  }

  /**
   * Decrypts {@code envelope}. The tag is verified before any plaintext is returned.
   *
   * @throws KeyException if {@code recipient} handles a different wrap scheme than the envelope
   * @throws IntegrityException if the envelope was tampered with or wrapped for another key
   */
  public byte[] decrypt(Envelope envelope, KeyUnwrapper recipient)
      throws KeyException, IntegrityException {
    if (envelope.wrapScheme() != recipient.scheme()) {
      throw new KeyException(
          String.format(
              "Envelope is wrapped with %s but the key is for %s",
              envelope.wrapScheme(), recipient.scheme()),
          ErrorReason.SCHEME_MISMATCH);
    }
    byte[] header =
        EnvelopeCodec.header(envelope.version(), envelope.wrapScheme(), envelope.kdfParams());
    byte[] secret = recipient.unwrap(envelope.wrappedKey(), header);
    if (secret.length != SECRET_LENGTH) {
      Arrays.fill(secret, (byte) 0);
      throw new IntegrityException(
          "Unwrapped secret has " + secret.length + " bytes", ErrorReason.KEY_UNWRAP_FAILED);
    }
    byte[] key = deriveKey(secret, envelope.salt(), envelope.kdfParams());
    byte[] sealed = new byte[envelope.ciphertext().length + envelope.tag().length];
    System.arraycopy(envelope.ciphertext(), 0, sealed, 0, envelope.ciphertext().length);
    System.arraycopy(
        envelope.tag(), 0, sealed, envelope.ciphertext().length, envelope.tag().length);
    try {
      return aesGcm(Cipher.DECRYPT_MODE, key, envelope.nonce(), header, sealed);
    } catch (AEADBadTagException e) {
      throw new IntegrityException(
          "Envelope failed authentication", ErrorReason.AUTHENTICATION_FAILED, e);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM is unavailable", e);
    } finally {
      Arrays.fill(secret, (byte) 0);
      Arrays.fill(key, (byte) 0);
    }
  }

  private byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }

  private static byte[] deriveKey(byte[] secret, byte[] salt, KdfParams params) {
    return SCrypt.generate(secret, salt, params.n(), params.r(), params.p(), AES_KEY_LENGTH);
  }

  private static byte[] aesGcm(int mode, byte[] key, byte[] nonce, byte[] aad, byte[] input)
      throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(AES_GCM);
    cipher.init(
        mode,
        new SecretKeySpec(key, "AES"),
        new GCMParameterSpec(Envelope.TAG_LENGTH * Byte.SIZE, nonce));
    cipher.updateAAD(aad);
    return cipher.doFinal(input);
  }
}
