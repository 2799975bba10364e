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
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * Parses recipient key material.
 *
 * <p>Two encodings are accepted: PEM RSA keys ({@code PUBLIC KEY}, {@code PRIVATE KEY} or {@code
 * RSA PRIVATE KEY} blocks) and Tink JSON hybrid keysets. Anything else fails with {@link
 * KeyException} rather than falling back to a weaker scheme.
 */
public final class RecipientKeys {

  private static final String PEM_PREFIX = "-----BEGIN ";

  private RecipientKeys() {}

  /** Parses a recipient public key into a {@link KeyWrapper}. */
  public static KeyWrapper parsePublicKey(String encoded) throws KeyException {
    String trimmed = encoded.trim();
    if (trimmed.startsWith(PEM_PREFIX)) {
      Object pemObject = readPem(trimmed);
      if (!(pemObject instanceof SubjectPublicKeyInfo)) {
        throw new KeyException("PEM block is not a public key", ErrorReason.UNSUPPORTED_KEY_TYPE);
      }
      PublicKey publicKey;
      try {
        publicKey = new JcaPEMKeyConverter().getPublicKey((SubjectPublicKeyInfo) pemObject);
      } catch (PEMException | RuntimeException e) {
        throw new KeyException("Unreadable public key", ErrorReason.MALFORMED_KEY, e);
      }
      if (!(publicKey instanceof RSAPublicKey)) {
        throw new KeyException(
            "Unsupported public key algorithm " + publicKey.getAlgorithm(),
            ErrorReason.UNSUPPORTED_KEY_TYPE);
      }
      return RsaOaepKeyWrapper.create((RSAPublicKey) publicKey);
    }
    if (trimmed.startsWith("{")) {
      try {
        return TinkHybridKeyWrapper.create(TinkKeysets.fromJsonPublic(trimmed));
      } catch (GeneralSecurityException | IOException e) {
        throw new KeyException("Unreadable Tink public keyset", ErrorReason.MALFORMED_KEY, e);
      }
    }
    throw new KeyException(
        "Public key is neither PEM nor a Tink JSON keyset", ErrorReason.MALFORMED_KEY);
  }

  /** Parses the private key of this client into a {@link KeyUnwrapper}. */
  public static KeyUnwrapper parsePrivateKey(String encoded) throws KeyException {
    String trimmed = encoded.trim();
    if (trimmed.startsWith(PEM_PREFIX)) {
      Object pemObject = readPem(trimmed);
      PrivateKey privateKey;
      try {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        if (pemObject instanceof PEMKeyPair) {
          privateKey = converter.getKeyPair((PEMKeyPair) pemObject).getPrivate();
        } else if (pemObject instanceof PrivateKeyInfo) {
          privateKey = converter.getPrivateKey((PrivateKeyInfo) pemObject);
        } else {
          throw new KeyException(
              "PEM block is not an unencrypted private key", ErrorReason.UNSUPPORTED_KEY_TYPE);
        }
      } catch (PEMException | RuntimeException e) {
        throw new KeyException("Unreadable private key", ErrorReason.MALFORMED_KEY, e);
      }
      if (!(privateKey instanceof RSAPrivateKey)) {
        throw new KeyException(
            "Unsupported private key algorithm " + privateKey.getAlgorithm(),
            ErrorReason.UNSUPPORTED_KEY_TYPE);
      }
      return RsaOaepKeyUnwrapper.create((RSAPrivateKey) privateKey);
    }
    if (trimmed.startsWith("{")) {
      try {
        return TinkHybridKeyUnwrapper.create(TinkKeysets.fromJsonCleartext(trimmed));
      } catch (GeneralSecurityException | IOException e) {
        throw new KeyException("Unreadable Tink private keyset", ErrorReason.MALFORMED_KEY, e);
      }
    }
    throw new KeyException(
        "Private key is neither PEM nor a Tink JSON keyset", ErrorReason.MALFORMED_KEY);
  }

  /** Encodes {@code key} as a PEM block. */
  public static String toPem(Key key) throws IOException {
    StringWriter out = new StringWriter();
    try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
      writer.writeObject(key);
    }
    return out.toString();
  }

  private static Object readPem(String pem) throws KeyException {
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object pemObject = parser.readObject();
      if (pemObject == null) {
        throw new KeyException("No PEM block found", ErrorReason.MALFORMED_KEY);
      }
      return pemObject;
    } catch (IOException | RuntimeException e) {
      // Bad base64 and bad DER surface as unchecked BouncyCastle exceptions.
      throw new KeyException("Unreadable PEM block", ErrorReason.MALFORMED_KEY, e);
    }
  }
}
