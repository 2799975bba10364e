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

package com.atlasexplorer.client.crypto.local;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.atlasexplorer.client.crypto.KeyException;
import com.atlasexplorer.client.crypto.RecipientKeys;
import com.atlasexplorer.client.crypto.TinkKeysets;
import com.atlasexplorer.client.envelope.WrapScheme;
import com.google.crypto.tink.KeysetHandle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;

/**
 * Generates a key pair for this client and writes the private and public halves to files (or does
 * nothing if a usable private key already exists).
 *
 * <p>The public half is handed to the experiment service so it can encrypt results for this
 * client; the private half stays local and opens those results.
 */
public final class ClientKeyFileGenerator {

  private static final int RSA_MODULUS_BITS = 3072;

  private ClientKeyFileGenerator() {}

  /**
   * Generates a key pair for {@code scheme}, unless a readable private key already exists at
   * {@code privateKeyPath}.
   *
   * @return whether a new key was generated; false if there was something already existing.
   */
  public static boolean generateKeyPair(WrapScheme scheme, Path privateKeyPath, Path publicKeyPath)
      throws IOException, GeneralSecurityException {
    // A key already exists there, skip generating.
    if (Files.exists(privateKeyPath) && hasKey(privateKeyPath)) {
      return false;
    }
    String privateKey;
    String publicKey;
    switch (scheme) {
      case TINK_HYBRID:
        KeysetHandle keysetHandle = TinkKeysets.generatePrivateKeyset();
        privateKey = TinkKeysets.toJsonCleartext(keysetHandle);
        publicKey = TinkKeysets.toJsonCleartext(keysetHandle.getPublicKeysetHandle());
        break;
      case RSA_OAEP_SHA256:
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(RSA_MODULUS_BITS);
        KeyPair keyPair = generator.generateKeyPair();
        privateKey = RecipientKeys.toPem(keyPair.getPrivate());
        publicKey = RecipientKeys.toPem(keyPair.getPublic());
        break;
      default:
        throw new IllegalArgumentException("Unknown wrap scheme " + scheme);
    }
    Files.writeString(privateKeyPath, privateKey, UTF_8);
    Files.writeString(publicKeyPath, publicKey, UTF_8);
    return true;
  }

  /**
   * Returns true if there is a private key at {@code path}.
   *
   * <p>If the key could not be processed for whatever reason, returns false.
   */
  private static boolean hasKey(Path path) {
    try {
      RecipientKeys.parsePrivateKey(Files.readString(path, UTF_8));
    } catch (IOException | KeyException e) {
      // Unable to process the key.
      return false;
    }
    return true;
  }
}
