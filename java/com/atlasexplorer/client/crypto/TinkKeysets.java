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

import com.google.crypto.tink.CleartextKeysetHandle;
import com.google.crypto.tink.JsonKeysetReader;
import com.google.crypto.tink.JsonKeysetWriter;
import com.google.crypto.tink.KeyTemplates;
import com.google.crypto.tink.KeysetHandle;
import com.google.crypto.tink.hybrid.HybridConfig;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;

/** JSON (de)serialization and generation of the Tink hybrid keysets used for key wrapping. */
public final class TinkKeysets {

  /** HPKE with X25519 key agreement, HKDF-SHA256 and AES-256-GCM, without a key id prefix. */
  public static final String KEY_TEMPLATE = "DHKEM_X25519_HKDF_SHA256_HKDF_SHA256_AES_256_GCM_RAW";

  static {
    try {
      HybridConfig.register();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Could not register Tink HybridConfig", e);
    }
  }

  private TinkKeysets() {}

  /** Generates a new private hybrid keyset. */
  public static KeysetHandle generatePrivateKeyset() throws GeneralSecurityException {
    return KeysetHandle.generateNew(KeyTemplates.get(KEY_TEMPLATE));
  }

  /** Returns the JSON form of {@code keysetHandle}, including secret material if present. */
  public static String toJsonCleartext(KeysetHandle keysetHandle) throws IOException {
    ByteArrayOutputStream keyStream = new ByteArrayOutputStream();
    CleartextKeysetHandle.write(keysetHandle, JsonKeysetWriter.withOutputStream(keyStream));
    return keyStream.toString();
  }

  /** Reverses {@link #toJsonCleartext(KeysetHandle)}. */
  public static KeysetHandle fromJsonCleartext(String input)
      throws GeneralSecurityException, IOException {
    return CleartextKeysetHandle.read(JsonKeysetReader.withString(input));
  }

  /**
   * Reads a public keyset.
   *
   * @throws GeneralSecurityException if the keyset carries secret key material
   */
  public static KeysetHandle fromJsonPublic(String input)
      throws GeneralSecurityException, IOException {
    return KeysetHandle.readNoSecret(JsonKeysetReader.withString(input));
  }
}
