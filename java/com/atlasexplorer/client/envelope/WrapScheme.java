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

package com.atlasexplorer.client.envelope;

import java.util.Optional;

/** Asymmetric scheme used to wrap the per-envelope content secret. */
public enum WrapScheme {
  /** Tink HPKE with X25519, HKDF-SHA256 and AES-256-GCM. */
  TINK_HYBRID(1),
  /** RSA-OAEP with SHA-256 and MGF1-SHA-256. */
  RSA_OAEP_SHA256(2);

  private final int id;

  WrapScheme(int id) {
    this.id = id;
  }

  /** Identifier written to the envelope header. */
  public int id() {
    return id;
  }

  public static Optional<WrapScheme> fromId(int id) {
    for (WrapScheme scheme : values()) {
      if (scheme.id == id) {
        return Optional.of(scheme);
      }
    }
    return Optional.empty();
  }
}
