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

package com.atlasexplorer.client.crypto.model;

/** Failure categories of key handling and envelope decryption. */
public enum ErrorReason {
  /** Key text could not be parsed as PEM or as a Tink JSON keyset. */
  MALFORMED_KEY,
  /** Key parsed but is of a type this client cannot use. */
  UNSUPPORTED_KEY_TYPE,
  /** RSA modulus below the accepted minimum. */
  WEAK_KEY,
  /** Envelope was wrapped with a different scheme than the unwrapper handles. */
  SCHEME_MISMATCH,
  /** Wrapping the content secret failed. */
  KEY_WRAP_FAILED,
  /** The wrapped content secret did not unwrap with the supplied key. */
  KEY_UNWRAP_FAILED,
  /** AES-GCM tag verification failed. */
  AUTHENTICATION_FAILED,
}
