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

/** Thrown when an envelope fails authentication. No plaintext is released. */
public final class IntegrityException extends Exception {

  private final ErrorReason reason;

  /** Creates a new instance from a message String and a reason. */
  public IntegrityException(String message, ErrorReason reason) {
    super(message);
    this.reason = reason;
  }

  /** Constructs a new exception with the specified detail message, reason, and cause. */
  public IntegrityException(String message, ErrorReason reason, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /** Returns the {@link ErrorReason} for the exception. */
  public ErrorReason getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return String.format("%s (Error reason: %s)", super.toString(), reason);
  }
}
