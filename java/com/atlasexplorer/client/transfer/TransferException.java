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

package com.atlasexplorer.client.transfer;

import com.atlasexplorer.client.transfer.model.ErrorReason;
import java.util.Optional;

/** Represents a failed signed URL upload or download. */
public final class TransferException extends Exception {

  private final ErrorReason reason;
  private final Optional<Integer> statusCode;

  public TransferException(String message, ErrorReason reason) {
    this(message, reason, Optional.empty());
  }

  public TransferException(String message, ErrorReason reason, Optional<Integer> statusCode) {
    super(message);
    this.reason = reason;
    this.statusCode = statusCode;
  }

  public TransferException(String message, ErrorReason reason, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.statusCode = Optional.empty();
  }

  public ErrorReason getReason() {
    return reason;
  }

  /** HTTP status of the last attempt, if one was received. */
  public Optional<Integer> getStatusCode() {
    return statusCode;
  }

  @Override
  public String toString() {
    return String.format("%s (Error reason: %s)", super.toString(), reason);
  }
}
