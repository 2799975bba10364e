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

package com.atlasexplorer.client.transfer.model;

/** Reasons a signed URL transfer failed. */
public enum ErrorReason {
  /** The signed URL expired before an attempt could be made. */
  URL_EXPIRED,
  /** The signed URL was issued for a different HTTP method. */
  WRONG_METHOD,
  /** Storage answered with a non retryable status, such as 403. */
  CLIENT_ERROR,
  /** Every attempt answered with a retryable status. */
  RETRIES_EXHAUSTED,
  /** The last attempt failed at the transport level. */
  NETWORK_ERROR,
}
