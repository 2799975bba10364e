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

import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;

/** Moves opaque bytes to and from signed URLs. Knows nothing about their content. */
public interface TransferClient {

  /**
   * Uploads {@code payload} with a PUT to {@code url}.
   *
   * @throws TransferException on a non success status, an expired URL or exhausted retries
   * @throws CancelledException if {@code cancellation} fired before an attempt
   */
  void upload(SignedUrl url, byte[] payload, Cancellation cancellation)
      throws TransferException, CancelledException;

  /**
   * Downloads the object behind {@code url} with a GET.
   *
   * @throws TransferException on a non success status, an expired URL or exhausted retries
   * @throws CancelledException if {@code cancellation} fired before an attempt
   */
  byte[] download(SignedUrl url, Cancellation cancellation)
      throws TransferException, CancelledException;
}
