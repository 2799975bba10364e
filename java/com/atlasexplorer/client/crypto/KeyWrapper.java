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

import com.atlasexplorer.client.envelope.WrapScheme;

/** Public half of a recipient: wraps a content secret so only the recipient can recover it. */
public interface KeyWrapper {

  WrapScheme scheme();

  /**
   * Wraps {@code secret}, binding it to {@code associatedData}. Every call uses fresh randomness.
   *
   * @throws KeyException if the key cannot be used for wrapping
   */
  byte[] wrap(byte[] secret, byte[] associatedData) throws KeyException;
}
