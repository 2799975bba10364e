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

package com.atlasexplorer.client.submission;

import com.atlasexplorer.client.crypto.KeyException;
import com.atlasexplorer.client.crypto.KeyUnwrapper;
import com.atlasexplorer.client.crypto.KeyWrapper;
import com.atlasexplorer.client.crypto.TinkHybridKeyUnwrapper;
import com.atlasexplorer.client.crypto.TinkHybridKeyWrapper;
import com.atlasexplorer.client.crypto.TinkKeysets;
import com.google.crypto.tink.KeysetHandle;
import java.security.GeneralSecurityException;

/** Key pairs of the service and of the client, generated once per test run. */
final class TestKeys {

  static final KeyWrapper SERVICE_PUBLIC;
  static final KeyUnwrapper SERVICE_PRIVATE;
  static final KeyWrapper CLIENT_PUBLIC;
  static final KeyUnwrapper CLIENT_PRIVATE;

  static {
    try {
      KeysetHandle service = TinkKeysets.generatePrivateKeyset();
      KeysetHandle client = TinkKeysets.generatePrivateKeyset();
      SERVICE_PUBLIC = TinkHybridKeyWrapper.create(service.getPublicKeysetHandle());
      SERVICE_PRIVATE = TinkHybridKeyUnwrapper.create(service);
      CLIENT_PUBLIC = TinkHybridKeyWrapper.create(client.getPublicKeysetHandle());
      CLIENT_PRIVATE = TinkHybridKeyUnwrapper.create(client);
    } catch (GeneralSecurityException | KeyException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private TestKeys() {}
}
