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

package com.atlasexplorer.app;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/** Arguments of the {@code keygen} command. */
@Parameters(commandDescription = "Generates a key pair for receiving encrypted results.")
public final class KeygenArgs {

  @Parameter(names = "--scheme", description = "Key scheme: TINK_HYBRID or RSA_OAEP_SHA256.")
  private String scheme = "TINK_HYBRID";

  @Parameter(
      names = "--private-key-out",
      description = "Path for the private key. Left untouched if it already holds a key.",
      required = true)
  private String privateKeyOut = "";

  @Parameter(
      names = "--public-key-out",
      description = "Path for the public key to share with the service.",
      required = true)
  private String publicKeyOut = "";

  public String getScheme() {
    return scheme;
  }

  public String getPrivateKeyOut() {
    return privateKeyOut;
  }

  public String getPublicKeyOut() {
    return publicKeyOut;
  }
}
