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

import com.atlasexplorer.client.crypto.local.ClientKeyFileGenerator;
import com.atlasexplorer.client.envelope.WrapScheme;
import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Generates the key pair a client uses to receive encrypted results. */
final class KeygenCommand implements Command {

  static final String NAME = "keygen";

  private static final Logger logger = LoggerFactory.getLogger(KeygenCommand.class);

  private final KeygenArgs args;

  KeygenCommand(KeygenArgs args) {
    this.args = args;
  }

  @Override
  public Object args() {
    return args;
  }

  @Override
  public int run() {
    WrapScheme scheme;
    try {
      scheme = WrapScheme.valueOf(args.getScheme().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      logger.error("Unknown key scheme {}", args.getScheme());
      return AtlasExplorerApplication.EXIT_USAGE;
    }
    Path privateKeyPath = Path.of(args.getPrivateKeyOut());
    Path publicKeyPath = Path.of(args.getPublicKeyOut());
    try {
      if (ClientKeyFileGenerator.generateKeyPair(scheme, privateKeyPath, publicKeyPath)) {
        logger.info("Wrote {} key pair to {} and {}", scheme, privateKeyPath, publicKeyPath);
      } else {
        logger.info("Key already exists at {}, nothing generated", privateKeyPath);
      }
      return AtlasExplorerApplication.EXIT_OK;
    } catch (IOException | GeneralSecurityException e) {
      logger.error("Key generation failed", e);
      return AtlasExplorerApplication.EXIT_FAILURE;
    }
  }
}
