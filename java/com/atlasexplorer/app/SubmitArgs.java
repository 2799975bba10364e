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
import java.util.ArrayList;
import java.util.List;

/**
 * Arguments of the {@code submit} command. Service settings left empty here are read from the
 * environment.
 */
@Parameters(
    commandDescription = "Encrypts workloads, runs them remotely and fetches the result.")
public final class SubmitArgs {

  @Parameter(
      names = "--workload",
      description = "Path of an ELF workload. Repeat to run several together.",
      required = true)
  private List<String> workloads = new ArrayList<>();

  @Parameter(
      names = "--core",
      description = "Target core, for example I8500_(1_thread), I8500_(2_threads) or P8700.",
      required = true)
  private String core = "";

  @Parameter(
      names = "--service-public-key",
      description = "File holding the service public key (PEM or Tink JSON keyset).",
      required = true)
  private String servicePublicKey = "";

  @Parameter(
      names = "--client-private-key",
      description = "File holding this client's private key, used to decrypt the result.",
      required = true)
  private String clientPrivateKey = "";

  @Parameter(
      names = "--output",
      description = "Where to write the decrypted result. Nothing is written when empty.")
  private String output = "";

  @Parameter(names = "--gateway-url", description = "Base URL of the experiment service.")
  private String gatewayUrl = "";

  @Parameter(names = "--channel", description = "Release channel of the experiment service.")
  private String channel = "";

  @Parameter(names = "--region", description = "Region of the experiment service.")
  private String region = "";

  @Parameter(
      names = "--working-directory",
      description = "Directory for encrypted per job artifacts. Empty value disables them.")
  private String workingDirectory = "";

  @Parameter(
      names = "--deadline-seconds",
      description = "Cancels the submission after this many seconds. 0 means no deadline.")
  private long deadlineSeconds = 0;

  public List<String> getWorkloads() {
    return workloads;
  }

  public String getCore() {
    return core;
  }

  public String getServicePublicKey() {
    return servicePublicKey;
  }

  public String getClientPrivateKey() {
    return clientPrivateKey;
  }

  public String getOutput() {
    return output;
  }

  public String getGatewayUrl() {
    return gatewayUrl;
  }

  public String getChannel() {
    return channel;
  }

  public String getRegion() {
    return region;
  }

  public String getWorkingDirectory() {
    return workingDirectory;
  }

  public long getDeadlineSeconds() {
    return deadlineSeconds;
  }
}
