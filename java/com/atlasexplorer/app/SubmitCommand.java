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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.atlasexplorer.client.crypto.KeyException;
import com.atlasexplorer.client.crypto.KeyUnwrapper;
import com.atlasexplorer.client.crypto.KeyWrapper;
import com.atlasexplorer.client.crypto.RecipientKeys;
import com.atlasexplorer.client.submission.ExperimentWorkspace;
import com.atlasexplorer.client.submission.ResultPackage;
import com.atlasexplorer.client.submission.SubmissionException;
import com.atlasexplorer.client.submission.SubmissionOrchestrator;
import com.atlasexplorer.client.submission.TargetCore;
import com.atlasexplorer.client.submission.model.ErrorReason;
import com.atlasexplorer.shared.clients.configclient.ParameterClient;
import com.atlasexplorer.shared.util.Cancellation;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.ProvisionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Submits one or more workloads and optionally writes the decrypted result to a file. */
final class SubmitCommand implements Command {

  static final String NAME = "submit";

  private static final Logger logger = LoggerFactory.getLogger(SubmitCommand.class);

  private final SubmitArgs args;
  private final ParameterClient environment;

  SubmitCommand(SubmitArgs args, ParameterClient environment) {
    this.args = args;
    this.environment = environment;
  }

  @Override
  public Object args() {
    return args;
  }

  @Override
  public int run() {
    TargetCore core;
    try {
      core = TargetCore.fromName(args.getCore());
    } catch (IllegalArgumentException e) {
      logger.error(e.getMessage());
      return AtlasExplorerApplication.EXIT_USAGE;
    }

    KeyWrapper recipient;
    KeyUnwrapper resultKey;
    try {
      recipient = RecipientKeys.parsePublicKey(readKey(args.getServicePublicKey()));
      resultKey = RecipientKeys.parsePrivateKey(readKey(args.getClientPrivateKey()));
    } catch (IOException | KeyException e) {
      logger.error("Could not load keys: {}", e.toString());
      return AtlasExplorerApplication.EXIT_FAILURE;
    }

    SubmissionOrchestrator orchestrator;
    try {
      orchestrator =
          Guice.createInjector(new AtlasExplorerModule(args, environment, resultKey))
              .getInstance(SubmissionOrchestrator.class);
    } catch (ProvisionException e) {
      logger.error("Invalid configuration: {}", e.getCause() == null ? e : e.getCause());
      return AtlasExplorerApplication.EXIT_USAGE;
    }

    Cancellation cancellation = cancellation();
    Thread shutdownHook = new Thread(cancellation::cancel);
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    try {
      ResultPackage result =
          orchestrator.submit(workloadPaths(), core, recipient, cancellation);
      logger.info(
          "Job {} returned {} bytes, sha256 {}", result.jobId(), result.size(), result.sha256());
      if (!args.getOutput().isEmpty()) {
        Path written = ExperimentWorkspace.saveResult(result, Path.of(args.getOutput()));
        logger.info("Result written to {}", written);
      }
      return AtlasExplorerApplication.EXIT_OK;
    } catch (SubmissionException e) {
      logger.error("Submission failed: {}", e.toString());
      return e.getReason() == ErrorReason.CANCELLED
          ? AtlasExplorerApplication.EXIT_CANCELLED
          : AtlasExplorerApplication.EXIT_FAILURE;
    } catch (IOException e) {
      logger.error("Could not write result to {}", args.getOutput(), e);
      return AtlasExplorerApplication.EXIT_FAILURE;
    } finally {
      removeShutdownHook(shutdownHook);
    }
  }

  private ImmutableList<Path> workloadPaths() {
    return args.getWorkloads().stream().map(Path::of).collect(toImmutableList());
  }

  private Cancellation cancellation() {
    if (args.getDeadlineSeconds() <= 0) {
      return Cancellation.create();
    }
    Clock clock = Clock.systemUTC();
    return Cancellation.withDeadline(
        clock, clock.instant().plus(Duration.ofSeconds(args.getDeadlineSeconds())));
  }

  private static String readKey(String path) throws IOException {
    return Files.readString(Path.of(path), UTF_8);
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      // JVM is already shutting down; the hook has run.
      logger.debug("Shutdown in progress", e);
    }
  }
}
