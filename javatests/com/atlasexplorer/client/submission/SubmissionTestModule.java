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

import com.atlasexplorer.client.Annotations.JitterRandom;
import com.atlasexplorer.client.envelope.KdfParams;
import com.atlasexplorer.client.poller.PollerConfig;
import com.atlasexplorer.client.poller.Sleeper;
import com.atlasexplorer.client.poller.testing.FakeClockSleeper;
import com.atlasexplorer.client.service.ExperimentServiceClient;
import com.atlasexplorer.client.service.testing.FakeExperimentServiceClient;
import com.atlasexplorer.client.transfer.TransferClient;
import com.atlasexplorer.client.transfer.testing.InMemoryTransferClient;
import com.google.acai.TestScoped;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;
import java.util.Random;

/** Wires {@link SubmissionOrchestrator} to in-memory fakes and a fake clock. */
public final class SubmissionTestModule extends AbstractModule {

  @Override
  protected void configure() {
    bind(FakeClockSleeper.class).in(TestScoped.class);
    bind(Clock.class).to(FakeClockSleeper.class);
    bind(Sleeper.class).to(FakeClockSleeper.class);
    bind(FakeExperimentServiceClient.class).in(TestScoped.class);
    bind(ExperimentServiceClient.class).to(FakeExperimentServiceClient.class);
    bind(InMemoryTransferClient.class).in(TestScoped.class);
    bind(TransferClient.class).to(InMemoryTransferClient.class);
  }

  @Provides
  SecureRandom provideSecureRandom() {
    return new SecureRandom();
  }

  @Provides
  @JitterRandom
  Random provideJitterRandom() {
    return new Random(7);
  }

  @Provides
  KdfParams provideKdfParams() {
    return KdfParams.create(10, 8, 1);
  }

  @Provides
  PollerConfig providePollerConfig() {
    return PollerConfig.builder().build();
  }

  @Provides
  SubmissionConfig provideSubmissionConfig() {
    return SubmissionConfig.builder()
        .setChannel("stable")
        .setRegion("eu")
        .setResultKey(TestKeys.CLIENT_PRIVATE)
        .setWorkingDirectory(Optional.empty())
        .build();
  }
}
