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

package com.atlasexplorer.client.poller;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.atlasexplorer.client.poller.testing.FakeClockSleeper;
import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.ErrorReason;
import com.atlasexplorer.client.service.model.JobStatusResponse;
import com.atlasexplorer.client.service.testing.FakeExperimentServiceClient;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;
import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JobStatusPollerTest {

  private static final String JOB_ID = FakeExperimentServiceClient.JOB_ID;

  private final FakeExperimentServiceClient service = new FakeExperimentServiceClient();
  private final FakeClockSleeper clock = new FakeClockSleeper();

  @Test
  public void pollUntilTerminal_succeedsAfterProgress() throws Exception {
    service.thenReport("queued", "running", "running", "succeeded");
    PollerConfig config = PollerConfig.builder().build();

    PollResult result = poller(config).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(result.state()).isEqualTo(JobState.SUCCEEDED);
    assertThat(result.downloadUrl()).hasValue(FakeExperimentServiceClient.DOWNLOAD_URL);
    assertThat(result.statusCalls()).isEqualTo(4);
    assertThat(service.getStatusCalls()).isEqualTo(4);
    ImmutableList<Duration> sleeps = clock.getSleeps();
    assertThat(sleeps).hasSize(3);
    assertThat(Comparators.isInOrder(sleeps, Duration::compareTo)).isTrue();
    assertThat(sleeps.get(0)).isAtLeast(config.initialInterval());
    assertThat(result.elapsed()).isEqualTo(sleeps.stream().reduce(Duration.ZERO, Duration::plus));
  }

  @Test
  public void pollUntilTerminal_neverRunningPastBudget_expires() throws Exception {
    service.thenReport("running");
    PollerConfig config =
        PollerConfig.builder()
            .setMaxWait(Duration.ofSeconds(10))
            .setInitialInterval(Duration.ofSeconds(2))
            .setMaxInterval(Duration.ofSeconds(4))
            .build();

    PollResult result = poller(config).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(result.state()).isEqualTo(JobState.EXPIRED);
    assertThat(result.elapsed()).isEqualTo(Duration.ofSeconds(10));
    assertThat(result.statusCalls()).isEqualTo(clock.getSleeps().size());
    for (Duration sleep : clock.getSleeps()) {
      assertThat(sleep).isAtMost(Duration.ofSeconds(4));
    }
  }

  @Test
  public void pollUntilTerminal_sleepsGrowToMaxInterval() throws Exception {
    service.thenReport("running");
    PollerConfig config =
        PollerConfig.builder()
            .setMaxWait(Duration.ofMinutes(5))
            .setInitialInterval(Duration.ofSeconds(1))
            .setMaxInterval(Duration.ofSeconds(8))
            .setMultiplier(2.0)
            .setJitter(0)
            .build();

    poller(config).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(clock.getSleeps().subList(0, 5))
        .containsExactly(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(8),
            Duration.ofSeconds(8))
        .inOrder();
  }

  @Test
  public void pollUntilTerminal_remoteFailure_returnsReason() throws Exception {
    service
        .thenReport("queued")
        .thenRespond(
            JobStatusResponse.builder()
                .jobId(JOB_ID)
                .state("FAILED")
                .failureReason(Optional.of("illegal instruction"))
                .build());

    PollResult result =
        poller(PollerConfig.builder().build()).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(result.state()).isEqualTo(JobState.FAILED);
    assertThat(result.failureReason()).hasValue("illegal instruction");
    assertThat(result.downloadUrl()).isEmpty();
  }

  @Test
  public void pollUntilTerminal_remoteExpiry_returnsExpired() throws Exception {
    service.thenReport("running", "expired");

    PollResult result =
        poller(PollerConfig.builder().build()).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(result.state()).isEqualTo(JobState.EXPIRED);
    assertThat(result.statusCalls()).isEqualTo(2);
  }

  @Test
  public void pollUntilTerminal_regressionIsIgnored() throws Exception {
    service.thenReport("running", "queued", "succeeded");

    PollResult result =
        poller(PollerConfig.builder().build()).pollUntilTerminal(JOB_ID, Cancellation.create());

    assertThat(result.state()).isEqualTo(JobState.SUCCEEDED);
  }

  @Test
  public void pollUntilTerminal_alreadyCancelled_makesNoCalls() {
    service.thenReport("running");
    Cancellation cancellation = Cancellation.create();
    cancellation.cancel();

    assertThrows(
        CancelledException.class,
        () -> poller(PollerConfig.builder().build()).pollUntilTerminal(JOB_ID, cancellation));
    assertThat(service.getStatusCalls()).isEqualTo(0);
  }

  @Test
  public void pollUntilTerminal_deadlinePasses_cancels() {
    service.thenReport("running");
    Cancellation cancellation =
        Cancellation.withDeadline(clock, FakeClockSleeper.DEFAULT_START.plusSeconds(20));

    assertThrows(
        CancelledException.class,
        () -> poller(PollerConfig.builder().build()).pollUntilTerminal(JOB_ID, cancellation));
    assertThat(clock.instant()).isAtLeast(FakeClockSleeper.DEFAULT_START.plusSeconds(20));
  }

  @Test
  public void pollUntilTerminal_unknownState_throwsMalformedResponse() {
    service.thenReport("queued", "on_fire");

    ExperimentServiceException e =
        assertThrows(
            ExperimentServiceException.class,
            () ->
                poller(PollerConfig.builder().build())
                    .pollUntilTerminal(JOB_ID, Cancellation.create()));

    assertThat(e.getReason()).isEqualTo(ErrorReason.MALFORMED_RESPONSE);
  }

  @Test
  public void pollUntilTerminal_succeededWithoutUrl_throwsMalformedResponse() {
    service.thenRespond(JobStatusResponse.builder().jobId(JOB_ID).state("succeeded").build());

    ExperimentServiceException e =
        assertThrows(
            ExperimentServiceException.class,
            () ->
                poller(PollerConfig.builder().build())
                    .pollUntilTerminal(JOB_ID, Cancellation.create()));

    assertThat(e.getReason()).isEqualTo(ErrorReason.MALFORMED_RESPONSE);
  }

  @Test
  public void pollUntilTerminal_serviceError_propagates() {
    service
        .thenReport("running")
        .thenFail(new ExperimentServiceException("down", ErrorReason.UNAVAILABLE));

    ExperimentServiceException e =
        assertThrows(
            ExperimentServiceException.class,
            () ->
                poller(PollerConfig.builder().build())
                    .pollUntilTerminal(JOB_ID, Cancellation.create()));

    assertThat(e.getReason()).isEqualTo(ErrorReason.UNAVAILABLE);
  }

  @Test
  public void pollUntilTerminal_interrupted_cancels() {
    service.thenReport("running");
    Sleeper interrupted =
        duration -> {
          throw new InterruptedException();
        };
    JobStatusPoller poller =
        new JobStatusPoller(
            service, PollerConfig.builder().build(), clock, interrupted, new Random(1));

    try {
      assertThrows(
          CancelledException.class, () -> poller.pollUntilTerminal(JOB_ID, Cancellation.create()));
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  public void nextInterval_isCappedAndNeverDecreases() {
    PollerConfig config =
        PollerConfig.builder()
            .setInitialInterval(Duration.ofSeconds(1))
            .setMaxInterval(Duration.ofSeconds(10))
            .setJitter(0.5)
            .build();
    JobStatusPoller poller = poller(config);

    assertThat(poller.nextInterval(Duration.ofSeconds(20), Duration.ZERO))
        .isEqualTo(Duration.ofSeconds(10));
    assertThat(poller.nextInterval(Duration.ofSeconds(1), Duration.ofSeconds(5)))
        .isEqualTo(Duration.ofSeconds(5));
    Duration jittered = poller.nextInterval(Duration.ofSeconds(2), Duration.ZERO);
    assertThat(jittered).isAtLeast(Duration.ofSeconds(2));
    assertThat(jittered).isAtMost(Duration.ofSeconds(3));
  }

  private JobStatusPoller poller(PollerConfig config) {
    return new JobStatusPoller(service, config, clock, clock, new Random(42));
  }
}
