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

import com.atlasexplorer.client.Annotations.JitterRandom;
import com.atlasexplorer.client.service.ExperimentServiceClient;
import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.ErrorReason;
import com.atlasexplorer.client.service.model.JobStatusResponse;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a submitted job to a terminal {@link JobState}.
 *
 * <p>Each iteration checks the cancellation, then the elapsed budget, then asks the service for
 * the job status. Between non terminal reports the poller sleeps through the injected {@link
 * Sleeper}. Sleep intervals grow multiplicatively up to {@link PollerConfig#maxInterval()}, are
 * stretched by random jitter, never decrease, and are cut short so that no sleep runs past the
 * budget. Transient network errors are retried by the HTTP layer underneath {@link
 * ExperimentServiceClient}; an error that reaches this class ends polling.
 */
public final class JobStatusPoller {

  private static final Logger logger = LoggerFactory.getLogger(JobStatusPoller.class);

  private final ExperimentServiceClient serviceClient;
  private final PollerConfig config;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Random random;

  @Inject
  public JobStatusPoller(
      ExperimentServiceClient serviceClient,
      PollerConfig config,
      Clock clock,
      Sleeper sleeper,
      @JitterRandom Random random) {
    this.serviceClient = serviceClient;
    this.config = config;
    this.clock = clock;
    this.sleeper = sleeper;
    this.random = random;
  }

  /**
   * Polls {@code jobId} until it succeeds, fails, expires or the budget runs out.
   *
   * @throws ExperimentServiceException if a status call failed after the HTTP layer's retries, or
   *     the service reported something this client cannot interpret
   * @throws CancelledException if {@code cancellation} fired or the thread was interrupted
   */
  public PollResult pollUntilTerminal(String jobId, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException {
    Instant start = clock.instant();
    Instant deadline = start.plus(config.maxWait());
    JobState state = JobState.PENDING;
    Duration backoff = config.initialInterval();
    Duration previousInterval = Duration.ZERO;
    int statusCalls = 0;

    while (true) {
      cancellation.throwIfCancelled();
      if (!clock.instant().isBefore(deadline)) {
        logger.warn("Job {} still {} after {}, giving up", jobId, state, config.maxWait());
        return PollResult.expired(Optional.empty(), statusCalls, elapsedSince(start));
      }

      JobStatusResponse status = serviceClient.getStatus(jobId, cancellation);
      statusCalls++;
      JobState reported = RemoteStatusMapper.map(status.state());

      switch (reported) {
        case SUCCEEDED:
          if (status.downloadUrl().isEmpty()) {
            throw new ExperimentServiceException(
                "Job " + jobId + " succeeded without a download URL",
                ErrorReason.MALFORMED_RESPONSE);
          }
          logger.info("Job {} succeeded after {} status calls", jobId, statusCalls);
          return PollResult.succeeded(status.downloadUrl().get(), statusCalls, elapsedSince(start));
        case FAILED:
          logger.warn("Job {} failed: {}", jobId, status.failureReason().orElse("no reason given"));
          return PollResult.failed(status.failureReason(), statusCalls, elapsedSince(start));
        case EXPIRED:
          logger.warn("Job {} expired on the service side", jobId);
          return PollResult.expired(status.failureReason(), statusCalls, elapsedSince(start));
        default:
          break;
      }

      if (state.isRegressionTo(reported)) {
        logger.warn("Job {} reported {} after {}; keeping {}", jobId, reported, state, state);
      } else if (reported != state) {
        logger.info("Job {} moved from {} to {}", jobId, state, reported);
        state = reported;
      }

      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        continue;
      }
      Duration interval = nextInterval(backoff, previousInterval);
      previousInterval = interval;
      Duration sleep = interval.compareTo(remaining) < 0 ? interval : remaining;
      logger.debug("Job {} is {}, next status call in {}", jobId, state, sleep);
      try {
        sleeper.sleep(sleep);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancelledException("Interrupted while polling job " + jobId, e);
      }
      backoff = min(multiply(backoff, config.multiplier()), config.maxInterval());
    }
  }

  /** Jittered backoff, capped at the configured maximum and never below the previous interval. */
  @VisibleForTesting
  Duration nextInterval(Duration backoff, Duration previousInterval) {
    Duration jittered = multiply(backoff, 1 + random.nextDouble() * config.jitter());
    Duration capped = min(jittered, config.maxInterval());
    return capped.compareTo(previousInterval) > 0 ? capped : previousInterval;
  }

  private Duration elapsedSince(Instant start) {
    return Duration.between(start, clock.instant());
  }

  private static Duration multiply(Duration duration, double factor) {
    return Duration.ofNanos((long) (duration.toNanos() * factor));
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
