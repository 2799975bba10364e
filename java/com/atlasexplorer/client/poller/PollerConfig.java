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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/** Backoff and budget settings for {@link JobStatusPoller}. */
@AutoValue
public abstract class PollerConfig {

  public static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(30);
  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(2);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(30);
  public static final double DEFAULT_MULTIPLIER = 1.5;
  public static final double DEFAULT_JITTER = 0.2;

  public static Builder builder() {
    return new AutoValue_PollerConfig.Builder()
        .setMaxWait(DEFAULT_MAX_WAIT)
        .setInitialInterval(DEFAULT_INITIAL_INTERVAL)
        .setMaxInterval(DEFAULT_MAX_INTERVAL)
        .setMultiplier(DEFAULT_MULTIPLIER)
        .setJitter(DEFAULT_JITTER);
  }

  /** Cumulative time after which polling gives up with {@link JobState#EXPIRED}. */
  public abstract Duration maxWait();

  /** Backoff before the second status call. */
  public abstract Duration initialInterval();

  /** Ceiling for the backoff. */
  public abstract Duration maxInterval();

  public abstract double multiplier();

  /** Fraction in [0, 1) by which an interval may be stretched at random. */
  public abstract double jitter();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setMaxWait(Duration maxWait);

    public abstract Builder setInitialInterval(Duration initialInterval);

    public abstract Builder setMaxInterval(Duration maxInterval);

    public abstract Builder setMultiplier(double multiplier);

    public abstract Builder setJitter(double jitter);

    abstract PollerConfig autoBuild();

    public PollerConfig build() {
      PollerConfig config = autoBuild();
      checkArgument(!config.maxWait().isNegative() && !config.maxWait().isZero(), "maxWait");
      checkArgument(
          !config.initialInterval().isNegative() && !config.initialInterval().isZero(),
          "initialInterval must be positive");
      checkArgument(
          config.maxInterval().compareTo(config.initialInterval()) >= 0,
          "maxInterval must not be below initialInterval");
      checkArgument(config.multiplier() >= 1.0, "multiplier must be at least 1");
      checkArgument(config.jitter() >= 0 && config.jitter() < 1, "jitter must be in [0, 1)");
      return config;
    }
  }
}
