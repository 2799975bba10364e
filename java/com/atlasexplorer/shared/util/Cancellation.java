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

package com.atlasexplorer.shared.util;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a single submission.
 *
 * <p>A submission is cancelled either explicitly through {@link #cancel()} or implicitly once the
 * optional deadline has passed. Long running operations call {@link #throwIfCancelled()} at their
 * suspension points (top of a poll iteration, before an HTTP attempt).
 */
public final class Cancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final Clock clock;
  private final Optional<Instant> deadline;

  private Cancellation(Clock clock, Optional<Instant> deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  /** Returns a cancellation that only fires when {@link #cancel()} is called. */
  public static Cancellation create() {
    return new Cancellation(Clock.systemUTC(), Optional.empty());
  }

  /** Returns a cancellation that also fires once {@code clock} passes {@code deadline}. */
  public static Cancellation withDeadline(Clock clock, Instant deadline) {
    return new Cancellation(clock, Optional.of(deadline));
  }

  /** Requests cancellation. Idempotent. */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || deadline.map(d -> !clock.instant().isBefore(d)).orElse(false);
  }

  /** Throws {@link CancelledException} if the submission was cancelled or its deadline passed. */
  public void throwIfCancelled() throws CancelledException {
    if (cancelled.get()) {
      throw new CancelledException("Submission was cancelled");
    }
    if (deadline.isPresent() && !clock.instant().isBefore(deadline.get())) {
      throw new CancelledException("Submission deadline " + deadline.get() + " has passed");
    }
  }
}
