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

import com.atlasexplorer.client.transfer.SignedUrl;
import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Optional;

/** Terminal outcome of {@link JobStatusPoller#pollUntilTerminal}. */
@AutoValue
public abstract class PollResult {

  public static PollResult succeeded(SignedUrl downloadUrl, int statusCalls, Duration elapsed) {
    return new AutoValue_PollResult(
        JobState.SUCCEEDED, Optional.of(downloadUrl), Optional.empty(), statusCalls, elapsed);
  }

  public static PollResult failed(Optional<String> reason, int statusCalls, Duration elapsed) {
    return new AutoValue_PollResult(
        JobState.FAILED, Optional.empty(), reason, statusCalls, elapsed);
  }

  public static PollResult expired(Optional<String> reason, int statusCalls, Duration elapsed) {
    return new AutoValue_PollResult(
        JobState.EXPIRED, Optional.empty(), reason, statusCalls, elapsed);
  }

  public abstract JobState state();

  /** Present only for {@link JobState#SUCCEEDED}. */
  public abstract Optional<SignedUrl> downloadUrl();

  /** The service's failure reason, verbatim, when it gave one. */
  public abstract Optional<String> failureReason();

  public abstract int statusCalls();

  public abstract Duration elapsed();
}
