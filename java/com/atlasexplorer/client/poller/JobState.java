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

/**
 * Local view of a job's lifecycle. Declaration order is the order in which a job progresses;
 * {@link #SUCCEEDED}, {@link #FAILED} and {@link #EXPIRED} are terminal.
 */
public enum JobState {
  PENDING,
  UPLOADING,
  QUEUED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  EXPIRED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == EXPIRED;
  }

  /** True if moving from this state to {@code next} would go backwards. */
  public boolean isRegressionTo(JobState next) {
    return !isTerminal() && !next.isTerminal() && ordinal() > next.ordinal();
  }
}
