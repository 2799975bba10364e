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

import com.atlasexplorer.client.crypto.KeyUnwrapper;
import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Per client settings threaded through {@link SubmissionOrchestrator}. Immutable, so concurrent
 * submissions with different configurations never interfere.
 */
@AutoValue
public abstract class SubmissionConfig {

  public static final long DEFAULT_MAX_WORKLOAD_BYTES = 256L * 1024 * 1024;

  public static Builder builder() {
    return new AutoValue_SubmissionConfig.Builder().setMaxWorkloadBytes(DEFAULT_MAX_WORKLOAD_BYTES);
  }

  public abstract String channel();

  public abstract String region();

  /** Private key of this client, used to open result envelopes. */
  public abstract KeyUnwrapper resultKey();

  /** Where encrypted artifacts are kept per job. Nothing is persisted when absent. */
  public abstract Optional<Path> workingDirectory();

  public abstract long maxWorkloadBytes();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setChannel(String channel);

    public abstract Builder setRegion(String region);

    public abstract Builder setResultKey(KeyUnwrapper resultKey);

    public abstract Builder setWorkingDirectory(Optional<Path> workingDirectory);

    public abstract Builder setMaxWorkloadBytes(long maxWorkloadBytes);

    public abstract SubmissionConfig build();
  }
}
