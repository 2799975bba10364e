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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.time.Instant;

/** One request to run one or more workloads together on a target core. */
@AutoValue
public abstract class ExperimentSubmission {

  public static ExperimentSubmission create(
      String id, ImmutableList<Path> workloadPaths, TargetCore targetCore, Instant createdAt) {
    return new AutoValue_ExperimentSubmission(id, workloadPaths, targetCore, createdAt);
  }

  public abstract String id();

  /** Workloads in submission order, never empty. */
  public abstract ImmutableList<Path> workloadPaths();

  public abstract TargetCore targetCore();

  public abstract Instant createdAt();
}
