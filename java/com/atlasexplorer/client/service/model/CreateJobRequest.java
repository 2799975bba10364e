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

package com.atlasexplorer.client.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Body of {@code POST /experiments}. Describes the encrypted workload that will be uploaded. */
@AutoValue
public abstract class CreateJobRequest {

  public static Builder builder() {
    return new AutoValue_CreateJobRequest.Builder();
  }

  @JsonProperty("submissionId")
  public abstract String submissionId();

  @JsonProperty("targetCore")
  public abstract String targetCore();

  /** File name of the first workload. */
  @JsonProperty("workloadName")
  public abstract String workloadName();

  /** File names of every workload, in submission order. */
  @JsonProperty("workloadNames")
  public abstract ImmutableList<String> workloadNames();

  /** {@code elf} for a single raw workload, {@code zip} for a bundle of several. */
  @JsonProperty("packaging")
  public abstract String packaging();

  @JsonProperty("encryptedSize")
  public abstract long encryptedSize();

  @JsonProperty("channel")
  public abstract String channel();

  @JsonProperty("region")
  public abstract String region();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setSubmissionId(String submissionId);

    public abstract Builder setTargetCore(String targetCore);

    public abstract Builder setWorkloadName(String workloadName);

    public abstract Builder setWorkloadNames(ImmutableList<String> workloadNames);

    public abstract Builder setPackaging(String packaging);

    public abstract Builder setEncryptedSize(long encryptedSize);

    public abstract Builder setChannel(String channel);

    public abstract Builder setRegion(String region);

    public abstract CreateJobRequest build();
  }
}
