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

import com.atlasexplorer.client.transfer.SignedUrl;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * Response of {@code GET /experiments/{jobId}/status}. The state is kept in the service's own
 * vocabulary; mapping it onto local job states is the poller's concern.
 */
@AutoValue
@JsonDeserialize(builder = JobStatusResponse.Builder.class)
public abstract class JobStatusResponse {

  public static JobStatusResponse.Builder builder() {
    return Builder.builder();
  }

  @JsonProperty("jobId")
  public abstract String jobId();

  @JsonProperty("state")
  public abstract String state();

  @JsonProperty("downloadUrl")
  public abstract Optional<SignedUrl> downloadUrl();

  @JsonProperty("failureReason")
  public abstract Optional<String> failureReason();

  @JsonIgnoreProperties(ignoreUnknown = true)
  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static JobStatusResponse.Builder builder() {
      return new AutoValue_JobStatusResponse.Builder();
    }

    @JsonProperty("jobId")
    public abstract JobStatusResponse.Builder jobId(String jobId);

    @JsonProperty("state")
    public abstract JobStatusResponse.Builder state(String state);

    @JsonProperty("downloadUrl")
    public abstract JobStatusResponse.Builder downloadUrl(Optional<SignedUrl> downloadUrl);

    @JsonProperty("failureReason")
    public abstract JobStatusResponse.Builder failureReason(Optional<String> failureReason);

    public abstract JobStatusResponse build();
  }
}
