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

/** Response of {@code POST /experiments}. */
@AutoValue
@JsonDeserialize(builder = CreateJobResponse.Builder.class)
public abstract class CreateJobResponse {

  public static CreateJobResponse create(String jobId, SignedUrl uploadUrl) {
    return Builder.builder().jobId(jobId).uploadUrl(uploadUrl).build();
  }

  @JsonProperty("jobId")
  public abstract String jobId();

  @JsonProperty("uploadUrl")
  public abstract SignedUrl uploadUrl();

  @JsonIgnoreProperties(ignoreUnknown = true)
  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static CreateJobResponse.Builder builder() {
      return new AutoValue_CreateJobResponse.Builder();
    }

    @JsonProperty("jobId")
    public abstract CreateJobResponse.Builder jobId(String jobId);

    @JsonProperty("uploadUrl")
    public abstract CreateJobResponse.Builder uploadUrl(SignedUrl uploadUrl);

    public abstract CreateJobResponse build();
  }
}
