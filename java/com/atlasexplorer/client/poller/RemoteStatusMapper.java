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

import com.atlasexplorer.client.service.ExperimentServiceException;
import com.atlasexplorer.client.service.model.ErrorReason;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/** Maps the experiment service's status vocabulary onto {@link JobState}. */
public final class RemoteStatusMapper {

  private static final ImmutableMap<String, JobState> VOCABULARY =
      ImmutableMap.<String, JobState>builder()
          .put("pending", JobState.PENDING)
          .put("created", JobState.PENDING)
          .put("uploading", JobState.UPLOADING)
          .put("queued", JobState.QUEUED)
          .put("submitted", JobState.QUEUED)
          .put("running", JobState.RUNNING)
          .put("processing", JobState.RUNNING)
          .put("in_progress", JobState.RUNNING)
          .put("succeeded", JobState.SUCCEEDED)
          .put("success", JobState.SUCCEEDED)
          .put("completed", JobState.SUCCEEDED)
          .put("complete", JobState.SUCCEEDED)
          .put("done", JobState.SUCCEEDED)
          .put("failed", JobState.FAILED)
          .put("error", JobState.FAILED)
          .put("expired", JobState.EXPIRED)
          .put("timed_out", JobState.EXPIRED)
          .build();

  private RemoteStatusMapper() {}

  /**
   * Returns the local state for {@code remoteState}, ignoring case and surrounding whitespace.
   *
   * @throws ExperimentServiceException with {@link ErrorReason#MALFORMED_RESPONSE} for a value
   *     outside the known vocabulary
   */
  public static JobState map(String remoteState) throws ExperimentServiceException {
    JobState state = VOCABULARY.get(remoteState.trim().toLowerCase(Locale.ROOT));
    if (state == null) {
      throw new ExperimentServiceException(
          "Unknown remote job state '" + remoteState + "'", ErrorReason.MALFORMED_RESPONSE);
    }
    return state;
  }
}
