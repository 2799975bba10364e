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

package com.atlasexplorer.client.service;

import com.atlasexplorer.client.service.model.CreateJobRequest;
import com.atlasexplorer.client.service.model.CreateJobResponse;
import com.atlasexplorer.client.service.model.JobStatusResponse;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;

/** Client for the remote experiment service. */
public interface ExperimentServiceClient {

  /** Registers a new job and returns where its encrypted workload must be uploaded. */
  CreateJobResponse createJob(CreateJobRequest request, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException;

  /** Tells the service that the workload for {@code jobId} is uploaded and may be processed. */
  void startJob(String jobId, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException;

  /** Returns the current remote status of {@code jobId}. */
  JobStatusResponse getStatus(String jobId, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException;
}
