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

package com.atlasexplorer.client.submission.model;

/** Why a submission failed, independent of the stage it failed in. */
public enum ErrorReason {
  /** The workload file is missing, empty, too large or not an ELF executable. */
  INVALID_WORKLOAD,
  /** Local file system failure. */
  IO_ERROR,
  /** Bad or incompatible key material. */
  KEY_ERROR,
  /** An envelope failed authentication. */
  INTEGRITY_ERROR,
  /** An envelope or service response could not be parsed. */
  FORMAT_ERROR,
  /** A signed URL upload or download failed. */
  TRANSFER_ERROR,
  /** The service refused a request, including refused credentials. */
  SERVICE_REJECTED,
  /** The service could not be reached or kept failing transiently. */
  SERVICE_UNAVAILABLE,
  /** The job did not reach a terminal state within the polling budget, or expired remotely. */
  JOB_EXPIRED,
  /** The service reported that the job failed. */
  REMOTE_FAILURE,
  /** The caller cancelled the submission or its deadline passed. */
  CANCELLED,
}
