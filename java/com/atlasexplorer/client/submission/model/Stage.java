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

/** Pipeline stages of a submission, in execution order, plus the deduplication wait. */
public enum Stage {
  READ_WORKLOAD,
  ENCRYPT,
  CREATE_JOB,
  UPLOAD,
  START_JOB,
  POLL,
  DOWNLOAD,
  DECRYPT,
  /** Only runs when a working directory is configured. */
  PERSIST_ARTIFACT,
  /** Waiting for an identical submission that another caller already has in flight. */
  AWAIT_IDENTICAL,
}
