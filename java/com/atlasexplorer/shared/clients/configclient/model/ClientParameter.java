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

package com.atlasexplorer.shared.clients.configclient.model;

/** Parameters needed by the submission client. */
public enum ClientParameter {
  // Credentials
  API_KEY,
  CHANNEL,
  REGION,
  // Service
  GATEWAY_URL,
  WORKING_DIRECTORY,
  // Polling
  POLL_MAX_WAIT_SECONDS,
  POLL_INITIAL_INTERVAL_MILLIS,
  POLL_MAX_INTERVAL_MILLIS,
  // Transfer
  TRANSFER_MAX_ATTEMPTS,
}
