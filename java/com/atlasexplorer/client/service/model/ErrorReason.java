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

/** Failure categories of experiment service calls. */
public enum ErrorReason {
  /** 401 or 403: the API key was refused. */
  UNAUTHENTICATED,
  /** Any other 4xx: the service refused the request itself. */
  REJECTED,
  /** Network failure or a retryable status that persisted through every attempt. */
  UNAVAILABLE,
  /** The response body did not match the expected contract. */
  MALFORMED_RESPONSE,
}
