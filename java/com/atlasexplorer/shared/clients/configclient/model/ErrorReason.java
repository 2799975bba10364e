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

/** Failure categories reported by a {@code ParameterClient}. */
public enum ErrorReason {
  /** A parameter that has no default was not supplied. */
  MISSING_REQUIRED_PARAMETER,
  /** A parameter was supplied but could not be parsed. */
  INVALID_PARAMETER,
  /** The parameter source itself could not be read. */
  FETCH_ERROR,
}
