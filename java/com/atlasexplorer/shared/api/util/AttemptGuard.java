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

package com.atlasexplorer.shared.api.util;

/**
 * Precondition evaluated by {@link HttpClientWrapper} before the initial attempt and before every
 * retry. Throwing {@link AttemptAbortedException} stops the request without further retries.
 */
@FunctionalInterface
public interface AttemptGuard {

  /** Guard that never aborts. */
  AttemptGuard NONE = () -> {};

  void beforeAttempt() throws AttemptAbortedException;

  /** Signals that no further attempt may be made for the current request. */
  final class AttemptAbortedException extends Exception {

    public AttemptAbortedException(String message) {
      super(message);
    }

    public AttemptAbortedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
