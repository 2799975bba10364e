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

package com.atlasexplorer.client.submission;

import com.atlasexplorer.client.submission.model.ErrorReason;
import com.atlasexplorer.client.submission.model.Stage;

/**
 * Represents a failed submission. Carries the stage that failed and a reason; the underlying
 * exception, when there is one, is the cause.
 */
public final class SubmissionException extends Exception {

  private final Stage stage;
  private final ErrorReason reason;

  public SubmissionException(Stage stage, ErrorReason reason, String message) {
    super(message);
    this.stage = stage;
    this.reason = reason;
  }

  public SubmissionException(Stage stage, ErrorReason reason, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.reason = reason;
  }

  public Stage getStage() {
    return stage;
  }

  public ErrorReason getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return String.format("%s (Stage: %s, Error reason: %s)", super.toString(), stage, reason);
  }
}
