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

import com.google.auto.value.AutoValue;
import com.google.common.hash.Hashing;

/** Decrypted analysis results of a finished job. */
@AutoValue
public abstract class ResultPackage {

  public static ResultPackage create(String submissionId, String jobId, byte[] bytes) {
    byte[] copy = bytes.clone();
    return new AutoValue_ResultPackage(
        submissionId, jobId, copy, copy.length, Hashing.sha256().hashBytes(copy).toString());
  }

  public abstract String submissionId();

  public abstract String jobId();

  @SuppressWarnings("mutable")
  abstract byte[] content();

  /** Size of the decrypted result in bytes. */
  public abstract long size();

  /** Lowercase hex SHA-256 of the decrypted result. */
  public abstract String sha256();

  /** Returns a copy of the decrypted result. */
  public byte[] bytes() {
    return content().clone();
  }
}
