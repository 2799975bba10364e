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

import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local directory holding the encrypted artifacts of each job under {@code <root>/<jobId>/}.
 *
 * <p>Job ids are opaque service strings, so the directory name is the id with every character
 * other than ASCII letters, digits, {@code -} and {@code _} percent-encoded.
 *
 * <p>Only envelopes are written here. Decrypted results reach the disk solely through {@link
 * #saveResult}, at a path the caller chooses.
 */
public final class ExperimentWorkspace {

  static final String WORKLOAD_FILE = "workload.envelope";
  static final String RESULT_FILE = "result.envelope";

  private static final Escaper JOB_ID_ESCAPER = new PercentEscaper("-_", false);

  private final Path root;

  public ExperimentWorkspace(Path root) {
    this.root = root;
  }

  /** Writes the encrypted workload of {@code jobId}. */
  public Path saveEncryptedWorkload(String jobId, byte[] envelope) throws IOException {
    return writeAtomically(jobDirectory(jobId).resolve(WORKLOAD_FILE), envelope);
  }

  /** Writes the encrypted result of {@code jobId}. */
  public Path saveEncryptedResult(String jobId, byte[] envelope) throws IOException {
    return writeAtomically(jobDirectory(jobId).resolve(RESULT_FILE), envelope);
  }

  /** Writes the decrypted {@code result} to {@code target}, as explicitly requested by a caller. */
  public static Path saveResult(ResultPackage result, Path target) throws IOException {
    return writeAtomically(target.toAbsolutePath(), result.bytes());
  }

  Path jobDirectory(String jobId) throws IOException {
    if (jobId.isEmpty()) {
      throw new IOException("An empty job id has no workspace directory");
    }
    return root.resolve(JOB_ID_ESCAPER.escape(jobId));
  }

  private static Path writeAtomically(Path target, byte[] bytes) throws IOException {
    Path parent = target.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, bytes);
      return Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
