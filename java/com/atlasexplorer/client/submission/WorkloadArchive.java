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

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Plaintext layout of a submission's workloads.
 *
 * <p>A single workload is sent as its raw ELF bytes ({@link #PACKAGING_ELF}). Two or more are
 * bundled into one ZIP archive ({@link #PACKAGING_ZIP}) with one entry per workload, named by its
 * file name and kept in submission order. Entry timestamps are fixed so identical inputs give
 * identical archives.
 */
final class WorkloadArchive {

  static final String PACKAGING_ELF = "elf";
  static final String PACKAGING_ZIP = "zip";

  private WorkloadArchive() {}

  /** Packaging name announced to the service for {@code workloadCount} workloads. */
  static String packaging(int workloadCount) {
    return workloadCount == 1 ? PACKAGING_ELF : PACKAGING_ZIP;
  }

  /**
   * Returns the plaintext for {@code contents}, which are parallel to {@code names}. The caller
   * owns the returned buffer.
   */
  static byte[] pack(ImmutableList<String> names, List<byte[]> contents) throws IOException {
    if (names.size() != contents.size() || names.isEmpty()) {
      throw new IllegalArgumentException(
          String.format("%d names for %d workloads", names.size(), contents.size()));
    }
    if (names.size() == 1) {
      return contents.get(0).clone();
    }
    WipeableOutputStream buffer = new WipeableOutputStream();
    try {
      try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
        for (int i = 0; i < names.size(); i++) {
          ZipEntry entry = new ZipEntry(names.get(i));
          entry.setTime(0L);
          zip.putNextEntry(entry);
          zip.write(contents.get(i));
          zip.closeEntry();
        }
      }
      return buffer.toByteArray();
    } finally {
      buffer.wipe();
    }
  }

  /** Lets the archive's intermediate buffer be zeroed once copied out. */
  private static final class WipeableOutputStream extends ByteArrayOutputStream {

    synchronized void wipe() {
      Arrays.fill(buf, (byte) 0);
      reset();
    }
  }
}
