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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class WorkloadArchiveTest {

  private static final byte[] MANDELBROT = "\u007fELF mandelbrot".getBytes(UTF_8);
  private static final byte[] MEMCPY = "\u007fELF memcpy".getBytes(UTF_8);

  @Test
  public void pack_singleWorkload_isRawCopy() throws Exception {
    byte[] packed =
        WorkloadArchive.pack(ImmutableList.of("mandelbrot.elf"), ImmutableList.of(MANDELBROT));

    assertThat(packed).isEqualTo(MANDELBROT);
    assertThat(packed).isNotSameInstanceAs(MANDELBROT);
    assertThat(WorkloadArchive.packaging(1)).isEqualTo(WorkloadArchive.PACKAGING_ELF);
  }

  @Test
  public void pack_severalWorkloads_zipsInOrder() throws Exception {
    byte[] packed =
        WorkloadArchive.pack(
            ImmutableList.of("mandelbrot.elf", "memcpy.elf"),
            ImmutableList.of(MANDELBROT, MEMCPY));

    Map<String, byte[]> entries = unzip(packed);
    assertThat(entries.keySet()).containsExactly("mandelbrot.elf", "memcpy.elf").inOrder();
    assertThat(entries.get("mandelbrot.elf")).isEqualTo(MANDELBROT);
    assertThat(entries.get("memcpy.elf")).isEqualTo(MEMCPY);
    assertThat(WorkloadArchive.packaging(2)).isEqualTo(WorkloadArchive.PACKAGING_ZIP);
  }

  @Test
  public void pack_sameInputs_givesSameArchive() throws Exception {
    ImmutableList<String> names = ImmutableList.of("a.elf", "b.elf");

    byte[] first = WorkloadArchive.pack(names, ImmutableList.of(MANDELBROT, MEMCPY));
    byte[] second = WorkloadArchive.pack(names, ImmutableList.of(MANDELBROT, MEMCPY));

    assertThat(first).isEqualTo(second);
  }

  @Test
  public void pack_mismatchedNames_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> WorkloadArchive.pack(ImmutableList.of("a.elf"), ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> WorkloadArchive.pack(ImmutableList.of(), ImmutableList.of()));
  }

  static ImmutableMap<String, byte[]> unzip(byte[] archive) throws IOException {
    Map<String, byte[]> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), zip.readAllBytes());
      }
    }
    return ImmutableMap.copyOf(entries);
  }
}
