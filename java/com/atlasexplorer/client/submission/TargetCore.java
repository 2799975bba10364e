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

/** Core models the experiment service can simulate. */
public enum TargetCore {
  I8500_1_THREAD("I8500_(1_thread)"),
  I8500_2_THREADS("I8500_(2_threads)"),
  P8700("P8700"),
  SHOGUN_2T("shogun_2t");

  private final String serviceName;

  TargetCore(String serviceName) {
    this.serviceName = serviceName;
  }

  /** Name the experiment service uses for this core. */
  public String serviceName() {
    return serviceName;
  }

  /**
   * Accepts either the service name (e.g. {@code I8500_(1_thread)}) or the constant name.
   *
   * @throws IllegalArgumentException for an unknown core
   */
  public static TargetCore fromName(String name) {
    for (TargetCore core : values()) {
      if (core.serviceName.equals(name) || core.name().equals(name)) {
        return core;
      }
    }
    throw new IllegalArgumentException("Unknown target core: " + name);
  }
}
