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

package com.atlasexplorer.client.envelope;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** scrypt cost parameters carried in every envelope header. */
@AutoValue
public abstract class KdfParams {

  public static final int MIN_LOG2_N = 10;
  public static final int MAX_LOG2_N = 20;
  public static final int MAX_R = 16;
  public static final int MAX_P = 4;

  /** N = 2^15, r = 8, p = 1. */
  public static final KdfParams DEFAULT = create(15, 8, 1);

  /**
   * @throws IllegalArgumentException if any parameter is outside the accepted bounds
   */
  public static KdfParams create(int log2N, int r, int p) {
    checkArgument(
        isValid(log2N, r, p), "Unsupported scrypt parameters log2N=%s r=%s p=%s", log2N, r, p);
    return new AutoValue_KdfParams(log2N, r, p);
  }

  static boolean isValid(int log2N, int r, int p) {
    return log2N >= MIN_LOG2_N
        && log2N <= MAX_LOG2_N
        && r >= 1
        && r <= MAX_R
        && p >= 1
        && p <= MAX_P;
  }

  public abstract int log2N();

  public abstract int r();

  public abstract int p();

  /** The scrypt CPU/memory cost N. */
  public int n() {
    return 1 << log2N();
  }
}
