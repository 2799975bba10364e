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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** Fully read HTTP response. Bodies are kept as bytes since signed URL downloads are binary. */
@AutoValue
public abstract class HttpClientResponse {

  public static HttpClientResponse create(
      int statusCode, byte[] responseBody, ImmutableMap<String, String> headers) {
    return new AutoValue_HttpClientResponse(statusCode, responseBody, headers);
  }

  public static HttpClientResponse create(
      int statusCode, String responseBody, ImmutableMap<String, String> headers) {
    return create(statusCode, responseBody.getBytes(UTF_8), headers);
  }

  public abstract int statusCode();

  @SuppressWarnings("mutable")
  public abstract byte[] responseBody();

  public abstract ImmutableMap<String, String> headers();

  /** Returns the body decoded as UTF-8. */
  public String bodyAsString() {
    return new String(responseBody(), UTF_8);
  }

  public boolean isSuccessful() {
    return statusCode() >= 200 && statusCode() < 300;
  }
}
