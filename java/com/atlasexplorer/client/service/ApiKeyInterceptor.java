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

package com.atlasexplorer.client.service;

import org.apache.http.HttpRequest;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.protocol.HttpContext;

/** Request interceptor that adds the API key header to every experiment service request. */
public final class ApiKeyInterceptor implements HttpRequestInterceptor {

  public static final String API_KEY_HEADER = "apikey";

  private final String apiKey;

  public ApiKeyInterceptor(String apiKey) {
    this.apiKey = apiKey;
  }

  @Override
  public void process(HttpRequest httpRequest, HttpContext httpContext) {
    httpRequest.setHeader(API_KEY_HEADER, apiKey);
  }

  @Override
  public String toString() {
    return "ApiKeyInterceptor{apiKey=<redacted>}";
  }
}
