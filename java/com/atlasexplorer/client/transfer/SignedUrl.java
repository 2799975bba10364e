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

package com.atlasexplorer.client.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;

/**
 * Short lived URL issued by the experiment service for a single upload or download.
 *
 * <p>The query string usually carries a signature, so {@link #toString()} omits it. Log the
 * object, never {@link #url()}. Only absolute http and https URLs are accepted.
 */
@AutoValue
@JsonDeserialize(builder = SignedUrl.Builder.class)
public abstract class SignedUrl {

  /** HTTP method a signed URL was issued for. */
  public enum Method {
    PUT,
    GET
  }

  public static SignedUrl create(String url, Method method, Instant expiresAt) {
    return Builder.builder().url(url).method(method).expiresAt(expiresAt).build();
  }

  @JsonProperty("url")
  public abstract String url();

  @JsonProperty("method")
  public abstract Method method();

  @JsonProperty("expiresAt")
  public abstract Instant expiresAt();

  /** True once {@code clock} has reached {@link #expiresAt()}. */
  public boolean isExpired(Clock clock) {
    return !clock.instant().isBefore(expiresAt());
  }

  /** Returns {@link #url()} as a {@link URI}; always valid for a built instance. */
  public URI uri() {
    return URI.create(url());
  }

  /** Returns the URL without its query string. */
  public String redactedUrl() {
    int query = url().indexOf('?');
    return query < 0 ? url() : url().substring(0, query) + "?<redacted>";
  }

  @Override
  public String toString() {
    return String.format("SignedUrl{%s %s, expiresAt=%s}", method(), redactedUrl(), expiresAt());
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static SignedUrl.Builder builder() {
      return new AutoValue_SignedUrl.Builder();
    }

    @JsonProperty("url")
    public abstract SignedUrl.Builder url(String url);

    @JsonProperty("method")
    public abstract SignedUrl.Builder method(Method method);

    @JsonProperty("expiresAt")
    public abstract SignedUrl.Builder expiresAt(Instant expiresAt);

    abstract SignedUrl autoBuild();

    /**
     * Builds the signed URL.
     *
     * @throws IllegalArgumentException if the URL is not an absolute http or https URL
     */
    public SignedUrl build() {
      SignedUrl signedUrl = autoBuild();
      URI uri;
      try {
        uri = new URI(signedUrl.url());
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException(
            "Signed URL " + signedUrl.redactedUrl() + " is not a valid URI", e);
      }
      String scheme = uri.getScheme();
      if (uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        throw new IllegalArgumentException(
            "Signed URL " + signedUrl.redactedUrl() + " is not an absolute http(s) URL");
      }
      return signedUrl;
    }
  }
}
