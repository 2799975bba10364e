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

import com.atlasexplorer.shared.api.util.AttemptGuard.AttemptAbortedException;
import com.google.common.collect.ImmutableMap;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wrapper class to create HttpClient with interceptor, supporting exponential retry strategy.
 *
 * <p>Every attempt, including the first, is preceded by an {@link AttemptGuard} check so that a
 * cancelled submission or an expired signed URL stops the request before bytes hit the wire. When
 * all attempts return a retryable status code the last response is returned to the caller.
 * Retryable codes are 408, 429 and every 5xx.
 */
public class HttpClientWrapper {

  private static final Logger logger = LoggerFactory.getLogger(HttpClientWrapper.class);

  private static final int DEFAULT_INTERVAL_MILLIS = 2000;

  private static final int DEFAULT_MAX_ATTEMPTS = 5;

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  private static final IntervalFunction DEFAULT_INTERVAL_FUNCTION =
      numOfAttempts -> (long) DEFAULT_INTERVAL_MILLIS;

  private final CloseableHttpClient httpClient;

  private final Retry retryConfig;

  /** Returns a builder for this class. */
  public static HttpClientWrapper.Builder builder() {
    return new HttpClientWrapper.Builder();
  }

  private HttpClientWrapper(CloseableHttpClient httpClient, Retry retryConfig) {
    this.httpClient = httpClient;
    this.retryConfig = retryConfig;
  }

  /**
   * Executes the request, applying the interceptor and the retry strategy. {@code guard} is
   * consulted before each attempt.
   *
   * @throws AttemptAbortedException if the guard refused an attempt; no retry follows
   * @throws IOException if the last attempt failed at the transport level
   */
  public <T extends HttpRequestBase> HttpClientResponse execute(T request, AttemptGuard guard)
      throws IOException, AttemptAbortedException {
    try {
      return Retry.decorateCheckedSupplier(
              retryConfig,
              () -> {
                guard.beforeAttempt();
                return executeRequest(request);
              })
          .apply();
    } catch (AttemptAbortedException | IOException e) {
      throw e;
    } catch (Throwable throwable) {
      throw new IOException(throwable);
    }
  }

  /** Returns true for 408, 429 and every 5xx status, which this client retries on. */
  public static boolean isRetryable(int statusCode) {
    return statusCode == HttpStatus.SC_REQUEST_TIMEOUT
        || statusCode == HttpStatus.SC_TOO_MANY_REQUESTS
        || statusCode >= HttpStatus.SC_INTERNAL_SERVER_ERROR;
  }

  /**
   * Executes the request and reads the response into HttpClientResponse. Reading the response is
   * necessary before retrying to prevent connection leak.
   */
  private <T extends HttpRequestBase> HttpClientResponse executeRequest(T request)
      throws IOException {
    try (CloseableHttpResponse response = httpClient.execute(request)) {
      HttpEntity entity = response.getEntity();
      byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      int statusCode = response.getStatusLine().getStatusCode();
      if (isRetryable(statusCode)) {
        logger.warn(
            "{} {} returned retryable status {}",
            request.getMethod(),
            redact(request),
            statusCode);
      }
      return HttpClientResponse.create(
          statusCode,
          body,
          Stream.of(response.getAllHeaders())
              .collect(
                  ImmutableMap.toImmutableMap(
                      Header::getName, Header::getValue, (first, second) -> first)));
    } catch (IOException e) {
      logger.warn("{} {} failed: {}", request.getMethod(), redact(request), e.toString());
      throw e;
    }
  }

  /** Drops the query string, which carries signed URL credentials. */
  private static String redact(HttpRequestBase request) {
    String uri = request.getURI().toString();
    int query = uri.indexOf('?');
    return query < 0 ? uri : uri.substring(0, query) + "?<redacted>";
  }

  private static HttpClientWrapper createHttpClient(
      Optional<HttpRequestInterceptor> interceptor,
      Optional<IntervalFunction> intervalFunction,
      int maxAttempts) {
    int timeoutMillis = Math.toIntExact(DEFAULT_TIMEOUT.toMillis());
    HttpClientBuilder httpClientBuilder =
        HttpClients.custom()
            .disableAutomaticRetries() // Retries are handled separately.
            .setDefaultRequestConfig(
                RequestConfig.custom()
                    .setConnectTimeout(timeoutMillis)
                    .setConnectionRequestTimeout(timeoutMillis)
                    .setSocketTimeout(timeoutMillis)
                    .build());
    interceptor.ifPresent(
        httpInterceptor -> httpClientBuilder.addInterceptorFirst(httpInterceptor));
    RetryConfig retryConfig =
        RetryConfig.<HttpClientResponse>custom()
            .intervalFunction(intervalFunction.orElse(DEFAULT_INTERVAL_FUNCTION))
            .maxAttempts(maxAttempts)
            .retryExceptions(IOException.class)
            .ignoreExceptions(AttemptAbortedException.class)
            .retryOnResult(response -> isRetryable(response.statusCode()))
            .build();

    return new HttpClientWrapper(
        httpClientBuilder.build(), RetryRegistry.of(retryConfig).retry("httpClient"));
  }

  /** Builder class for {@link HttpClientWrapper} */
  public static class Builder {

    private HttpRequestInterceptor interceptor;

    private IntervalFunction intervalFunction;

    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    /** Sets the interceptor that should be called before every request. */
    public Builder setInterceptor(HttpRequestInterceptor interceptor) {
      this.interceptor = interceptor;
      return this;
    }

    /**
     * Sets jittered exponential backoff intervals capped at {@code maxInterval}.
     *
     * @param randomizationFactor in [0, 1); each interval is spread by this fraction either way
     * @param maxAttempts 1 + retry attempts to make
     */
    public Builder setExponentialRandomBackoff(
        Duration initialInterval,
        double multiplier,
        double randomizationFactor,
        Duration maxInterval,
        int maxAttempts) {
      this.intervalFunction =
          IntervalFunction.ofExponentialRandomBackoff(
              initialInterval, multiplier, randomizationFactor, maxInterval);
      this.maxAttempts = maxAttempts;
      return this;
    }

    public HttpClientWrapper build() {
      return HttpClientWrapper.createHttpClient(
          Optional.ofNullable(interceptor), Optional.ofNullable(intervalFunction), maxAttempts);
    }
  }
}
