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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.atlasexplorer.shared.api.util.AttemptGuard.AttemptAbortedException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.http.HttpException;
import org.apache.http.HttpRequest;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.protocol.HttpContext;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HttpClientWrapperTest {

  private static final Duration FAST_INTERVAL = Duration.ofMillis(10);

  private HttpServer server;
  private TestHandler testHandler;
  private boolean serverStopped;

  @Before
  public void setUp() throws IOException {
    testHandler = new TestHandler();
    // Picks a random available port.
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/test", testHandler);
    server.start();
  }

  @After
  public void tearDown() {
    stopServer();
  }

  @Test
  public void execute_succeeds() throws Exception {
    HttpClientWrapper httpClient = HttpClientWrapper.builder().build();
    testHandler.respondWith(200);

    HttpClientResponse actualResponse = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(actualResponse.statusCode()).isEqualTo(200);
    assertThat(actualResponse.bodyAsString()).isEqualTo("body-1");
    assertThat(actualResponse.isSuccessful()).isTrue();
  }

  @Test
  public void execute_withRetriableCode_retries() throws Exception {
    int maxAttempts = 3;
    HttpClientWrapper httpClient = fastRetries(maxAttempts).build();
    testHandler.respondWith(503);

    HttpClientResponse actualResponse = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(testHandler.calledCount.get()).isEqualTo(maxAttempts);
    assertThat(actualResponse.statusCode()).isEqualTo(503);
  }

  @Test
  public void execute_withNonRetriableCode_noRetries() throws Exception {
    HttpClientWrapper httpClient = fastRetries(3).build();
    testHandler.respondWith(403);

    HttpClientResponse actualResponse = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(testHandler.calledCount.get()).isEqualTo(1);
    assertThat(actualResponse.statusCode()).isEqualTo(403);
  }

  @Test
  public void execute_retriesUntilSuccess() throws Exception {
    HttpClientWrapper httpClient = fastRetries(5).build();
    testHandler.respondWith(500, 503, 200, 500);

    HttpClientResponse response = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.bodyAsString()).isEqualTo("body-3");
    assertThat(testHandler.calledCount.get()).isEqualTo(3);
  }

  @Test
  public void execute_withExponentialRandomBackoff_stopsAtMaxAttempts() throws Exception {
    int maxAttempts = 4;
    HttpClientWrapper httpClient =
        HttpClientWrapper.builder()
            .setExponentialRandomBackoff(
                Duration.ofMillis(5), 2.0, 0.5, Duration.ofMillis(20), maxAttempts)
            .build();
    testHandler.respondWith(429);

    HttpClientResponse response = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(response.statusCode()).isEqualTo(429);
    assertThat(testHandler.calledCount.get()).isEqualTo(maxAttempts);
  }

  @Test
  public void execute_withUnreachableServer_throwsIOException() {
    HttpClientWrapper httpClient = fastRetries(2).build();
    URI uri = uri();
    stopServer();

    assertThrows(IOException.class, () -> httpClient.execute(new HttpGet(uri), AttemptGuard.NONE));
  }

  @Test
  public void execute_withInterceptor_withRetriableCode_interceptorCalledWithRetry()
      throws Exception {
    TestInterceptor interceptor = new TestInterceptor();
    HttpClientWrapper httpClient = fastRetries(5).setInterceptor(interceptor).build();
    testHandler.respondWith(503);

    httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(interceptor.interceptorCallCount).isEqualTo(5);
  }

  @Test
  public void execute_guardRefusesFirstAttempt_sendsNothing() {
    HttpClientWrapper httpClient = fastRetries(5).build();
    testHandler.respondWith(200);

    assertThrows(
        AttemptAbortedException.class,
        () ->
            httpClient.execute(
                new HttpGet(uri()),
                () -> {
                  throw new AttemptAbortedException("no");
                }));
    assertThat(testHandler.calledCount.get()).isEqualTo(0);
  }

  @Test
  public void execute_guardRefusesRetry_stopsRetrying() {
    HttpClientWrapper httpClient = fastRetries(5).build();
    testHandler.respondWith(503);
    AtomicInteger guardCalls = new AtomicInteger();

    assertThrows(
        AttemptAbortedException.class,
        () ->
            httpClient.execute(
                new HttpGet(uri()),
                () -> {
                  if (guardCalls.incrementAndGet() > 2) {
                    throw new AttemptAbortedException("stop");
                  }
                }));
    assertThat(testHandler.calledCount.get()).isEqualTo(2);
  }

  @Test
  public void execute_withUncommonServerError_retries() throws Exception {
    HttpClientWrapper httpClient = fastRetries(3).build();
    testHandler.respondWith(507, 200);

    HttpClientResponse response = httpClient.execute(new HttpGet(uri()), AttemptGuard.NONE);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(testHandler.calledCount.get()).isEqualTo(2);
  }

  @Test
  public void isRetryable_coversTimeoutsThrottlingAndServerErrors() {
    for (int statusCode : new int[] {408, 429, 500, 501, 503, 505, 507, 511}) {
      assertThat(HttpClientWrapper.isRetryable(statusCode)).isTrue();
    }
    for (int statusCode : new int[] {200, 204, 400, 401, 403, 404, 409, 499}) {
      assertThat(HttpClientWrapper.isRetryable(statusCode)).isFalse();
    }
  }

  private static HttpClientWrapper.Builder fastRetries(int maxAttempts) {
    return HttpClientWrapper.builder()
        .setExponentialRandomBackoff(FAST_INTERVAL, 1.0, 0.0, FAST_INTERVAL, maxAttempts);
  }

  private void stopServer() {
    if (!serverStopped) {
      server.stop(0);
      serverStopped = true;
    }
  }

  private URI uri() {
    return URI.create("http://localhost:" + server.getAddress().getPort() + "/test?sig=secret");
  }

  /** A test interceptor to be called before http request is made by the client. */
  private static class TestInterceptor implements HttpRequestInterceptor {
    private int interceptorCallCount = 0;

    @Override
    public void process(HttpRequest request, HttpContext context)
        throws HttpException, IOException {
      interceptorCallCount++;
    }
  }

  /** Sends the scripted status codes in order, repeating the last one. */
  private static class TestHandler implements HttpHandler {
    private final AtomicInteger calledCount = new AtomicInteger();
    private volatile int[] statusCodes = {200};

    void respondWith(int... statusCodes) {
      this.statusCodes = statusCodes;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
      int call = calledCount.incrementAndGet();
      int statusCode = statusCodes[Math.min(call, statusCodes.length) - 1];
      byte[] body = ("body-" + call).getBytes(UTF_8);
      exchange.sendResponseHeaders(statusCode, body.length);
      try (OutputStream responseBody = exchange.getResponseBody()) {
        responseBody.write(body);
      }
    }
  }
}
