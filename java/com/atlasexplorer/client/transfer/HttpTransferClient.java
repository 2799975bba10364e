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

import com.atlasexplorer.client.Annotations.StorageHttpClient;
import com.atlasexplorer.client.transfer.model.ErrorReason;
import com.atlasexplorer.shared.api.util.AttemptGuard;
import com.atlasexplorer.shared.api.util.AttemptGuard.AttemptAbortedException;
import com.atlasexplorer.shared.api.util.HttpClientResponse;
import com.atlasexplorer.shared.api.util.HttpClientWrapper;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;
import com.google.inject.Inject;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransferClient} over plain HTTP.
 *
 * <p>Retries and backoff come from the injected {@link HttpClientWrapper}. Before every attempt the
 * cancellation and the URL expiry are checked, so an expired URL is never sent.
 */
public final class HttpTransferClient implements TransferClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpTransferClient.class);

  private final HttpClientWrapper httpClient;
  private final Clock clock;

  @Inject
  public HttpTransferClient(@StorageHttpClient HttpClientWrapper httpClient, Clock clock) {
    this.httpClient = httpClient;
    this.clock = clock;
  }

  @Override
  public void upload(SignedUrl url, byte[] payload, Cancellation cancellation)
      throws TransferException, CancelledException {
    requireMethod(url, SignedUrl.Method.PUT);
    HttpPut request = new HttpPut(url.uri());
    request.setEntity(new ByteArrayEntity(payload, ContentType.APPLICATION_OCTET_STREAM));
    execute(url, request, cancellation);
    logger.info("Uploaded {} bytes to {}", payload.length, url);
  }

  @Override
  public byte[] download(SignedUrl url, Cancellation cancellation)
      throws TransferException, CancelledException {
    requireMethod(url, SignedUrl.Method.GET);
    byte[] body = execute(url, new HttpGet(url.uri()), cancellation).responseBody();
    logger.info("Downloaded {} bytes from {}", body.length, url);
    return body;
  }

  private HttpClientResponse execute(
      SignedUrl url, HttpRequestBase request, Cancellation cancellation)
      throws TransferException, CancelledException {
    AttemptGuard guard =
        () -> {
          if (cancellation.isCancelled()) {
            throw new AttemptAbortedException("Transfer cancelled");
          }
          if (url.isExpired(clock)) {
            throw new AttemptAbortedException("Signed URL expired at " + url.expiresAt());
          }
        };
    HttpClientResponse response;
    try {
      response = httpClient.execute(request, guard);
    } catch (AttemptAbortedException e) {
      cancellation.throwIfCancelled();
      throw new TransferException(
          "Signed URL " + url + " expired before the transfer completed",
          ErrorReason.URL_EXPIRED);
    } catch (IOException e) {
      throw new TransferException("Transfer to " + url + " failed", ErrorReason.NETWORK_ERROR, e);
    }
    if (response.isSuccessful()) {
      return response;
    }
    int status = response.statusCode();
    if (HttpClientWrapper.isRetryable(status)) {
      throw new TransferException(
          String.format("Transfer to %s still failing with status %d after retries", url, status),
          ErrorReason.RETRIES_EXHAUSTED,
          Optional.of(status));
    }
    throw new TransferException(
        String.format("Transfer to %s rejected with status %d", url, status),
        ErrorReason.CLIENT_ERROR,
        Optional.of(status));
  }

  private static void requireMethod(SignedUrl url, SignedUrl.Method expected)
      throws TransferException {
    if (url.method() != expected) {
      throw new TransferException(
          String.format("Signed URL %s was issued for %s, not %s", url, url.method(), expected),
          ErrorReason.WRONG_METHOD);
    }
  }
}
