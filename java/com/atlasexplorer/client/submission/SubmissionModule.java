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

import com.atlasexplorer.client.Annotations.JitterRandom;
import com.atlasexplorer.client.Annotations.ServiceBaseUrl;
import com.atlasexplorer.client.Annotations.ServiceHttpClient;
import com.atlasexplorer.client.Annotations.StorageHttpClient;
import com.atlasexplorer.client.crypto.KeyUnwrapper;
import com.atlasexplorer.client.envelope.KdfParams;
import com.atlasexplorer.client.poller.PollerConfig;
import com.atlasexplorer.client.poller.Sleeper;
import com.atlasexplorer.client.poller.SystemSleeper;
import com.atlasexplorer.client.service.ApiKeyInterceptor;
import com.atlasexplorer.client.service.ExperimentServiceClient;
import com.atlasexplorer.client.service.HttpExperimentServiceClient;
import com.atlasexplorer.client.transfer.HttpTransferClient;
import com.atlasexplorer.client.transfer.TransferClient;
import com.atlasexplorer.shared.api.util.HttpClientWrapper;
import com.atlasexplorer.shared.clients.configclient.ParameterClient;
import com.atlasexplorer.shared.clients.configclient.ParameterClient.ParameterClientException;
import com.atlasexplorer.shared.clients.configclient.model.ClientParameter;
import com.atlasexplorer.shared.clients.configclient.model.ErrorReason;
import com.google.common.base.CharMatcher;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the submission pipeline from a {@link ParameterClient}. Requires bindings for {@link
 * ParameterClient} and for the {@link KeyUnwrapper} that opens this client's results.
 */
public final class SubmissionModule extends AbstractModule {

  private static final int DEFAULT_TRANSFER_MAX_ATTEMPTS = 5;
  private static final int MAX_TRANSFER_ATTEMPTS = 100;
  private static final Duration TRANSFER_INITIAL_BACKOFF = Duration.ofMillis(500);
  private static final Duration TRANSFER_MAX_BACKOFF = Duration.ofSeconds(10);
  private static final double TRANSFER_BACKOFF_MULTIPLIER = 2.0;
  private static final double TRANSFER_BACKOFF_JITTER = 0.5;

  @Override
  protected void configure() {
    bind(TransferClient.class).to(HttpTransferClient.class);
    bind(ExperimentServiceClient.class).to(HttpExperimentServiceClient.class);
    bind(Sleeper.class).to(SystemSleeper.class);
  }

  @Provides
  @Singleton
  Clock provideClock() {
    return Clock.systemUTC();
  }

  @Provides
  SecureRandom provideSecureRandom() {
    return new SecureRandom();
  }

  @Provides
  @JitterRandom
  Random provideJitterRandom() {
    return new Random();
  }

  @Provides
  KdfParams provideKdfParams() {
    return KdfParams.DEFAULT;
  }

  @Provides
  @Singleton
  @ServiceBaseUrl
  String provideServiceBaseUrl(ParameterClient parameterClient) throws ParameterClientException {
    String gatewayUrl =
        CharMatcher.is('/')
            .trimTrailingFrom(parameterClient.getRequiredParameter(ClientParameter.GATEWAY_URL));
    URI uri;
    try {
      uri = new URI(gatewayUrl);
    } catch (URISyntaxException e) {
      throw new ParameterClientException(
          ClientParameter.GATEWAY_URL + " is not a valid URL", ErrorReason.INVALID_PARAMETER, e);
    }
    if (uri.getHost() == null || uri.getRawQuery() != null) {
      throw new ParameterClientException(
          ClientParameter.GATEWAY_URL + " must be an absolute URL without a query",
          ErrorReason.INVALID_PARAMETER);
    }
    return gatewayUrl;
  }

  @Provides
  @Singleton
  @ServiceHttpClient
  HttpClientWrapper provideServiceHttpClient(ParameterClient parameterClient)
      throws ParameterClientException {
    return transferRetryPolicy(parameterClient)
        .setInterceptor(
            new ApiKeyInterceptor(parameterClient.getRequiredParameter(ClientParameter.API_KEY)))
        .build();
  }

  @Provides
  @Singleton
  @StorageHttpClient
  HttpClientWrapper provideStorageHttpClient(ParameterClient parameterClient)
      throws ParameterClientException {
    return transferRetryPolicy(parameterClient).build();
  }

  @Provides
  @Singleton
  PollerConfig providePollerConfig(ParameterClient parameterClient)
      throws ParameterClientException {
    long maxWaitSeconds =
        parameterClient.getLongParameter(
            ClientParameter.POLL_MAX_WAIT_SECONDS, PollerConfig.DEFAULT_MAX_WAIT.toSeconds());
    long initialIntervalMillis =
        parameterClient.getLongParameter(
            ClientParameter.POLL_INITIAL_INTERVAL_MILLIS,
            PollerConfig.DEFAULT_INITIAL_INTERVAL.toMillis());
    long maxIntervalMillis =
        parameterClient.getLongParameter(
            ClientParameter.POLL_MAX_INTERVAL_MILLIS, PollerConfig.DEFAULT_MAX_INTERVAL.toMillis());
    return PollerConfig.builder()
        .setMaxWait(Duration.ofSeconds(maxWaitSeconds))
        .setInitialInterval(Duration.ofMillis(initialIntervalMillis))
        .setMaxInterval(Duration.ofMillis(Math.max(maxIntervalMillis, initialIntervalMillis)))
        .build();
  }

  @Provides
  @Singleton
  SubmissionConfig provideSubmissionConfig(
      ParameterClient parameterClient, KeyUnwrapper resultKey) throws ParameterClientException {
    return SubmissionConfig.builder()
        .setChannel(parameterClient.getRequiredParameter(ClientParameter.CHANNEL))
        .setRegion(parameterClient.getRequiredParameter(ClientParameter.REGION))
        .setResultKey(resultKey)
        .setWorkingDirectory(
            parameterClient
                .getParameter(ClientParameter.WORKING_DIRECTORY)
                .filter(v -> !v.isBlank())
                .map(Path::of))
        .build();
  }

  private static HttpClientWrapper.Builder transferRetryPolicy(ParameterClient parameterClient)
      throws ParameterClientException {
    long maxAttempts =
        parameterClient.getLongParameter(
            ClientParameter.TRANSFER_MAX_ATTEMPTS, DEFAULT_TRANSFER_MAX_ATTEMPTS);
    if (maxAttempts < 1 || maxAttempts > MAX_TRANSFER_ATTEMPTS) {
      throw new ParameterClientException(
          String.format(
              "%s must be between 1 and %d, got %d",
              ClientParameter.TRANSFER_MAX_ATTEMPTS, MAX_TRANSFER_ATTEMPTS, maxAttempts),
          ErrorReason.INVALID_PARAMETER);
    }
    return HttpClientWrapper.builder()
        .setExponentialRandomBackoff(
            TRANSFER_INITIAL_BACKOFF,
            TRANSFER_BACKOFF_MULTIPLIER,
            TRANSFER_BACKOFF_JITTER,
            TRANSFER_MAX_BACKOFF,
            Math.toIntExact(maxAttempts));
  }
}
