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

import com.atlasexplorer.client.Annotations.ServiceBaseUrl;
import com.atlasexplorer.client.Annotations.ServiceHttpClient;
import com.atlasexplorer.client.service.model.CreateJobRequest;
import com.atlasexplorer.client.service.model.CreateJobResponse;
import com.atlasexplorer.client.service.model.ErrorReason;
import com.atlasexplorer.client.service.model.JobStatusResponse;
import com.atlasexplorer.shared.api.util.AttemptGuard;
import com.atlasexplorer.shared.api.util.AttemptGuard.AttemptAbortedException;
import com.atlasexplorer.shared.api.util.HttpClientResponse;
import com.atlasexplorer.shared.api.util.HttpClientWrapper;
import com.atlasexplorer.shared.mapper.TimeObjectMapper;
import com.atlasexplorer.shared.util.Cancellation;
import com.atlasexplorer.shared.util.CancelledException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.UrlEscapers;
import com.google.inject.Inject;
import java.io.IOException;
import java.net.URI;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Class responsible for making JSON requests to the experiment service. */
public final class HttpExperimentServiceClient implements ExperimentServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpExperimentServiceClient.class);

  private static final String EXPERIMENTS_PATH = "/experiments";

  private static final ObjectMapper mapper = new TimeObjectMapper();

  private final HttpClientWrapper httpClient;
  private final String baseUrl;

  @Inject
  public HttpExperimentServiceClient(
      @ServiceHttpClient HttpClientWrapper httpClient, @ServiceBaseUrl String baseUrl) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl;
  }

  @Override
  public CreateJobResponse createJob(CreateJobRequest request, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException {
    HttpPost post = new HttpPost(URI.create(baseUrl + EXPERIMENTS_PATH));
    post.setEntity(new StringEntity(toJson(request), ContentType.APPLICATION_JSON));
    HttpClientResponse response = execute(post, cancellation);
    CreateJobResponse created = parse(response, CreateJobResponse.class);
    logger.info(
        "Created job {} for submission {} on {}",
        created.jobId(),
        request.submissionId(),
        request.targetCore());
    return created;
  }

  @Override
  public void startJob(String jobId, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException {
    HttpPost post = new HttpPost(URI.create(jobUrl(jobId) + ":start"));
    post.setEntity(new StringEntity("{}", ContentType.APPLICATION_JSON));
    execute(post, cancellation);
    logger.info("Started job {}", jobId);
  }

  @Override
  public JobStatusResponse getStatus(String jobId, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException {
    HttpClientResponse response =
        execute(new HttpGet(URI.create(jobUrl(jobId) + "/status")), cancellation);
    JobStatusResponse status = parse(response, JobStatusResponse.class);
    if (!status.jobId().equals(jobId)) {
      throw new ExperimentServiceException(
          String.format("Asked for the status of job %s but got job %s", jobId, status.jobId()),
          ErrorReason.MALFORMED_RESPONSE);
    }
    logger.debug("Job {} reports state {}", jobId, status.state());
    return status;
  }

  private String jobUrl(String jobId) {
    return baseUrl + EXPERIMENTS_PATH + "/" + UrlEscapers.urlPathSegmentEscaper().escape(jobId);
  }

  private HttpClientResponse execute(HttpRequestBase request, Cancellation cancellation)
      throws ExperimentServiceException, CancelledException {
    AttemptGuard guard =
        () -> {
          if (cancellation.isCancelled()) {
            throw new AttemptAbortedException("Service call cancelled");
          }
        };
    HttpClientResponse response;
    try {
      response = httpClient.execute(request, guard);
    } catch (AttemptAbortedException e) {
      cancellation.throwIfCancelled();
      throw new CancelledException("Service call cancelled", e);
    } catch (IOException e) {
      throw new ExperimentServiceException(
          "Error performing service call " + request.getMethod() + " " + request.getURI(),
          ErrorReason.UNAVAILABLE,
          e);
    }
    int statusCode = response.statusCode();
    if (response.isSuccessful()) {
      return response;
    }
    String message =
        String.format(
            "%s %s returned status %d: %s",
            request.getMethod(), request.getURI(), statusCode, response.bodyAsString());
    if (statusCode == HttpStatus.SC_UNAUTHORIZED || statusCode == HttpStatus.SC_FORBIDDEN) {
      throw new ExperimentServiceException(message, ErrorReason.UNAUTHENTICATED);
    }
    if (HttpClientWrapper.isRetryable(statusCode)) {
      throw new ExperimentServiceException(message, ErrorReason.UNAVAILABLE);
    }
    throw new ExperimentServiceException(message, ErrorReason.REJECTED);
  }

  private static String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize " + value, e);
    }
  }

  private static <T> T parse(HttpClientResponse response, Class<T> type)
      throws ExperimentServiceException {
    try {
      return mapper.readValue(response.responseBody(), type);
    } catch (IOException | IllegalArgumentException | IllegalStateException e) {
      throw new ExperimentServiceException(
          "Serialization error reading " + type.getSimpleName(),
          ErrorReason.MALFORMED_RESPONSE,
          e);
    }
  }
}
