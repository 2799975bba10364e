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

package com.atlasexplorer.shared.clients.configclient;

import com.atlasexplorer.shared.clients.configclient.model.ClientParameter;
import com.atlasexplorer.shared.clients.configclient.model.ErrorReason;
import java.util.Optional;

/** Interface for fetching parameters. */
public interface ParameterClient {

  /**
   * Blocking call to get a parameter.
   *
   * @throws ParameterClientException if an error occurred while attempting to read the parameter
   * @return an {@link Optional} of {@link String} for parameter value
   */
  Optional<String> getParameter(String param) throws ParameterClientException;

  /** Blocking call to get a {@link ClientParameter}. */
  default Optional<String> getParameter(ClientParameter param) throws ParameterClientException {
    return getParameter(param.name());
  }

  /**
   * Returns the value of {@code param}.
   *
   * @throws ParameterClientException with {@link ErrorReason#MISSING_REQUIRED_PARAMETER} if the
   *     parameter is absent or blank
   */
  default String getRequiredParameter(ClientParameter param) throws ParameterClientException {
    Optional<String> value = getParameter(param).filter(v -> !v.isBlank());
    if (value.isEmpty()) {
      throw new ParameterClientException(
          "Missing required parameter " + param, ErrorReason.MISSING_REQUIRED_PARAMETER);
    }
    return value.get();
  }

  /**
   * Returns {@code param} parsed as a long, or {@code defaultValue} when it is absent.
   *
   * @throws ParameterClientException with {@link ErrorReason#INVALID_PARAMETER} if the value is
   *     not a positive integer
   */
  default long getLongParameter(ClientParameter param, long defaultValue)
      throws ParameterClientException {
    Optional<String> value = getParameter(param).filter(v -> !v.isBlank());
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.get().trim());
      if (parsed <= 0) {
        throw new ParameterClientException(
            param + " must be positive, got " + parsed, ErrorReason.INVALID_PARAMETER);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new ParameterClientException(
          param + " is not a number", ErrorReason.INVALID_PARAMETER, e);
    }
  }

  /**
   * Blocking call to get the environment name.
   *
   * @return an {@link Optional} of {@link String} for environment name
   */
  Optional<String> getEnvironmentName() throws ParameterClientException;

  /** Represents an exception thrown by the {@code ParameterClient} class. */
  final class ParameterClientException extends Exception {
    private final ErrorReason reason;

    /** Creates a new instance from a reason and a {@code Throwable}. */
    public ParameterClientException(ErrorReason reason, Throwable cause) {
      super(cause);
      this.reason = reason;
    }

    /** Creates a new instance from a message String and a reason. */
    public ParameterClientException(String message, ErrorReason reason) {
      super(message);
      this.reason = reason;
    }

    /** Constructs a new exception with the specified detail message, reason, and cause. */
    public ParameterClientException(String message, ErrorReason reason, Throwable cause) {
      super(message, cause);
      this.reason = reason;
    }

    /** Returns the {@link ErrorReason} for the exception. */
    public ErrorReason getReason() {
      return reason;
    }

    /** Returns a String representation of the error. */
    @Override
    public String toString() {
      return String.format("%s (Error reason: %s)", super.toString(), reason);
    }
  }
}
