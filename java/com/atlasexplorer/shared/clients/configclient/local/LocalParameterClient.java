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

package com.atlasexplorer.shared.clients.configclient.local;

import com.atlasexplorer.shared.clients.configclient.ParameterClient;
import com.atlasexplorer.shared.clients.configclient.local.Annotations.ParameterValues;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import java.util.Optional;

/**
 * Parameter client implementation for getting parameters from cli args. This helps with running the
 * code locally and in tests without touching the process environment.
 */
public final class LocalParameterClient implements ParameterClient {

  private final ImmutableMap<String, String> parameterValues;

  /** Creates a new instance of the {@code LocalParameterClient} class. */
  @Inject
  public LocalParameterClient(@ParameterValues ImmutableMap<String, String> parameterValues) {
    this.parameterValues = parameterValues;
  }

  /**
   * Gets a parameter from the local flags.
   *
   * <p>The raw parameter name will be used to query the parameter mapping, with no prefixes or
   * environments added.
   *
   * @return an {@link Optional} of {@link String} for parameter value
   */
  @Override
  public Optional<String> getParameter(String param) {
    return Optional.ofNullable(parameterValues.get(param));
  }

  @Override
  public Optional<String> getEnvironmentName() {
    return Optional.of("local");
  }
}
