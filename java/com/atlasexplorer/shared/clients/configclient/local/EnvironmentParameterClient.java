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
import com.atlasexplorer.shared.clients.configclient.local.Annotations.EnvironmentVariables;
import com.atlasexplorer.shared.clients.configclient.model.ClientParameter;
import com.atlasexplorer.shared.clients.configclient.model.ErrorReason;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import java.util.List;
import java.util.Optional;

/**
 * Parameter client reading {@code ATLAS_EXPLORER_<PARAM>} environment variables.
 *
 * <p>The combined {@code MIPS_ATLAS_CONFIG=apikey:channel:region} variable is honoured as a
 * fallback for {@link ClientParameter#API_KEY}, {@link ClientParameter#CHANNEL} and {@link
 * ClientParameter#REGION}. A dedicated variable always wins over the combined one.
 */
public final class EnvironmentParameterClient implements ParameterClient {

  static final String PREFIX = "ATLAS_EXPLORER_";
  static final String LEGACY_CONFIG_VARIABLE = "MIPS_ATLAS_CONFIG";

  private final ImmutableMap<String, String> environment;

  @Inject
  public EnvironmentParameterClient(
      @EnvironmentVariables ImmutableMap<String, String> environment) {
    this.environment = environment;
  }

  /** Returns a client over the current process environment. */
  public static EnvironmentParameterClient fromSystemEnvironment() {
    return new EnvironmentParameterClient(ImmutableMap.copyOf(System.getenv()));
  }

  @Override
  public Optional<String> getParameter(String param) throws ParameterClientException {
    Optional<String> direct = Optional.ofNullable(environment.get(PREFIX + param));
    if (direct.isPresent()) {
      return direct;
    }
    return legacyValue(param);
  }

  @Override
  public Optional<String> getEnvironmentName() {
    return Optional.ofNullable(environment.get(PREFIX + "ENVIRONMENT"));
  }

  private Optional<String> legacyValue(String param) throws ParameterClientException {
    int index;
    if (param.equals(ClientParameter.API_KEY.name())) {
      index = 0;
    } else if (param.equals(ClientParameter.CHANNEL.name())) {
      index = 1;
    } else if (param.equals(ClientParameter.REGION.name())) {
      index = 2;
    } else {
      return Optional.empty();
    }
    String legacy = environment.get(LEGACY_CONFIG_VARIABLE);
    if (legacy == null) {
      return Optional.empty();
    }
    List<String> parts = Splitter.on(':').trimResults().splitToList(legacy);
    if (parts.size() != 3) {
      throw new ParameterClientException(
          LEGACY_CONFIG_VARIABLE + " must have the form apikey:channel:region",
          ErrorReason.INVALID_PARAMETER);
    }
    return Optional.of(parts.get(index)).filter(v -> !v.isEmpty());
  }
}
