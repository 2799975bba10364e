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

package com.atlasexplorer.app;

import com.atlasexplorer.client.crypto.KeyUnwrapper;
import com.atlasexplorer.client.submission.SubmissionModule;
import com.atlasexplorer.shared.clients.configclient.ParameterClient;
import com.atlasexplorer.shared.clients.configclient.ParameterClient.ParameterClientException;
import com.atlasexplorer.shared.clients.configclient.local.LocalParameterClient;
import com.atlasexplorer.shared.clients.configclient.model.ClientParameter;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.Optional;

/** Module for the {@code submit} command. Flags take precedence over the environment. */
final class AtlasExplorerModule extends AbstractModule {

  private final SubmitArgs args;
  private final ParameterClient environment;
  private final KeyUnwrapper resultKey;

  AtlasExplorerModule(SubmitArgs args, ParameterClient environment, KeyUnwrapper resultKey) {
    this.args = args;
    this.environment = environment;
    this.resultKey = resultKey;
  }

  @Override
  protected void configure() {
    bind(KeyUnwrapper.class).toInstance(resultKey);
    install(new SubmissionModule());
  }

  @Provides
  @Singleton
  ParameterClient provideParameterClient() throws ParameterClientException {
    ImmutableMap<ClientParameter, String> flags =
        ImmutableMap.of(
            ClientParameter.GATEWAY_URL, args.getGatewayUrl(),
            ClientParameter.CHANNEL, args.getChannel(),
            ClientParameter.REGION, args.getRegion(),
            ClientParameter.WORKING_DIRECTORY, args.getWorkingDirectory());
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (ClientParameter param : ClientParameter.values()) {
      Optional<String> value =
          Optional.ofNullable(flags.get(param)).filter(flag -> !flag.isEmpty());
      if (value.isEmpty()) {
        value = environment.getParameter(param);
      }
      value.ifPresent(v -> values.put(param.name(), v));
    }
    return new LocalParameterClient(values.build());
  }
}
