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

import com.atlasexplorer.shared.clients.configclient.ParameterClient;
import com.atlasexplorer.shared.clients.configclient.local.EnvironmentParameterClient;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 *   atlas-explorer keygen --private-key-out client.json --public-key-out client.pub.json
 *   atlas-explorer submit --workload hello.elf --core P8700 \
 *       --service-public-key service.pub.json --client-private-key client.json --output out.bin
 *   atlas-explorer submit --workload mandelbrot.elf --workload memcpy.elf --core shogun_2t \
 *       --service-public-key service.pub.json --client-private-key client.json
 * </pre>
 */
public final class AtlasExplorerApplication {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_CANCELLED = 130;

  private static final Logger logger = LoggerFactory.getLogger(AtlasExplorerApplication.class);

  private AtlasExplorerApplication() {}

  /** Parses the subcommand and its arguments, runs it and exits with its status. */
  public static void main(String[] args) {
    System.exit(run(args, EnvironmentParameterClient.fromSystemEnvironment()));
  }

  static int run(String[] args, ParameterClient environment) {
    ImmutableMap<String, Command> commands =
        ImmutableMap.of(
            SubmitCommand.NAME, new SubmitCommand(new SubmitArgs(), environment),
            KeygenCommand.NAME, new KeygenCommand(new KeygenArgs()));
    JCommander.Builder builder = JCommander.newBuilder().programName("atlas-explorer");
    commands.forEach((name, command) -> builder.addCommand(name, command.args()));
    JCommander jCommander = builder.build();
    try {
      jCommander.parse(args);
    } catch (ParameterException e) {
      logger.error(e.getMessage());
      jCommander.usage();
      return EXIT_USAGE;
    }
    String parsed = jCommander.getParsedCommand();
    if (parsed == null) {
      jCommander.usage();
      return EXIT_USAGE;
    }
    return commands.get(parsed).run();
  }
}
