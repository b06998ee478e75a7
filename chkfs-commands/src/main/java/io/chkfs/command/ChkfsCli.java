package io.chkfs.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Content hash key tools
///
/// This is the top level command; its subcommands are loaded from the bundled command services.
@CommandLine.Command(name = "chkfs",
    mixinStandardHelpOptions = true,
    version = "chkfs 0.1.0",
    subcommands = {CommandLine.HelpCommand.class},
    modelTransformer = AddBundledCommands.class)
public class ChkfsCli {
  private static final Logger logger = LogManager.getLogger(ChkfsCli.class);

  /// Builds the command line with all bundled commands attached.
  /// @return a ready to execute command line
  public static CommandLine commandLine() {
    return new CommandLine(new ChkfsCli())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true)
        .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
          logger.error("{} failed: {}", cmd.getCommandName(), ex.getMessage(), ex);
          return 1;
        });
  }

  /// run a chkfs command
  /// @param args
  ///     command line args
  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }
}
