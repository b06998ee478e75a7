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

import picocli.CommandLine;

import java.util.ServiceLoader;
import java.util.Set;

/// Adds every {@link BundledCommand} service to the root command as a subcommand, named by its
/// {@link CommandLine.Command#name()}.
public class AddBundledCommands implements CommandLine.IModelTransformer {
  @Override
  public CommandLine.Model.CommandSpec transform(CommandLine.Model.CommandSpec commandSpec) {
    Set<String> registered = commandSpec.subcommands().keySet();
    for (ServiceLoader.Provider<BundledCommand> provider : ServiceLoader.load(BundledCommand.class).stream().toList()) {
      Class<? extends BundledCommand> type = provider.type();
      CommandLine.Command command = type.getAnnotation(CommandLine.Command.class);
      if (command == null) {
        continue;
      }
      if (registered.contains(command.name())) {
        throw new IllegalStateException("Command '" + command.name() + "' from " + type.getName()
                                        + " is already registered");
      }
      commandSpec.addSubcommand(command.name(), new CommandLine(type));
    }
    return commandSpec;
  }
}
