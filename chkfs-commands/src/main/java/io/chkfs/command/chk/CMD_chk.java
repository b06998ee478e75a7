package io.chkfs.command.chk;

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

import io.chkfs.command.BundledCommand;
import io.chkfs.command.chk.subcommands.CMD_chk_encode;
import io.chkfs.command.chk.subcommands.CMD_chk_parse;
import io.chkfs.command.chk.subcommands.CMD_chk_shape;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;

/// Commands for content hash key encoding.
/// Implementation details are delegated to the subcommand classes.
@Command(name = "chk",
    header = "commands for content hash key trees and locators",
    description = """
        The commands in this section encode files into content hash key trees and print the
        resulting locators. A locator names the root block of a file; identical content always
        yields an identical locator.""",
    subcommands = {
        CMD_chk_encode.class,
        CMD_chk_shape.class,
        CMD_chk_parse.class,
        HelpCommand.class
    })
public class CMD_chk implements BundledCommand {
}
