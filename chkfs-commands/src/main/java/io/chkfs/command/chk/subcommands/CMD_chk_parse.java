package io.chkfs.command.chk.subcommands;

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

import io.chkfs.encoding.Base32Encoding;
import io.chkfs.locator.ChkLocator;
import io.chkfs.locator.MalformedLocatorException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/// Validates a locator and prints its fields.
@Command(
    name = "parse",
    description = "Validate a CHK locator and print its fields"
)
public class CMD_chk_parse implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_chk_parse.class);

    @Parameters(index = "0", description = "The locator to parse")
    private String locator;

    @Override
    public Integer call() {
        ChkLocator parsed;
        try {
            parsed = ChkLocator.parse(locator.trim());
        } catch (MalformedLocatorException e) {
            logger.error("Malformed locator: {}", e.getMessage());
            return 1;
        }
        System.out.println("key:     " + Base32Encoding.encode(parsed.key().bytes()));
        System.out.println("address: " + Base32Encoding.encode(parsed.address().bytes()));
        System.out.println("size:    " + parsed.fileSize());
        return 0;
    }
}
