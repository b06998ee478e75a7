package io.chkfs.command.common;

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

/// Shared `-v/--verbose` and `-q/--quiet` flags.
///
/// Quiet suppresses everything on standard output except results; verbose adds per file detail.
public class VerbosityOption {

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Print per file detail")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Print results only")
    private boolean quiet = false;

    /// @return true if verbose output was requested and not overridden by quiet
    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /// @return true unless quiet output was requested
    public boolean showNormalOutput() {
        return !quiet;
    }

    /// @throws IllegalStateException if both flags are set
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }
}
