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

import io.chkfs.command.chk.PathInputOpener;
import io.chkfs.command.chk.console.SimpleProgressReporter;
import io.chkfs.command.common.ParallelExecutionOption;
import io.chkfs.command.common.VerbosityOption;
import io.chkfs.crypto.ChkRecord;
import io.chkfs.locator.ChkLocator;
import io.chkfs.source.SizedInput;
import io.chkfs.source.SizedInputOpener;
import io.chkfs.tree.ChkTreeEncoder;
import io.chkfs.tree.ChkTreeShape;
import io.chkfs.tree.EncodeProgress;
import io.chkfs.tree.TreeBlockListener;
import io.chkfs.tree.TreeShape;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/// Encodes files into CHK trees and prints one locator per file, in argument order.
///
/// This command supports the following options:
/// - `-p, --parallel` / `--threads`: encode the leaves of each file on a thread pool
/// - `--progress-interval`: seconds between progress log lines, 0 to disable
/// - `--blocks`: log every block as it is produced
/// - `-v, --verbose` / `-q, --quiet`: more or less detail besides the locators
///
/// A file that cannot be read is reported and skipped; the exit code is then 1.
@Command(
    name = "encode",
    description = "Encode files and print their CHK locators"
)
public class CMD_chk_encode implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_chk_encode.class);

    @Parameters(index = "0..*", arity = "1..*", description = "Files to encode")
    private List<Path> files = new ArrayList<>();

    @Option(names = {"--progress-interval"},
        description = "Progress reporting interval in seconds, 0 to disable (default: ${DEFAULT-VALUE})",
        defaultValue = "5")
    private int progressInterval = 5;

    @Option(names = {"--blocks"}, description = "Log every block as it is produced")
    private boolean logBlocks = false;

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final SizedInputOpener<Path> opener;

    /// Creates the command with the local file opener.
    public CMD_chk_encode() {
        this(new PathInputOpener());
    }

    /// @param opener resolves file arguments to sized inputs
    public CMD_chk_encode(SizedInputOpener<Path> opener) {
        this.opener = opener;
    }

    /// Executes the command with the specified options.
    ///
    /// @return 0 if every file was encoded, 1 otherwise
    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        if (progressInterval < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --progress-interval cannot be negative");
        }

        ExecutorService executor = parallelExecutionOption.createExecutor();
        if (executor != null && verbosityOption.showVerbose()) {
            logger.info("Encoding leaves with {} threads", parallelExecutionOption.getThreadCount());
        }
        boolean success = true;
        try {
            for (Path file : files) {
                try {
                    ChkLocator locator = encodeFile(file, executor);
                    System.out.println(locator.format());
                } catch (IOException e) {
                    logger.error("Error encoding {}: {}", file, e.getMessage());
                    success = false;
                } catch (RuntimeException e) {
                    logger.error("Error encoding {}", file, e);
                    success = false;
                }
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
        return success ? 0 : 1;
    }

    /**
     * Encodes one file.
     *
     * @param file the file to encode
     * @param executor the leaf encoding pool, or null to encode on this thread
     * @return the file's locator
     * @throws IOException if the file cannot be opened or read completely
     */
    public ChkLocator encodeFile(Path file, ExecutorService executor) throws IOException {
        try (SizedInput input = opener.open(file)) {
            TreeShape shape = ChkTreeShape.fromContentSize(input.size());
            EncodeProgress progress = new EncodeProgress(shape);
            ChkTreeEncoder encoder = ChkTreeEncoder.builder(shape)
                .progress(progress)
                .listener(blockListener())
                .leafExecutor(executor)
                .build(input.stream());

            ChkRecord root;
            if (progressInterval > 0 && verbosityOption.showNormalOutput()) {
                try (SimpleProgressReporter reporter = new SimpleProgressReporter(file, progressInterval)) {
                    reporter.startReporting(progress);
                    root = encoder.encode();
                }
            } else {
                root = encoder.encode();
            }

            if (verbosityOption.showVerbose()) {
                logger.info("File: {} - Size: {} bytes, Depth: {}, Leaves: {}, Blocks: {}",
                    file, input.size(), shape.getDepth(), shape.getLeafCount(), progress.getProcessedBlocks());
            }
            return ChkLocator.of(root);
        }
    }

    private TreeBlockListener blockListener() {
        if (!logBlocks) {
            return TreeBlockListener.NONE;
        }
        return block -> logger.info("{}", block);
    }
}
