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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Shared `-p/--parallel` and `--threads` options for commands that can spread leaf encoding
/// over several threads.
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Encode leaves in parallel, using all but one of the available cores"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of leaf encoding threads (implies --parallel)"
    )
    private Integer explicitThreads;

    /// @return true if leaves should be encoded on a thread pool
    public boolean isEffectivelyParallel() {
        return parallel || explicitThreads != null;
    }

    /// Calculates the thread count. Auto detection always leaves one core free.
    /// @return the number of threads, 1 when running sequentially
    public int getThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        }
        if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }

    /// Creates the leaf encoding pool.
    /// @return a pool of daemon threads, or null when running sequentially
    public ExecutorService createExecutor() {
        if (!isEffectivelyParallel()) {
            return null;
        }
        return Executors.newFixedThreadPool(getThreadCount(), runnable -> {
            Thread thread = new Thread(runnable, "chk-leaf-encoder");
            thread.setDaemon(true);
            return thread;
        });
    }
}
