package io.chkfs.command.chk.console;

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

import io.chkfs.tree.EncodeProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Logs encoding progress at a fixed interval.
 *
 * A daemon thread polls an {@link EncodeProgress} until its future is done. Closing the reporter
 * stops the thread and logs the final rate and the performance metrics.
 */
public class SimpleProgressReporter implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SimpleProgressReporter.class);

    private final Path filePath;
    private final int reportingIntervalSeconds;
    private final long startTime;
    private volatile boolean shutdown = false;
    private Thread reportingThread;
    private EncodeProgress progress;

    /**
     * Creates a new progress reporter.
     *
     * @param filePath The path of the file being encoded
     * @param reportingIntervalSeconds The interval in seconds between progress reports, at least 1
     */
    public SimpleProgressReporter(Path filePath, int reportingIntervalSeconds) {
        this.filePath = filePath;
        this.reportingIntervalSeconds = Math.max(1, reportingIntervalSeconds);
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the reporting thread.
     *
     * @param progress The progress object to monitor
     */
    public void startReporting(EncodeProgress progress) {
        if (reportingThread != null) {
            return;
        }
        this.progress = progress;
        logger.info("Encoding {} ({} bytes, {} blocks)", filePath, progress.getTotalBytes(), progress.getTotalBlocks());

        reportingThread = new Thread(() -> {
            try {
                while (!shutdown && !progress.getFuture().isDone()) {
                    Thread.sleep(reportingIntervalSeconds * 1000L);
                    if (!shutdown && !progress.getFuture().isDone()) {
                        reportProgress(progress);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Progress reporting for {} interrupted", filePath);
            }
        });
        reportingThread.setName("ChkProgressReporter-" + filePath.getFileName());
        reportingThread.setDaemon(true);
        reportingThread.start();
    }

    private void reportProgress(EncodeProgress progress) {
        long elapsedMillis = System.currentTimeMillis() - startTime;
        double blocksPerSecond = elapsedMillis > 0 ? progress.getProcessedBlocks() / (elapsedMillis / 1000.0) : 0.0;
        logger.info("CHK progress - File: {} | {}% ({}/{} blocks) | Phase: {} | Rate: {} blocks/sec",
            filePath.getFileName(),
            String.format("%.1f", progress.getFractionComplete() * 100.0),
            progress.getProcessedBlocks(), progress.getTotalBlocks(),
            progress.getPhase(),
            String.format("%.1f", blocksPerSecond));
    }

    private void reportFinalProgress(EncodeProgress progress) {
        double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        double mbPerSecond = elapsedSeconds > 0 ? (progress.getBytesRead() / 1024.0 / 1024.0) / elapsedSeconds : 0.0;
        logger.info("CHK encoding {} for: {} | Time: {}s | Blocks: {} | Throughput: {} MB/s{}{}",
            progress.getCurrentStage() == EncodeProgress.Stage.COMPLETED ? "completed" : "stopped",
            filePath,
            String.format("%.2f", elapsedSeconds),
            progress.getProcessedBlocks(),
            String.format("%.1f", mbPerSecond),
            System.lineSeparator(),
            progress.getPerformanceMetrics());
    }

    /**
     * Stops the reporting thread and logs the final summary.
     */
    @Override
    public void close() {
        shutdown = true;
        if (reportingThread != null) {
            reportingThread.interrupt();
            try {
                reportingThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reportFinalProgress(progress);
        }
    }
}
