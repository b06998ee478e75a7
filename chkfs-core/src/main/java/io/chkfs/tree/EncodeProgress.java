package io.chkfs.tree;

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

import io.chkfs.crypto.ChkRecord;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/// Tracks the progress of encoding one input into a CHK tree.
/// Counters are updated by the encoder as blocks are produced and may be read from any thread.
/// The future completes with the stamped root record, or exceptionally when the encode fails.
public class EncodeProgress {
    /// Stages of an encode
    public enum Stage {
        /// Created, nothing read yet
        INITIALIZING("Initializing"),
        /// Reading input and producing blocks
        ENCODING("Encoding blocks"),
        /// Root record produced
        COMPLETED("Completed"),
        /// Aborted by an error
        FAILED("Failed");

        private final String displayName;

        Stage(String displayName) {
            this.displayName = displayName;
        }

        /// Gets the display name for this stage.
        /// @return The display name.
        public String getDisplayName() {
            return displayName;
        }
    }

    private final CompletableFuture<ChkRecord> future;
    private final long totalLeaves;
    private final long totalBlocks;
    private final long totalBytes;
    private final AtomicLong processedLeaves = new AtomicLong(0);
    private final AtomicLong processedInternalBlocks = new AtomicLong(0);
    private final AtomicLong bytesRead = new AtomicLong(0);
    private volatile Stage currentStage;

    // Performance counters
    private final AtomicLong readTimeNanos = new AtomicLong(0);
    private final AtomicLong encodeTimeNanos = new AtomicLong(0);

    /// Creates a progress tracker sized from a tree shape.
    /// @param shape The shape of the tree being encoded.
    public EncodeProgress(TreeShape shape) {
        this(shape.getLeafCount(), shape.getTotalBlockCount(), shape.getTotalContentSize());
    }

    /// Creates a progress tracker with explicit totals.
    /// @param totalLeaves The number of leaf blocks to produce.
    /// @param totalBlocks The number of blocks of all depths to produce.
    /// @param totalBytes The number of input bytes to read.
    public EncodeProgress(long totalLeaves, long totalBlocks, long totalBytes) {
        this.future = new CompletableFuture<>();
        this.totalLeaves = totalLeaves;
        this.totalBlocks = totalBlocks;
        this.totalBytes = totalBytes;
        this.currentStage = Stage.INITIALIZING;
    }

    /// Gets the future that completes with the root record.
    /// @return The future.
    public CompletableFuture<ChkRecord> getFuture() {
        return future;
    }

    /// @return The number of leaf blocks produced so far.
    public long getProcessedLeaves() {
        return processedLeaves.get();
    }

    /// @return The number of internal blocks produced so far.
    public long getProcessedInternalBlocks() {
        return processedInternalBlocks.get();
    }

    /// @return The number of blocks of all depths produced so far.
    public long getProcessedBlocks() {
        return processedLeaves.get() + processedInternalBlocks.get();
    }

    /// @return The number of leaf blocks the encode will produce.
    public long getTotalLeaves() {
        return totalLeaves;
    }

    /// @return The number of blocks of all depths the encode will produce.
    public long getTotalBlocks() {
        return totalBlocks;
    }

    /// @return The number of input bytes read so far.
    public long getBytesRead() {
        return bytesRead.get();
    }

    /// @return The number of input bytes the encode will read.
    public long getTotalBytes() {
        return totalBytes;
    }

    /// @return The current stage.
    public Stage getCurrentStage() {
        return currentStage;
    }

    /// @return The display name of the current stage.
    public String getPhase() {
        return currentStage.getDisplayName();
    }

    /// @return Completed fraction of all blocks in [0, 1].
    public double getFractionComplete() {
        return totalBlocks == 0 ? 1.0 : (double) getProcessedBlocks() / totalBlocks;
    }

    /// Sets the current stage.
    /// @param stage The new stage.
    public void setStage(Stage stage) {
        this.currentStage = stage;
    }

    /// Records a produced block.
    /// @param type The type of the block.
    public void blockProduced(BlockType type) {
        if (type == BlockType.DBLOCK) {
            processedLeaves.incrementAndGet();
        } else {
            processedInternalBlocks.incrementAndGet();
        }
    }

    /// Records input consumption.
    /// @param bytes The number of bytes read.
    /// @param nanos The time spent reading.
    public void addBytesRead(long bytes, long nanos) {
        bytesRead.addAndGet(bytes);
        readTimeNanos.addAndGet(nanos);
    }

    /// Adds to the hash and cipher time counter.
    /// @param nanos The time in nanoseconds to add.
    public void addEncodeTime(long nanos) {
        encodeTimeNanos.addAndGet(nanos);
    }

    /// @return The total time spent reading input, in nanoseconds.
    public long getReadTimeNanos() {
        return readTimeNanos.get();
    }

    /// @return The total time spent hashing and encrypting, in nanoseconds.
    public long getEncodeTimeNanos() {
        return encodeTimeNanos.get();
    }

    /// Completes the future with the root record.
    /// @param root The stamped root record.
    public void complete(ChkRecord root) {
        if (future.complete(root)) {
            setStage(Stage.COMPLETED);
        }
    }

    /// Completes the future exceptionally, unless it is already complete.
    /// @param ex The failure.
    public void completeExceptionally(Throwable ex) {
        if (future.completeExceptionally(ex)) {
            setStage(Stage.FAILED);
        }
    }

    /// Gets a summary of performance metrics.
    /// @return A formatted string with performance metrics.
    public String getPerformanceMetrics() {
        return String.format(
            "Performance Metrics:%n" +
            "  Read Time: %.3f ms%n" +
            "  Hash+Cipher Time: %.3f ms%n",
            readTimeNanos.get() / 1_000_000.0,
            encodeTimeNanos.get() / 1_000_000.0
        );
    }
}
