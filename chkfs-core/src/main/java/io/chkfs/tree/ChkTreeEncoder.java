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

import io.chkfs.crypto.ChkCrypto;
import io.chkfs.crypto.ChkRecord;
import io.chkfs.crypto.EncodedBlock;
import io.chkfs.source.SizedInput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/// Streams content into a CHK tree in a single pass and produces the root record.
///
/// The encoder keeps one {@link ChkLevelWindow} per level. Leaves are read in order and their
/// records dropped into the level 0 window. Whenever a window is complete, or the input is
/// exhausted, the window is folded into an internal block one level up. The root is the single
/// record left at level `depth - 1` once the input is consumed, stamped with the content size.
///
/// Every block is handed to the {@link TreeBlockListener} exactly once, children before parents.
/// With a leaf executor, the leaves of one level 1 window are hashed and encrypted concurrently;
/// the blocks and the root are the same as in a sequential encode and are emitted in the same order.
///
/// An encoder is single use and not thread safe. Drive it with {@link #encode()}, or one block at
/// a time with {@link #step()}.
public final class ChkTreeEncoder {
  private static final Logger logger = LogManager.getLogger(ChkTreeEncoder.class);

  private final InputStream input;
  private final TreeShape shape;
  private final ChkLevelWindow[] levels;
  private final TreeBlockListener listener;
  private final EncodeProgress progress;
  private final Executor leafExecutor;

  private long readOffset;
  private int currentDepth;
  private ChkRecord root;
  private boolean failed;

  private ChkTreeEncoder(Builder builder, InputStream input) {
    this.input = Objects.requireNonNull(input, "input cannot be null");
    this.shape = builder.shape;
    this.listener = builder.listener;
    this.progress = builder.progress != null ? builder.progress : new EncodeProgress(shape);
    this.leafExecutor = builder.leafExecutor;
    this.levels = new ChkLevelWindow[shape.getDepth()];
    for (int d = 0; d < levels.length; d++) {
      levels[d] = new ChkLevelWindow(d, shape.getFanOut());
    }
  }

  /// Creates a builder for an encoder over content of the given shape.
  /// @param shape the tree shape, which fixes the content size
  /// @return a new builder
  public static Builder builder(TreeShape shape) {
    return new Builder(shape);
  }

  /// Encodes exactly `size` bytes of a stream with the standard tree shape.
  /// @param input the content; not closed
  /// @param size the number of bytes to read
  /// @return the root record, carrying the size
  /// @throws IOException if reading fails or the stream ends early
  public static ChkRecord encode(InputStream input, long size) throws IOException {
    return builder(ChkTreeShape.fromContentSize(size)).build(input).encode();
  }

  /// Encodes a sized input with the standard tree shape.
  /// @param input the content; not closed
  /// @return the root record, carrying the size
  /// @throws IOException if reading fails or the stream ends early
  public static ChkRecord encode(SizedInput input) throws IOException {
    return encode(input.stream(), input.size());
  }

  /// Encodes a sized input on the given executor.
  ///
  /// The returned progress is live while the encode runs and its future completes with the
  /// root record. The input is always closed, and on success it is closed before the future
  /// completes.
  ///
  /// @param input the content
  /// @param listener receives every block, on the executor's thread
  /// @param executor runs the encode
  /// @return the progress of the encode
  public static EncodeProgress encodeAsync(SizedInput input, TreeBlockListener listener, Executor executor) {
    ChkTreeEncoder encoder = builder(ChkTreeShape.fromContentSize(input.size()))
        .listener(listener)
        .build(input.stream());
    EncodeProgress progress = encoder.getProgress();
    CompletableFuture.runAsync(() -> {
      try {
        try (input) {
          encoder.encodeBlocks();
        }
        encoder.step();
      } catch (Exception e) {
        logger.error("Encoding {} failed: {}", input.name(), e.getMessage());
        progress.completeExceptionally(e);
      }
    }, executor);
    return progress;
  }

  /// Runs the encoder to completion.
  /// @return the root record, carrying the content size
  /// @throws IOException if reading fails or the stream ends early
  public ChkRecord encode() throws IOException {
    encodeBlocks();
    return step();
  }

  private void encodeBlocks() throws IOException {
    while (currentDepth < shape.getDepth()) {
      step();
    }
  }

  /// Advances the encoder by one block, or by one batch of leaves when a leaf executor is set.
  ///
  /// After the last block, one further step stamps the root.
  ///
  /// @return the root record once the encode is complete, otherwise null
  /// @throws IOException if reading fails or the stream ends early
  /// @throws IllegalStateException if a previous step failed
  public ChkRecord step() throws IOException {
    if (root != null) {
      return root;
    }
    if (failed) {
      throw new IllegalStateException("Encoder failed at offset " + readOffset + " and cannot continue");
    }
    if (progress.getCurrentStage() == EncodeProgress.Stage.INITIALIZING) {
      logger.debug("Encoding {} bytes as a tree of depth {}", shape.getTotalContentSize(), shape.getDepth());
      progress.setStage(EncodeProgress.Stage.ENCODING);
    }
    try {
      if (currentDepth == shape.getDepth()) {
        root = levels[shape.getDepth() - 1].get(0).withFileSize(shape.getTotalContentSize());
        logger.debug("Encoded {} blocks, root {}", progress.getProcessedBlocks(), root.address());
        progress.complete(root);
        return root;
      }
      if (currentDepth == 0) {
        if (leafExecutor == null) {
          encodeLeaf();
        } else {
          encodeLeafBatch();
        }
      } else {
        encodeInternalBlock();
      }
      return null;
    } catch (IOException | RuntimeException e) {
      failed = true;
      progress.completeExceptionally(e);
      throw e;
    }
  }

  private void encodeLeaf() throws IOException {
    long offset = readOffset;
    byte[] data = readLeaf();
    long start = System.nanoTime();
    EncodedBlock block = ChkCrypto.encodeBlock(data);
    progress.addEncodeTime(System.nanoTime() - start);
    acceptLeaf(offset, block);
    promoteAfterLeaf();
  }

  /// Reads the remaining leaves of the current level 1 window, encodes them on the executor and
  /// accepts them in order.
  private void encodeLeafBatch() throws IOException {
    long span = shape.getSpanAtDepth(1);
    List<Long> offsets = new ArrayList<>();
    List<CompletableFuture<EncodedBlock>> futures = new ArrayList<>();
    do {
      offsets.add(readOffset);
      byte[] data = readLeaf();
      futures.add(CompletableFuture.supplyAsync(() -> {
        long start = System.nanoTime();
        EncodedBlock block = ChkCrypto.encodeBlock(data);
        progress.addEncodeTime(System.nanoTime() - start);
        return block;
      }, leafExecutor));
    } while (readOffset < shape.getTotalContentSize() && readOffset % span != 0);

    for (int i = 0; i < futures.size(); i++) {
      acceptLeaf(offsets.get(i), join(futures.get(i)));
    }
    currentDepth = 1;
  }

  private void acceptLeaf(long offset, EncodedBlock block) {
    int slot = shape.getChildSlotIndex(0, offset);
    levels[0].put(slot, block.record());
    emit(new TreeBlock(BlockType.DBLOCK, 0, offset, slot, 0, block.record(), block.ciphertext()));
  }

  private void promoteAfterLeaf() {
    if (readOffset == shape.getTotalContentSize() || readOffset % shape.getSpanAtDepth(1) == 0) {
      currentDepth = 1;
    }
  }

  private void encodeInternalBlock() {
    int depth = currentDepth;
    int childCount = shape.getInternalBlockChildCount(depth, readOffset);
    byte[] payload = levels[depth - 1].serialize(childCount);
    long start = System.nanoTime();
    EncodedBlock block = ChkCrypto.encodeBlock(payload);
    progress.addEncodeTime(System.nanoTime() - start);

    int slot = shape.getChildSlotIndex(depth, readOffset);
    levels[depth].put(slot, block.record());
    emit(new TreeBlock(BlockType.IBLOCK, depth, readOffset, slot, childCount, block.record(), block.ciphertext()));

    // A full parent, or the end of input, closes the next level too
    if (slot == shape.getFanOut() - 1 || readOffset == shape.getTotalContentSize()) {
      currentDepth = depth + 1;
    } else {
      currentDepth = 0;
    }
  }

  private void emit(TreeBlock block) {
    if (logger.isTraceEnabled()) {
      logger.trace("Produced {}", block);
    }
    progress.blockProduced(block.type());
    listener.onBlock(block);
  }

  private byte[] readLeaf() throws IOException {
    int length = (int) Math.min(shape.getLeafSize(), shape.getTotalContentSize() - readOffset);
    byte[] data = new byte[length];
    long start = System.nanoTime();
    int filled = 0;
    while (filled < length) {
      int n = input.read(data, filled, length - filled);
      if (n < 0) {
        throw new EOFException("Input ended after " + (readOffset + filled) + " of "
                               + shape.getTotalContentSize() + " bytes");
      }
      filled += n;
    }
    readOffset += length;
    progress.addBytesRead(length, System.nanoTime() - start);
    return data;
  }

  private static EncodedBlock join(CompletableFuture<EncodedBlock> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  /// @return the shape of the tree being encoded
  public TreeShape getShape() {
    return shape;
  }

  /// @return the progress tracker updated by this encoder
  public EncodeProgress getProgress() {
    return progress;
  }

  /// @return the number of content bytes consumed so far
  public long getReadOffset() {
    return readOffset;
  }

  /// @return the depth of the next block to produce; equal to the tree depth once all blocks exist
  public int getCurrentDepth() {
    return currentDepth;
  }

  /// @return true once the root has been produced
  public boolean isComplete() {
    return root != null;
  }

  /// @return the root record, or null until the encode is complete
  public ChkRecord getRoot() {
    return root;
  }

  /// Configures a {@link ChkTreeEncoder}.
  public static final class Builder {
    private final TreeShape shape;
    private TreeBlockListener listener = TreeBlockListener.NONE;
    private EncodeProgress progress;
    private Executor leafExecutor;

    private Builder(TreeShape shape) {
      this.shape = Objects.requireNonNull(shape, "shape cannot be null");
    }

    /// @param listener receives every produced block
    /// @return this builder
    public Builder listener(TreeBlockListener listener) {
      this.listener = Objects.requireNonNull(listener, "listener cannot be null");
      return this;
    }

    /// @param progress the tracker to update; by default one is created from the shape
    /// @return this builder
    public Builder progress(EncodeProgress progress) {
      this.progress = progress;
      return this;
    }

    /// @param leafExecutor runs leaf hashing and encryption; null encodes leaves on the calling thread
    /// @return this builder
    public Builder leafExecutor(Executor leafExecutor) {
      this.leafExecutor = leafExecutor;
      return this;
    }

    /// @param input the content, read from its current position; not closed by the encoder
    /// @return a new encoder
    public ChkTreeEncoder build(InputStream input) {
      return new ChkTreeEncoder(this, input);
    }
  }
}
