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

/**
 * Authoritative source for all block boundary calculations in a CHK tree.
 *
 * The leaf size is always {@code fanOut * RECORD_SIZE}, so a full internal block holds
 * exactly as many bytes as a full leaf. The standard shape uses {@link ChkConstants#FAN_OUT};
 * smaller fan-outs are accepted so that deep trees can be exercised with little data.
 *
 * The static methods are the pure functions behind the instance accessors and may be used
 * without building a shape.
 */
public final class ChkTreeShape implements TreeShape {

    /** Smallest fan-out that still forms a tree */
    public static final int MIN_FAN_OUT = 2;

    private final long totalContentSize;
    private final int fanOut;
    private final int leafSize;
    private final int depth;
    private final long leafCount;
    private final long totalBlockCount;

    /**
     * Creates the standard shape for the given content size.
     *
     * @param totalContentSize the total size of the content in bytes (must be non-negative)
     * @throws IllegalArgumentException if totalContentSize is negative
     */
    public ChkTreeShape(long totalContentSize) {
        this(totalContentSize, ChkConstants.FAN_OUT);
    }

    /**
     * Creates a shape with a specific fan-out.
     *
     * @param totalContentSize the total content size in bytes
     * @param fanOut the maximum number of children per internal block
     * @throws IllegalArgumentException if the size is negative or the fan-out below {@link #MIN_FAN_OUT}
     */
    public ChkTreeShape(long totalContentSize, int fanOut) {
        this.totalContentSize = validateContentSize(totalContentSize);
        this.fanOut = validateFanOut(fanOut);
        this.leafSize = fanOut * ChkConstants.RECORD_SIZE;
        this.depth = depthForSize(totalContentSize, leafSize, fanOut);
        this.leafCount = blocksCovering(totalContentSize, leafSize);
        long blocks = 0;
        for (int d = 0; d < depth; d++) {
            blocks += blocksCovering(totalContentSize, spanAtDepth(d, leafSize, fanOut));
        }
        this.totalBlockCount = blocks;
    }

    /**
     * Creates the standard shape for the given content size.
     *
     * @param totalContentSize the total size of the content in bytes
     * @return the shape
     */
    public static ChkTreeShape fromContentSize(long totalContentSize) {
        return new ChkTreeShape(totalContentSize);
    }

    @Override
    public int getLeafSize() {
        return leafSize;
    }

    @Override
    public int getFanOut() {
        return fanOut;
    }

    @Override
    public long getTotalContentSize() {
        return totalContentSize;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    @Override
    public long getSpanAtDepth(int depth) {
        return spanAtDepth(depth, leafSize, fanOut);
    }

    @Override
    public int getChildSlotIndex(int depth, long offset) {
        return childSlotIndex(depth, offset, leafSize, fanOut);
    }

    @Override
    public int getInternalBlockChildCount(int depth, long offset) {
        return internalBlockChildCount(depth, offset, leafSize, fanOut);
    }

    @Override
    public long getLeafCount() {
        return leafCount;
    }

    @Override
    public long getBlockCountAtDepth(int depth) {
        if (depth < 0 || depth >= this.depth) {
            throw new IllegalArgumentException("Depth " + depth + " out of bounds [0, " + this.depth + ")");
        }
        return blocksCovering(totalContentSize, getSpanAtDepth(depth));
    }

    @Override
    public long getTotalBlockCount() {
        return totalBlockCount;
    }

    @Override
    public long getLeafStartPosition(long leafIndex) {
        validateLeafIndex(leafIndex);
        return leafIndex * leafSize;
    }

    @Override
    public long getLeafEndPosition(long leafIndex) {
        validateLeafIndex(leafIndex);
        return Math.min(leafIndex * leafSize + leafSize, totalContentSize);
    }

    @Override
    public void validateLeafIndex(long leafIndex) {
        if (leafIndex < 0 || leafIndex >= leafCount) {
            throw new IllegalArgumentException(
                "Leaf index " + leafIndex + " out of bounds [0, " + leafCount + ")");
        }
    }

    /**
     * Computes the tree depth for a content size.
     *
     * The result is the smallest {@code d >= 1} whose level {@code d - 1} span covers the size.
     * When growing the span once more would overflow a long, the depth reached so far is
     * returned; spans at that depth saturate, so the result still covers the size.
     *
     * @param size the content size in bytes
     * @param leafSize the leaf size in bytes
     * @param fanOut the fan-out
     * @return the tree depth, at least 1
     */
    public static int depthForSize(long size, long leafSize, int fanOut) {
        validateContentSize(size);
        int treeDepth = 1;
        long span = leafSize;
        while (span < size) {
            treeDepth++;
            if (span > Long.MAX_VALUE / fanOut) {
                break;
            }
            span *= fanOut;
        }
        return treeDepth;
    }

    /**
     * Computes {@code leafSize * fanOut^depth}, saturating at {@link Long#MAX_VALUE}.
     *
     * @param depth the depth, 0 for leaves
     * @param leafSize the leaf size in bytes
     * @param fanOut the fan-out
     * @return the span in bytes
     */
    public static long spanAtDepth(int depth, long leafSize, int fanOut) {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth cannot be negative: " + depth);
        }
        long span = leafSize;
        for (int i = 0; i < depth; i++) {
            if (span > Long.MAX_VALUE / fanOut) {
                return Long.MAX_VALUE;
            }
            span *= fanOut;
        }
        return span;
    }

    /**
     * Computes the slot of a block within its parent.
     *
     * @param depth the block depth
     * @param offset the start offset of a leaf, or the end offset of an internal block
     * @param leafSize the leaf size in bytes
     * @param fanOut the fan-out
     * @return the slot index in {@code [0, fanOut)}
     */
    public static int childSlotIndex(int depth, long offset, long leafSize, int fanOut) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        long effective = offset;
        if (depth > 0) {
            if (offset == 0) {
                throw new IllegalArgumentException("An internal block cannot close at offset 0");
            }
            effective = offset - 1;
        }
        return (int) ((effective / spanAtDepth(depth, leafSize, fanOut)) % fanOut);
    }

    /**
     * Computes the number of children of an internal block closing at the given offset.
     *
     * @param depth the internal block depth, at least 1
     * @param offset the content offset at which the block closes, at least 1
     * @param leafSize the leaf size in bytes
     * @param fanOut the fan-out
     * @return the child count in {@code [1, fanOut]}
     */
    public static int internalBlockChildCount(int depth, long offset, long leafSize, int fanOut) {
        if (depth <= 0) {
            throw new IllegalArgumentException("Internal blocks have depth > 0, got: " + depth);
        }
        if (offset <= 0) {
            throw new IllegalArgumentException("Internal blocks close at offset > 0, got: " + offset);
        }
        long span = spanAtDepth(depth, leafSize, fanOut);
        long remainder = offset % span;
        if (remainder == 0) {
            return fanOut;
        }
        long childSpan = spanAtDepth(depth - 1, leafSize, fanOut);
        long children = remainder / childSpan;
        if (remainder % childSpan != 0) {
            children++;
        }
        return (int) children;
    }

    private static long blocksCovering(long size, long span) {
        if (size == 0) {
            return 1;
        }
        return (size - 1) / span + 1;
    }

    private static long validateContentSize(long contentSize) {
        if (contentSize < 0) {
            throw new IllegalArgumentException("Content size cannot be negative: " + contentSize);
        }
        return contentSize;
    }

    private static int validateFanOut(int fanOut) {
        if (fanOut < MIN_FAN_OUT || fanOut > ChkConstants.FAN_OUT) {
            throw new IllegalArgumentException(
                "Fan-out must be in [" + MIN_FAN_OUT + ", " + ChkConstants.FAN_OUT + "], got: " + fanOut);
        }
        return fanOut;
    }

    @Override
    public String toString() {
        return "ChkTreeShape{" +
            "totalContentSize=" + totalContentSize +
            ", fanOut=" + fanOut +
            ", leafSize=" + leafSize +
            ", depth=" + depth +
            ", leafCount=" + leafCount +
            ", totalBlockCount=" + totalBlockCount +
            '}';
    }
}
