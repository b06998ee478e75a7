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
 * Defines the shape of a CHK tree for one content size.
 *
 * This interface is the authoritative source for every block boundary calculation made
 * by the tree encoder. Nothing about the tree is stored: depth, spans, child positions and
 * partial block sizes are all derived from the content size, the leaf size and the fan-out.
 *
 * Depths count upward from the leaves. Depth 0 holds the data blocks; the root sits at
 * depth {@code getDepth() - 1}.
 */
public interface TreeShape {

  /**
   * Gets the maximum plaintext size of a block in bytes.
   *
   * @return the leaf size
   */
  int getLeafSize();

  /**
   * Gets the maximum number of children of an internal block.
   *
   * @return the fan-out
   */
  int getFanOut();

  /**
   * Gets the total content size in bytes.
   *
   * @return the content size this shape was built for
   */
  long getTotalContentSize();

  /**
   * Gets the number of levels from the leaves to the root, inclusive.
   *
   * This is the smallest depth {@code d >= 1} with {@code getSpanAtDepth(d - 1) >= size}.
   * A content size of zero still has depth 1: a single empty leaf.
   *
   * @return the tree depth, at least 1
   */
  int getDepth();

  /**
   * Gets the number of content bytes one block at the given depth covers when full.
   *
   * This is {@code leafSize * fanOut^depth}, saturated at {@link Long#MAX_VALUE}.
   *
   * @param depth the block depth, 0 for leaves
   * @return the byte span of a full block at that depth
   * @throws IllegalArgumentException if depth is negative
   */
  long getSpanAtDepth(int depth);

  /**
   * Gets the position of a block within its parent's child list.
   *
   * A leaf is identified by its start offset. An internal block is identified by the
   * offset at which it closes, so {@code offset - 1}, the last byte it covers, is used.
   *
   * @param depth the block depth
   * @param offset the start offset for a leaf, the end offset for an internal block
   * @return the slot index in {@code [0, getFanOut())}
   * @throws IllegalArgumentException if depth is negative, or an internal block is given offset 0
   */
  int getChildSlotIndex(int depth, long offset);

  /**
   * Gets the number of children of an internal block that closes at the given offset.
   *
   * The result is the full fan-out when the offset lands on a span boundary of the block's
   * depth, and otherwise the number of child spans needed to cover the remainder.
   *
   * @param depth the internal block depth, at least 1
   * @param offset the content offset at which the block closes, at least 1
   * @return the child count in {@code [1, getFanOut()]}
   * @throws IllegalArgumentException if depth or offset is not positive
   */
  int getInternalBlockChildCount(int depth, long offset);

  /**
   * Gets the number of leaf blocks.
   *
   * @return {@code ceil(size / leafSize)}, or 1 for empty content
   */
  long getLeafCount();

  /**
   * Gets the number of blocks produced at the given depth.
   *
   * @param depth the depth in {@code [0, getDepth())}
   * @return the block count at that depth
   * @throws IllegalArgumentException if depth is out of range
   */
  long getBlockCountAtDepth(int depth);

  /**
   * Gets the number of blocks in the whole tree, leaves included.
   *
   * @return the total block count
   */
  long getTotalBlockCount();

  /**
   * Gets the start position (inclusive) of the given leaf.
   *
   * @param leafIndex the leaf index (0-based)
   * @return the first content byte of the leaf
   * @throws IllegalArgumentException if leafIndex is out of bounds
   */
  long getLeafStartPosition(long leafIndex);

  /**
   * Gets the end position (exclusive) of the given leaf.
   *
   * @param leafIndex the leaf index (0-based)
   * @return one past the last content byte of the leaf
   * @throws IllegalArgumentException if leafIndex is out of bounds
   */
  long getLeafEndPosition(long leafIndex);

  /**
   * Validates that a leaf index is within {@code [0, getLeafCount())}.
   *
   * @param leafIndex the leaf index to check
   * @throws IllegalArgumentException if the index is out of bounds
   */
  void validateLeafIndex(long leafIndex);

  /**
   * Creates the shape used for all locators.
   *
   * @param contentSize the total content size in bytes
   * @return a shape with the standard leaf size and fan-out
   * @throws IllegalArgumentException if contentSize is negative
   */
  static ChkTreeShape fromContentSize(long contentSize) {
    return new ChkTreeShape(contentSize);
  }
}
