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

import java.util.Arrays;
import java.util.Objects;

/// One block produced by the tree encoder.
///
/// Listeners receive their own copy of the ciphertext and may keep or modify it.
///
/// @param type leaf or internal block
/// @param depth the block depth, 0 for leaves
/// @param offset the content offset the block starts at (leaves) or closes at (internal blocks)
/// @param slot the block's position within its parent
/// @param childCount the number of children of an internal block, 0 for leaves
/// @param record the block's content key and retrieval address
/// @param ciphertext the encrypted block
public record TreeBlock(
    BlockType type,
    int depth,
    long offset,
    int slot,
    int childCount,
    ChkRecord record,
    byte[] ciphertext
) {

  /// Validates that the block is internally consistent.
  public TreeBlock {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(record, "record cannot be null");
    Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
    if (type != BlockType.forDepth(depth)) {
      throw new IllegalArgumentException(type + " cannot sit at depth " + depth);
    }
    ciphertext = Arrays.copyOf(ciphertext, ciphertext.length);
  }

  /// @return a copy of the encrypted block
  @Override
  public byte[] ciphertext() {
    return Arrays.copyOf(ciphertext, ciphertext.length);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof TreeBlock other)) return false;
    return type == other.type && depth == other.depth && offset == other.offset && slot == other.slot
           && childCount == other.childCount && record.equals(other.record)
           && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(type, depth, offset, slot, childCount, record) + Arrays.hashCode(ciphertext);
  }

  /// @return the length of the block's plaintext, which equals the ciphertext length
  public int length() {
    return ciphertext.length;
  }

  @Override
  public String toString() {
    return type + "{depth=" + depth + ", offset=" + offset + ", slot=" + slot
           + ", children=" + childCount + ", length=" + ciphertext.length + ", " + record.address() + "}";
  }
}
