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

/// Kinds of blocks in a CHK tree.
public enum BlockType {
  /// Depth 0 block holding raw content bytes
  DBLOCK,
  /// Depth &gt; 0 block holding serialized child records
  IBLOCK;

  /// @param depth a block depth
  /// @return the type of blocks at that depth
  public static BlockType forDepth(int depth) {
    return depth == 0 ? DBLOCK : IBLOCK;
  }
}
