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

/// Receives every block the tree encoder produces, once each, in production order.
///
/// Listeners are called on the encoding thread. A listener that throws aborts the encode.
@FunctionalInterface
public interface TreeBlockListener {

  /// A listener that ignores all blocks
  TreeBlockListener NONE = block -> { };

  /// @param block the block just produced
  void onBlock(TreeBlock block);
}
