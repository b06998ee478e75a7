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

/// Fixed tree parameters.
///
/// These values are part of every locator ever produced. Changing any of them changes the
/// locator of every file, so they are constants rather than configuration.
public final class ChkConstants {

  /// Maximum plaintext size of any block, leaf or internal
  public static final int LEAF_SIZE = 32 * 1024;

  /// Maximum number of children of an internal block
  public static final int FAN_OUT = 256;

  /// Bytes one child occupies inside an internal block
  public static final int RECORD_SIZE = ChkRecord.SERIALIZED_LENGTH;

  private ChkConstants() {
  }
}
