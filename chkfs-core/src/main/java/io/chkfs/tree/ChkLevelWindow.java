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

import java.util.Objects;

/// The child slots of the one internal block that is currently open at a level.
///
/// Each level of the tree owns one window of `fanOut` slots. Slots are indexed by
/// {@link TreeShape#getChildSlotIndex(int, long)}, which wraps modulo the fan-out, so the
/// window is reused for every block of its level and the encoder never holds more than
/// `depth * fanOut` records.
final class ChkLevelWindow {

  private final int depth;
  private final ChkRecord[] slots;

  ChkLevelWindow(int depth, int fanOut) {
    this.depth = depth;
    this.slots = new ChkRecord[fanOut];
  }

  void put(int slot, ChkRecord record) {
    Objects.requireNonNull(record, "record cannot be null");
    slots[slot] = record;
  }

  ChkRecord get(int slot) {
    ChkRecord record = slots[slot];
    if (record == null) {
      throw new IllegalStateException("No record in slot " + slot + " at depth " + depth);
    }
    return record;
  }

  /// Concatenates the first `count` records in slot order into an internal block payload.
  /// Order matters: it determines the content key of the parent.
  byte[] serialize(int count) {
    if (count < 1 || count > slots.length) {
      throw new IllegalArgumentException("Child count " + count + " out of bounds [1, " + slots.length + "]");
    }
    byte[] payload = new byte[count * ChkRecord.SERIALIZED_LENGTH];
    for (int slot = 0; slot < count; slot++) {
      get(slot).writeTo(payload, slot * ChkRecord.SERIALIZED_LENGTH);
    }
    return payload;
  }
}
