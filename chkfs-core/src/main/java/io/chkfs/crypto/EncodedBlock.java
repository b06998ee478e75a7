package io.chkfs.crypto;

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

import java.util.Arrays;
import java.util.Objects;

/// A block after convergent encryption: its record and its ciphertext.
///
/// The ciphertext is copied on the way in and out; equality compares its contents.
///
/// @param record the content key and retrieval address of the block
/// @param ciphertext the encrypted block, the same length as the plaintext
public record EncodedBlock(ChkRecord record, byte[] ciphertext) {

  /// Validates that both components are present.
  public EncodedBlock {
    Objects.requireNonNull(record, "record cannot be null");
    Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
    ciphertext = Arrays.copyOf(ciphertext, ciphertext.length);
  }

  /// @return a copy of the ciphertext
  @Override
  public byte[] ciphertext() {
    return Arrays.copyOf(ciphertext, ciphertext.length);
  }

  /// @return the length of the ciphertext, which equals the plaintext length
  public int length() {
    return ciphertext.length;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof EncodedBlock other)) return false;
    return record.equals(other.record) && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    return 31 * record.hashCode() + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "EncodedBlock{length=" + ciphertext.length + ", " + record + "}";
  }
}
