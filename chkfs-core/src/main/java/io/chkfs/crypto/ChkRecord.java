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

import java.util.Objects;
import java.util.OptionalLong;

/// The (content key, retrieval address) pair produced for one block.
///
/// Only the root record of a finished encode carries a file size; every child record
/// has an empty {@link #fileSize()}.
///
/// @param key the hash of the block plaintext
/// @param address the hash of the block ciphertext
/// @param fileSize the total file size, present on the root record only
public record ChkRecord(ContentKey key, RetrievalAddress address, OptionalLong fileSize) {

  /// Serialized length of a record inside an internal block
  public static final int SERIALIZED_LENGTH = ContentKey.LENGTH + RetrievalAddress.LENGTH;

  /// Validates that all components are present.
  public ChkRecord {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(address, "address cannot be null");
    Objects.requireNonNull(fileSize, "fileSize cannot be null, use OptionalLong.empty()");
    if (fileSize.isPresent() && fileSize.getAsLong() < 0) {
      throw new IllegalArgumentException("File size cannot be negative: " + fileSize.getAsLong());
    }
  }

  /// Creates a child record without a file size.
  /// @param key the content key
  /// @param address the retrieval address
  public ChkRecord(ContentKey key, RetrievalAddress address) {
    this(key, address, OptionalLong.empty());
  }

  /// @param size the total file size
  /// @return a copy of this record stamped with the given file size
  public ChkRecord withFileSize(long size) {
    return new ChkRecord(key, address, OptionalLong.of(size));
  }

  /// @return true if this record was stamped as the root of a file
  public boolean isRoot() {
    return fileSize.isPresent();
  }

  /// Writes {@code key || address} into the target array.
  /// @param target the destination array
  /// @param offset the position of the first key byte
  public void writeTo(byte[] target, int offset) {
    key.copyTo(target, offset);
    address.copyTo(target, offset + ContentKey.LENGTH);
  }

  /// @return {@code key || address} as a new array of [#SERIALIZED_LENGTH] bytes
  public byte[] toBytes() {
    byte[] bytes = new byte[SERIALIZED_LENGTH];
    writeTo(bytes, 0);
    return bytes;
  }
}
