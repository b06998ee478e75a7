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

/// The hash of a block's plaintext.
///
/// A content key is both the fingerprint of the block and, after expansion through
/// {@link ChkCrypto#deriveKeyIv(byte[])}, the material for the block's cipher key.
/// Knowing the content key of a block is what allows decrypting it.
///
/// @param bytes the [#LENGTH] digest bytes
public record ContentKey(byte[] bytes) {

  /// Length of a content key in bytes
  public static final int LENGTH = ChkCrypto.HASH_LENGTH;

  /// Validates the digest length and takes a private copy of it.
  public ContentKey {
    Objects.requireNonNull(bytes, "content key bytes cannot be null");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException(
          "Content key must be " + LENGTH + " bytes, got: " + bytes.length);
    }
    bytes = Arrays.copyOf(bytes, bytes.length);
  }

  /// @return a copy of the digest bytes
  @Override
  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  /// Copies the digest into the given array.
  /// @param target the destination array
  /// @param offset the position in {@code target} of the first digest byte
  public void copyTo(byte[] target, int offset) {
    System.arraycopy(bytes, 0, target, offset, LENGTH);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ContentKey other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "ContentKey[" + HexDigits.abbreviate(bytes) + "]";
  }
}
