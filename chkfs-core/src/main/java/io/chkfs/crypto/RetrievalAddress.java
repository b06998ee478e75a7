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

/// The hash of a block's ciphertext.
///
/// This is the externally visible name of a block. It can be published without
/// revealing the {@link ContentKey} needed to decrypt the block.
///
/// @param bytes the [#LENGTH] digest bytes
public record RetrievalAddress(byte[] bytes) {

  /// Length of a retrieval address in bytes
  public static final int LENGTH = ChkCrypto.HASH_LENGTH;

  /// Validates the digest length and takes a private copy of it.
  public RetrievalAddress {
    Objects.requireNonNull(bytes, "retrieval address bytes cannot be null");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException(
          "Retrieval address must be " + LENGTH + " bytes, got: " + bytes.length);
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

  /// @param digest a digest to compare against
  /// @return true if {@code digest} is byte-identical to this address
  public boolean matches(byte[] digest) {
    return Arrays.equals(bytes, digest);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof RetrievalAddress other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "RetrievalAddress[" + HexDigits.abbreviate(bytes) + "]";
  }
}
