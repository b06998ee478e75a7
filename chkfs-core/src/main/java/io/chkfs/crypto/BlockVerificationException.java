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

/// Exception thrown when a block does not match the record that names it.
/// Carries the expected and actual digests so callers can report the mismatch.
public class BlockVerificationException extends RuntimeException {

  /// The digest the record promised.
  private final byte[] expectedHash;

  /// The digest computed from the block.
  private final byte[] actualHash;

  /// @param message the error message
  /// @param expectedHash the digest named by the record
  /// @param actualHash the digest computed from the block
  public BlockVerificationException(String message, byte[] expectedHash, byte[] actualHash) {
    super(message + " (expected " + HexDigits.abbreviate(expectedHash)
          + ", actual " + HexDigits.abbreviate(actualHash) + ")");
    this.expectedHash = expectedHash.clone();
    this.actualHash = actualHash.clone();
  }

  /// @return a copy of the expected digest
  public byte[] getExpectedHash() {
    return expectedHash.clone();
  }

  /// @return a copy of the computed digest
  public byte[] getActualHash() {
    return actualHash.clone();
  }
}
