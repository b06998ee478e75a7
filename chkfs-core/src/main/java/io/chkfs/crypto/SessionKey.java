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

/// The symmetric key and initialization vector used to encrypt one block.
///
/// Each block owns its own session key, derived from that block's {@link ContentKey}.
/// Instances are never shared between blocks and never change after construction.
///
/// @param key the [#KEY_LENGTH] byte AES-256 key
/// @param iv the [#IV_LENGTH] byte initialization vector
public record SessionKey(byte[] key, byte[] iv) {

  /// AES-256 key length in bytes
  public static final int KEY_LENGTH = 32;

  /// AES block-sized IV length in bytes
  public static final int IV_LENGTH = 16;

  /// Validates lengths and takes private copies of both arrays.
  public SessionKey {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(iv, "iv cannot be null");
    if (key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Session key must be " + KEY_LENGTH + " bytes, got: " + key.length);
    }
    if (iv.length != IV_LENGTH) {
      throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes, got: " + iv.length);
    }
    key = Arrays.copyOf(key, key.length);
    iv = Arrays.copyOf(iv, iv.length);
  }

  @Override
  public byte[] key() {
    return Arrays.copyOf(key, key.length);
  }

  @Override
  public byte[] iv() {
    return Arrays.copyOf(iv, iv.length);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SessionKey other)) return false;
    return Arrays.equals(key, other.key) && Arrays.equals(iv, other.iv);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(key) + Arrays.hashCode(iv);
  }

  // key material stays out of logs
  @Override
  public String toString() {
    return "SessionKey[redacted]";
  }
}
