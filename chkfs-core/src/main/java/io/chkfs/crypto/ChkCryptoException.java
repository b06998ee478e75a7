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

/// Thrown when the JCE provider cannot supply or run the hash or cipher.
/// Every conforming JDK ships SHA-512 and AES, so this signals a broken runtime.
public class ChkCryptoException extends RuntimeException {

  /// @param message the error message
  /// @param cause the underlying security exception
  public ChkCryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
