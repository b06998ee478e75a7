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

import java.util.HexFormat;

/// Short hex renderings of digests for log lines and toString output.
final class HexDigits {

  private static final HexFormat HEX_FORMAT = HexFormat.of();
  private static final int PREFIX_BYTES = 8;

  private HexDigits() {
  }

  static String abbreviate(byte[] digest) {
    if (digest.length <= PREFIX_BYTES) {
      return HEX_FORMAT.formatHex(digest);
    }
    return HEX_FORMAT.formatHex(digest, 0, PREFIX_BYTES) + "...";
  }
}
