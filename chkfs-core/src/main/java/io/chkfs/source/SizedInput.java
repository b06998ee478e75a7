package io.chkfs.source;

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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/// A readable byte stream together with its exact length.
///
/// The length must be known before reading starts, since it fixes the shape of the tree.
/// Closing a sized input closes its stream.
///
/// @param stream the content stream, positioned at the first content byte
/// @param size the exact number of bytes the stream will deliver
/// @param name a display name for logs and messages
public record SizedInput(InputStream stream, long size, String name) implements AutoCloseable {

  /// Validates the components.
  public SizedInput {
    Objects.requireNonNull(stream, "stream cannot be null");
    Objects.requireNonNull(name, "name cannot be null");
    if (size < 0) {
      throw new IllegalArgumentException("Size cannot be negative: " + size);
    }
  }

  /// Wraps an in-memory array.
  /// @param data the content
  /// @return a sized input over the whole array
  public static SizedInput of(byte[] data) {
    return new SizedInput(new ByteArrayInputStream(data), data.length, "memory[" + data.length + "]");
  }

  @Override
  public void close() throws IOException {
    stream.close();
  }
}
