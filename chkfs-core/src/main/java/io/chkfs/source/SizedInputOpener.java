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

import java.io.IOException;

/// Opens a named source as a stream with a known length.
///
/// The encoder never resolves names itself; callers supply an opener for their kind of
/// source, such as local file paths.
///
/// @param <T> the type naming a source
@FunctionalInterface
public interface SizedInputOpener<T> {

  /// @param source the source to open
  /// @return the opened stream and its size; the caller closes it
  /// @throws IOException if the source cannot be opened or sized
  SizedInput open(T source) throws IOException;
}
