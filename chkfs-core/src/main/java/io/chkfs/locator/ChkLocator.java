package io.chkfs.locator;

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

import io.chkfs.crypto.ChkRecord;
import io.chkfs.crypto.ContentKey;
import io.chkfs.crypto.RetrievalAddress;
import io.chkfs.encoding.Base32Encoding;
import io.chkfs.source.SizedInput;
import io.chkfs.tree.ChkTreeEncoder;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/// The canonical locator of encoded content:
/// `gnunet://fs/chk/<key>.<address>.<size>`, where key and address are the base32 forms of
/// the root record's 64-byte hashes and size is the content length in decimal.
///
/// Anyone holding the locator can fetch the root block by its address and decrypt it with
/// its key, and so on down the tree.
///
/// @param key the content key of the root block
/// @param address the retrieval address of the root block
/// @param fileSize the length of the encoded content in bytes
public record ChkLocator(ContentKey key, RetrievalAddress address, long fileSize) {

  /// The scheme and namespace that start every CHK locator
  public static final String PREFIX = "gnunet://fs/chk/";

  /// The length of each base32 hash field
  public static final int HASH_FIELD_LENGTH = Base32Encoding.encodedLength(ContentKey.LENGTH);

  private static final char SEPARATOR = '.';

  /// Validates the components.
  public ChkLocator {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(address, "address cannot be null");
    if (fileSize < 0) {
      throw new IllegalArgumentException("File size cannot be negative: " + fileSize);
    }
  }

  /// Builds the locator for a root record.
  /// @param root the root record produced by the tree encoder
  /// @return the locator
  /// @throws IllegalArgumentException if the record carries no file size
  public static ChkLocator of(ChkRecord root) {
    Objects.requireNonNull(root, "root cannot be null");
    long size = root.fileSize().orElseThrow(
        () -> new IllegalArgumentException("Record is not a root; it carries no file size"));
    return new ChkLocator(root.key(), root.address(), size);
  }

  /// Encodes exactly `size` bytes of a stream and returns their locator.
  /// @param input the content; not closed
  /// @param size the number of bytes to read
  /// @return the locator
  /// @throws IOException if reading fails or the stream ends early
  public static ChkLocator encode(InputStream input, long size) throws IOException {
    return of(ChkTreeEncoder.encode(input, size));
  }

  /// Encodes a sized input and returns its locator.
  /// @param input the content; not closed
  /// @return the locator
  /// @throws IOException if reading fails or the stream ends early
  public static ChkLocator encode(SizedInput input) throws IOException {
    return of(ChkTreeEncoder.encode(input));
  }

  /// Parses the canonical form produced by {@link #format()}.
  ///
  /// The size must be a plain decimal without sign or leading zeros, so every locator has
  /// exactly one textual form.
  ///
  /// @param text the locator text
  /// @return the locator
  /// @throws MalformedLocatorException if the text is not a canonical CHK locator
  public static ChkLocator parse(String text) {
    Objects.requireNonNull(text, "text cannot be null");
    if (!text.startsWith(PREFIX)) {
      throw new MalformedLocatorException("Locator must start with " + PREFIX, text);
    }
    int keyStart = PREFIX.length();
    int addressStart = keyStart + HASH_FIELD_LENGTH + 1;
    int sizeStart = addressStart + HASH_FIELD_LENGTH + 1;
    if (text.length() <= sizeStart) {
      throw new MalformedLocatorException("Locator is too short", text);
    }
    if (text.charAt(addressStart - 1) != SEPARATOR || text.charAt(sizeStart - 1) != SEPARATOR) {
      throw new MalformedLocatorException("Locator fields must be separated by '" + SEPARATOR + "'", text);
    }

    ContentKey key;
    RetrievalAddress address;
    try {
      key = new ContentKey(Base32Encoding.decode(text.subSequence(keyStart, addressStart - 1), ContentKey.LENGTH));
      address = new RetrievalAddress(
          Base32Encoding.decode(text.subSequence(addressStart, sizeStart - 1), RetrievalAddress.LENGTH));
    } catch (IllegalArgumentException e) {
      throw new MalformedLocatorException("Invalid hash field", text, e);
    }
    return new ChkLocator(key, address, parseSize(text, text.substring(sizeStart)));
  }

  private static long parseSize(String text, String digits) {
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        throw new MalformedLocatorException("Size must be a decimal number", text);
      }
    }
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      throw new MalformedLocatorException("Size must not have leading zeros", text);
    }
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw new MalformedLocatorException("Size is out of range", text, e);
    }
  }

  /// @return the root record this locator names, stamped with the file size
  public ChkRecord toRecord() {
    return new ChkRecord(key, address).withFileSize(fileSize);
  }

  /// @return the canonical locator string
  public String format() {
    return PREFIX + Base32Encoding.encode(key.bytes()) + SEPARATOR
           + Base32Encoding.encode(address.bytes()) + SEPARATOR + fileSize;
  }

  @Override
  public String toString() {
    return format();
  }
}
