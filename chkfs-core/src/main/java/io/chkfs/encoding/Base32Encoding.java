package io.chkfs.encoding;

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

/// Canonical 5-bit text encoding for digests in locators.
///
/// The input is read as one contiguous bit stream, most significant bit first, and cut
/// into 5-bit groups, each mapped onto [#ALPHABET]. The last group is zero-padded; no
/// padding characters are emitted. A 64 byte digest becomes 103 characters.
///
/// The alphabet is the RFC 4648 "base32hex" alphabet, so the output equals base32hex with
/// its trailing `=` characters removed.
public final class Base32Encoding {

  /// The 32 symbols, indexed by 5-bit value
  public static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUV";

  private static final char[] SYMBOLS = ALPHABET.toCharArray();
  private static final int BITS_PER_SYMBOL = 5;
  private static final int SYMBOL_MASK = 0x1f;

  private Base32Encoding() {
  }

  /// @param byteLength the number of input bytes
  /// @return the number of characters {@link #encode(byte[])} produces for that many bytes
  public static int encodedLength(int byteLength) {
    if (byteLength < 0) {
      throw new IllegalArgumentException("byteLength cannot be negative: " + byteLength);
    }
    return (int) (((long) byteLength * 8 + BITS_PER_SYMBOL - 1) / BITS_PER_SYMBOL);
  }

  /// Encodes bytes into the canonical text form.
  /// @param data the bytes to encode
  /// @return the encoded text, empty for empty input
  public static String encode(byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    StringBuilder sb = new StringBuilder(encodedLength(data.length));
    int bits = 0;
    int bitCount = 0;
    for (byte b : data) {
      bits = (bits << 8) | (b & 0xff);
      bitCount += 8;
      while (bitCount >= BITS_PER_SYMBOL) {
        bitCount -= BITS_PER_SYMBOL;
        sb.append(SYMBOLS[(bits >>> bitCount) & SYMBOL_MASK]);
      }
      bits &= (1 << bitCount) - 1;
    }
    if (bitCount > 0) {
      sb.append(SYMBOLS[(bits << (BITS_PER_SYMBOL - bitCount)) & SYMBOL_MASK]);
    }
    return sb.toString();
  }

  /// Decodes canonical text back into bytes.
  ///
  /// Only upper case symbols are accepted, the text must have exactly the length produced
  /// for `byteLength` bytes, and the pad bits of the last symbol must be zero. Each byte
  /// sequence therefore has a single accepted text form.
  ///
  /// @param text the encoded text
  /// @param byteLength the number of bytes the text encodes
  /// @return the decoded bytes
  /// @throws IllegalArgumentException if the text is not a canonical encoding
  public static byte[] decode(CharSequence text, int byteLength) {
    Objects.requireNonNull(text, "text cannot be null");
    int expected = encodedLength(byteLength);
    if (text.length() != expected) {
      throw new IllegalArgumentException(
          "Expected " + expected + " characters for " + byteLength + " bytes, got " + text.length());
    }
    byte[] out = new byte[byteLength];
    int bits = 0;
    int bitCount = 0;
    int pos = 0;
    for (int i = 0; i < text.length(); i++) {
      bits = (bits << BITS_PER_SYMBOL) | valueOf(text.charAt(i), i);
      bitCount += BITS_PER_SYMBOL;
      if (bitCount >= 8) {
        bitCount -= 8;
        out[pos++] = (byte) (bits >>> bitCount);
        bits &= (1 << bitCount) - 1;
      }
    }
    if (bits != 0) {
      throw new IllegalArgumentException("Non-zero padding bits in final character of: " + text);
    }
    return out;
  }

  /// @param c a character
  /// @return true if the character is one of the 32 symbols
  public static boolean isSymbol(char c) {
    return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'V');
  }

  private static int valueOf(char c, int index) {
    if (c >= '0' && c <= '9') {
      return c - '0';
    }
    if (c >= 'A' && c <= 'V') {
      return c - 'A' + 10;
    }
    throw new IllegalArgumentException("Invalid character '" + c + "' at index " + index);
  }
}
