package com.lokitext.search;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.charset.StandardCharsets;

/**
 * Byte-oriented indexing helpers shared by the matchers.
 */
public final class ByteIndex {
  /** Number of distinct symbols in the byte alphabet. */
  public static final int ALPHABET_SIZE = 256;

  /**
   * Checks the arguments of a find-all call: both non-null, pattern
   * non-empty.
   */
  public static void checkSearchArgs(byte[] text, byte[] pattern) {
    checkNotNull(text, "text cannot be null");
    checkNotNull(pattern, "pattern cannot be null");
    checkArgument(pattern.length > 0, "pattern cannot be empty");
  }

  /**
   * Returns true if text[offset, offset + pattern.length) equals pattern.
   * Out-of-range windows are never equal.
   */
  public static boolean regionMatches(byte[] text, int offset, byte[] pattern) {
    if (offset < 0 || offset > text.length - pattern.length) return false;
    for (int i = 0; i < pattern.length; ++i) {
      if (text[offset + i] != pattern[i]) return false;
    }
    return true;
  }

  public static byte[] toBytes(String s) {
    checkNotNull(s);
    return s.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Decodes bytes as UTF-8, replacing malformed sequences with U+FFFD.
   */
  public static String toString(byte[] bytes) {
    checkNotNull(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  /** Interprets the given byte as an unsigned value in [0, 256). */
  public static int unsigned(byte b) {
    return b & 0xff;
  }

  private ByteIndex() {
  }
}
