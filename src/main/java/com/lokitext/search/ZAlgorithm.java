package com.lokitext.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Z-algorithm search over the virtual string pattern + text.
 *
 * <p>No separator byte is inserted. Instead every Z value is capped at the
 * pattern length, so a prefix match can never run past the boundary between
 * pattern and text. Runs in O(n + m) time and space.</p>
 */
public final class ZAlgorithm {

  public static List<Match> findAll(byte[] text, byte[] pattern) {
    ByteIndex.checkSearchArgs(text, pattern);
    final int m = pattern.length;
    if (text.length < m) return Collections.emptyList();

    int[] z = zArray(pattern, text);
    List<Match> matches = new ArrayList<>();
    for (int i = m; i < z.length; ++i) {
      if (z[i] == m) {
        int start = i - m;
        matches.add(new Match(start, start + m));
      }
    }
    return Collections.unmodifiableList(matches);
  }

  /**
   * Returns the plain Z-array of s: z[i] is the length of the longest
   * substring starting at i that is also a prefix of s. z[0] is s.length.
   */
  static int[] zArray(byte[] s) {
    return zArray(s, new byte[0], s.length);
  }

  /**
   * Z-array of pattern + text, each value capped at pattern.length.
   */
  static int[] zArray(byte[] pattern, byte[] text) {
    return zArray(pattern, text, pattern.length);
  }

  private static int[] zArray(byte[] pattern, byte[] text, int cap) {
    final int m = pattern.length;
    final int total = m + text.length;
    int[] z = new int[total];
    if (total == 0) return z;
    z[0] = Math.min(m, cap);

    // [left, right) is the rightmost window known to match a prefix.
    int left = 0;
    int right = 0;
    for (int i = 1; i < total; ++i) {
      int k = 0;
      if (i < right) {
        k = Math.min(right - i, z[i - left]);
      }
      while (k < cap && i + k < total && byteAt(pattern, text, k) == byteAt(pattern, text, i + k)) {
        ++k;
      }
      z[i] = k;
      if (i + k > right) {
        left = i;
        right = i + k;
      }
    }
    return z;
  }

  // Byte at position i of the concatenation pattern + text.
  private static byte byteAt(byte[] pattern, byte[] text, int i) {
    return i < pattern.length ? pattern[i] : text[i - pattern.length];
  }

  private ZAlgorithm() {
  }
}
