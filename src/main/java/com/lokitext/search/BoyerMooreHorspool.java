package com.lokitext.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Boyer-Moore-Horspool search: the bad-character rule only, always keyed on
 * the last byte of the current window. Same O(n * m) ceiling as
 * Boyer-Moore with a weaker worst case but far smaller tables.
 */
public final class BoyerMooreHorspool {

  public static List<Match> findAll(byte[] text, byte[] pattern) {
    ByteIndex.checkSearchArgs(text, pattern);
    final int m = pattern.length;
    final int n = text.length;
    if (n < m) return Collections.emptyList();

    int[] skip = shiftTable(pattern);
    List<Match> matches = new ArrayList<>();
    int s = 0;
    while (s <= n - m) {
      if (ByteIndex.regionMatches(text, s, pattern)) {
        matches.add(new Match(s, s + m));
      }
      s += skip[ByteIndex.unsigned(text[s + m - 1])];
    }
    return Collections.unmodifiableList(matches);
  }

  /**
   * Returns the shift for every byte value: the distance from its last
   * occurrence in pattern[0 .. m-1) to the end of the pattern, or m if it
   * does not occur there. Every entry is at least 1.
   */
  static int[] shiftTable(byte[] pattern) {
    final int m = pattern.length;
    int[] skip = new int[ByteIndex.ALPHABET_SIZE];
    Arrays.fill(skip, m);
    for (int i = 0; i < m - 1; ++i) {
      skip[ByteIndex.unsigned(pattern[i])] = m - 1 - i;
    }
    return skip;
  }

  private BoyerMooreHorspool() {
  }
}
