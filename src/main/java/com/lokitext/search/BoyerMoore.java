package com.lokitext.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Boyer-Moore search using both the bad-character rule and the strong
 * good-suffix rule.
 *
 * <p>Each window is compared right to left. On a mismatch the window moves
 * by the larger of the two shifts; after a full match it moves by the
 * period of the pattern, so overlapping occurrences are still found.
 * Sub-linear on average, O(n * m) in the worst case.</p>
 */
public final class BoyerMoore {

  public static List<Match> findAll(byte[] text, byte[] pattern) {
    ByteIndex.checkSearchArgs(text, pattern);
    final int m = pattern.length;
    final int n = text.length;
    if (n < m) return Collections.emptyList();

    int[] lastOccurrence = badCharacterTable(pattern);
    int[] goodSuffix = goodSuffixTable(pattern);

    List<Match> matches = new ArrayList<>();
    int s = 0;  // Window start.
    while (s <= n - m) {
      int j = m - 1;
      while (j >= 0 && pattern[j] == text[s + j]) {
        --j;
      }
      if (j < 0) {
        matches.add(new Match(s, s + m));
        s += goodSuffix[0];
      } else {
        int badCharShift = j - lastOccurrence[ByteIndex.unsigned(text[s + j])];
        s += Math.max(goodSuffix[j + 1], badCharShift);
      }
    }
    return Collections.unmodifiableList(matches);
  }

  /**
   * Returns, for every byte value, the index of its last occurrence in
   * pattern, or -1 if it does not occur.
   */
  static int[] badCharacterTable(byte[] pattern) {
    int[] table = new int[ByteIndex.ALPHABET_SIZE];
    Arrays.fill(table, -1);
    for (int i = 0; i < pattern.length; ++i) {
      table[ByteIndex.unsigned(pattern[i])] = i;
    }
    return table;
  }

  /**
   * Returns the strong good-suffix shifts, indexed by the position just
   * after the mismatch: shift[j + 1] applies when pattern[j] mismatched and
   * pattern[j + 1 .. m) matched. shift[0] is the shift after a full match,
   * which is the period of the pattern.
   */
  static int[] goodSuffixTable(byte[] pattern) {
    final int m = pattern.length;
    int[] shift = new int[m + 1];
    // border[i] is the start of the widest border of pattern[i .. m).
    int[] border = new int[m + 1];

    // Case 1: the matched suffix occurs elsewhere, preceded by another byte.
    int i = m;
    int j = m + 1;
    border[i] = j;
    while (i > 0) {
      while (j <= m && pattern[i - 1] != pattern[j - 1]) {
        if (shift[j] == 0) shift[j] = j - i;
        j = border[j];
      }
      --i;
      --j;
      border[i] = j;
    }

    // Case 2: only a prefix of the pattern matches part of the suffix.
    j = border[0];
    for (i = 0; i <= m; ++i) {
      if (shift[i] == 0) shift[i] = j;
      if (i == j) j = border[j];
    }
    return shift;
  }

  private BoyerMoore() {
  }
}
