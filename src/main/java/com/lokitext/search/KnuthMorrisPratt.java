package com.lokitext.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Knuth-Morris-Pratt search. Runs in O(n + m) time and O(m) space by never
 * moving backwards in the text: on a mismatch the pattern falls back along
 * its prefix table instead of restarting.
 */
public final class KnuthMorrisPratt {

  /**
   * Finds every occurrence of pattern in text, overlapping ones included,
   * in increasing start order.
   *
   * @throws IllegalArgumentException if pattern is empty
   */
  public static List<Match> findAll(byte[] text, byte[] pattern) {
    ByteIndex.checkSearchArgs(text, pattern);
    final int m = pattern.length;
    if (text.length < m) return Collections.emptyList();

    int[] pi = prefixTable(pattern);
    List<Match> matches = new ArrayList<>();
    int j = 0;  // Number of pattern bytes currently matched.
    for (int i = 0; i < text.length; ++i) {
      while (j > 0 && pattern[j] != text[i]) {
        j = pi[j - 1];
      }
      if (pattern[j] == text[i]) {
        ++j;
      }
      if (j == m) {
        matches.add(new Match(i - m + 1, i + 1));
        // Keep the longest border so the next occurrence may overlap.
        j = pi[m - 1];
      }
    }
    return Collections.unmodifiableList(matches);
  }

  /**
   * Computes the prefix (failure) table: pi[i] is the length of the longest
   * proper prefix of pattern that is also a suffix of pattern[0..i].
   */
  static int[] prefixTable(byte[] pattern) {
    int[] pi = new int[pattern.length];
    int j = 0;
    for (int i = 1; i < pattern.length; ++i) {
      while (j > 0 && pattern[j] != pattern[i]) {
        j = pi[j - 1];
      }
      if (pattern[j] == pattern[i]) {
        ++j;
      }
      pi[i] = j;
    }
    return pi;
  }

  private KnuthMorrisPratt() {
  }
}
