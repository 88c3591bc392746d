package com.lokitext.search;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.base.Joiner;

/**
 * The single-pattern search algorithms. All of them report every
 * occurrence, overlapping ones included, in increasing start order, and
 * differ only in their cost profile.
 */
public enum Algorithm {
  /** Knuth-Morris-Pratt, O(n + m) worst case. */
  KMP("kmp"),
  /** Z-algorithm, O(n + m) worst case. */
  Z("z"),
  /** Rabin-Karp, O(n + m) on average. */
  RABIN_KARP("rabin-karp"),
  /** Boyer-Moore with the good-suffix rule, sub-linear on average. */
  BOYER_MOORE("boyer-moore"),
  /** Boyer-Moore-Horspool, bad-character rule only. */
  HORSPOOL("horspool");

  /**
   * Looks up an algorithm by its short name or constant name, ignoring
   * case.
   */
  public static Algorithm forName(String name) {
    checkNotNull(name, "algorithm name cannot be null");
    String trimmed = name.trim();
    for (Algorithm algorithm : values()) {
      if (algorithm.shortName.equalsIgnoreCase(trimmed) ||
          algorithm.name().equalsIgnoreCase(trimmed)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException(String.format(
        "Unknown algorithm \"%s\", expected one of: %s", name,
        Joiner.on(", ").join(names())));
  }

  private static String[] names() {
    Algorithm[] all = values();
    String[] names = new String[all.length];
    for (int i = 0; i < all.length; ++i) names[i] = all[i].shortName;
    return names;
  }

  private final String shortName;

  Algorithm(String shortName) {
    this.shortName = shortName;
  }

  public List<Match> findAll(byte[] text, byte[] pattern) {
    switch (this) {
      case KMP:         return KnuthMorrisPratt.findAll(text, pattern);
      case Z:           return ZAlgorithm.findAll(text, pattern);
      case RABIN_KARP:  return RabinKarp.findAll(text, pattern);
      case BOYER_MOORE: return BoyerMoore.findAll(text, pattern);
      case HORSPOOL:    return BoyerMooreHorspool.findAll(text, pattern);
      default: throw new AssertionError(this);
    }
  }

  /**
   * Same as {@link #findAll(byte[], byte[])}, with the Rabin-Karp hash
   * parameters taken from settings.
   */
  public List<Match> findAll(byte[] text, byte[] pattern, SearchSettings settings) {
    checkNotNull(settings);
    if (this == RABIN_KARP) return settings.getRabinKarp().search(text, pattern);
    return findAll(text, pattern);
  }

  /**
   * Searches the UTF-8 encoding of text; offsets of the returned matches
   * are byte offsets into that encoding.
   */
  public List<Match> findAll(String text, String pattern) {
    return findAll(ByteIndex.toBytes(text), ByteIndex.toBytes(pattern));
  }

  public String getName() {
    return this.shortName;
  }

  @Override
  public String toString() {
    return this.shortName;
  }
}
