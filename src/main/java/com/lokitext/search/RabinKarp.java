package com.lokitext.search;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rabin-Karp search with a polynomial rolling hash.
 *
 * <p>A window whose hash equals the pattern hash is always compared byte by
 * byte before it is reported, so collisions cost time but never produce a
 * false match. Average O(n + m); adversarial collisions degrade it to
 * O(n * m), which is bounded by the choice of modulus.</p>
 *
 * <p>Instances are immutable and may be shared.</p>
 */
public final class RabinKarp {
  public static final long DEFAULT_BASE = 256;
  public static final long DEFAULT_MODULUS = 1_000_000_007L;

  private static final RabinKarp DEFAULT = new RabinKarp(DEFAULT_BASE, DEFAULT_MODULUS);

  /**
   * Searches with the default base and modulus.
   */
  public static List<Match> findAll(byte[] text, byte[] pattern) {
    return DEFAULT.search(text, pattern);
  }

  private final long base;
  private final long modulus;

  /**
   * Both parameters must fit in 31 bits so that hash * base stays inside a
   * long.
   */
  public RabinKarp(long base, long modulus) {
    checkArgument(base > 0 && base <= Integer.MAX_VALUE,
                  "base must be in [1, 2^31): %s", base);
    checkArgument(modulus > 0 && modulus <= Integer.MAX_VALUE,
                  "modulus must be in [1, 2^31): %s", modulus);
    this.base = base;
    this.modulus = modulus;
  }

  public long getBase() {
    return this.base;
  }

  public long getModulus() {
    return this.modulus;
  }

  /**
   * Hash of bytes[offset, offset + length).
   */
  long hash(byte[] bytes, int offset, int length) {
    long h = 0;
    for (int i = offset; i < offset + length; ++i) {
      h = (h * this.base + ByteIndex.unsigned(bytes[i])) % this.modulus;
    }
    return h;
  }

  public List<Match> search(byte[] text, byte[] pattern) {
    ByteIndex.checkSearchArgs(text, pattern);
    final int m = pattern.length;
    final int n = text.length;
    if (n < m) return Collections.emptyList();

    // base^(m-1) mod modulus, the weight of the byte leaving the window.
    long highPow = 1;
    for (int i = 1; i < m; ++i) {
      highPow = (highPow * this.base) % this.modulus;
    }

    final long patternHash = hash(pattern, 0, m);
    long windowHash = hash(text, 0, m);
    List<Match> matches = new ArrayList<>();
    for (int start = 0; ; ++start) {
      if (windowHash == patternHash && ByteIndex.regionMatches(text, start, pattern)) {
        matches.add(new Match(start, start + m));
      }
      if (start + m >= n) break;
      long leaving = (ByteIndex.unsigned(text[start]) * highPow) % this.modulus;
      windowHash = (windowHash - leaving + this.modulus) % this.modulus;
      windowHash = (windowHash * this.base + ByteIndex.unsigned(text[start + m])) % this.modulus;
    }
    return Collections.unmodifiableList(matches);
  }

  @Override
  public String toString() {
    return String.format("RabinKarp(base=%d, modulus=%d)", this.base, this.modulus);
  }
}
