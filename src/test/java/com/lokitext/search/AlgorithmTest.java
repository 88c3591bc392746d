package com.lokitext.search;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Test;

/**
 * Properties every single-pattern algorithm must share.
 */
public class AlgorithmTest {

  private static List<Integer> starts(List<Match> matches) {
    List<Integer> starts = new ArrayList<>();
    for (Match match : matches) starts.add(match.getStart());
    return starts;
  }

  @Test
  public void overlappingOccurrences() {
    for (Algorithm algorithm : Algorithm.values()) {
      assertEquals(algorithm.getName(), Arrays.asList(0, 1, 2),
                   starts(algorithm.findAll("aaaa", "aa")));
    }
  }

  @Test
  public void patternLongerThanText() {
    for (Algorithm algorithm : Algorithm.values()) {
      assertTrue(algorithm.getName(), algorithm.findAll("abc", "abcd").isEmpty());
      assertTrue(algorithm.getName(), algorithm.findAll("", "a").isEmpty());
    }
  }

  @Test
  public void emptyPatternIsRejected() {
    for (Algorithm algorithm : Algorithm.values()) {
      try {
        algorithm.findAll("abc", "");
        fail(algorithm.getName() + " accepted an empty pattern");
      } catch (IllegalArgumentException expected) {
        // expected
      }
    }
  }

  @Test
  public void nullTextIsRejected() {
    for (Algorithm algorithm : Algorithm.values()) {
      try {
        algorithm.findAll(null, new byte[] {1});
        fail(algorithm.getName() + " accepted null text");
      } catch (NullPointerException expected) {
        // expected
      }
    }
  }

  @Test
  public void matchesAreWellFormed() {
    byte[] text = ByteIndex.toBytes("mississippi");
    byte[] pattern = ByteIndex.toBytes("issi");
    for (Algorithm algorithm : Algorithm.values()) {
      List<Match> matches = algorithm.findAll(text, pattern);
      assertEquals(algorithm.getName(), Arrays.asList(new Match(1, 5), new Match(4, 8)), matches);
      for (Match match : matches) {
        assertEquals(pattern.length, match.length());
        assertTrue(match.getEnd() <= text.length);
        assertFalse(match.hasPatternId());
      }
    }
  }

  @Test
  public void utf8ByteOffsets() {
    // "é" is two bytes in UTF-8.
    for (Algorithm algorithm : Algorithm.values()) {
      assertEquals(algorithm.getName(), Arrays.asList(new Match(3, 5), new Match(5, 7)),
                   algorithm.findAll("caféé", "é"));
    }
  }

  @Test
  public void agreesWithBruteForce() {
    Random random = new Random(20240101L);
    byte[][] alphabets = {
        ByteIndex.toBytes("ab"),
        ByteIndex.toBytes("abc"),
        {(byte) 0xff, 0x00, 0x7f, (byte) 0x80},
    };
    for (int round = 0; round < 500; ++round) {
      byte[] alphabet = alphabets[round % alphabets.length];
      byte[] text = BruteForce.randomBytes(random, alphabet, random.nextInt(64));
      byte[] pattern = BruteForce.randomBytes(random, alphabet, 1 + random.nextInt(6));
      List<Match> expected = BruteForce.findAll(text, pattern);
      for (Algorithm algorithm : Algorithm.values()) {
        assertEquals(algorithm.getName() + " on round " + round,
                     expected, algorithm.findAll(text, pattern));
      }
    }
  }

  @Test
  public void agreesOnPeriodicInputs() {
    String[][] cases = {
        {"abababababab", "abab"},
        {"aabaabaabaab", "aabaab"},
        {"abcabcabd", "abcabd"},
        {"aaaaaaaaab", "aaab"},
        {"baaaaaaaaa", "baaa"},
        {"abacabadabacaba", "abacaba"},
    };
    for (String[] c : cases) {
      byte[] text = ByteIndex.toBytes(c[0]);
      byte[] pattern = ByteIndex.toBytes(c[1]);
      List<Match> expected = BruteForce.findAll(text, pattern);
      for (Algorithm algorithm : Algorithm.values()) {
        assertEquals(algorithm.getName() + " on " + c[0], expected, algorithm.findAll(text, pattern));
      }
    }
  }

  @Test
  public void idempotent() {
    byte[] text = ByteIndex.toBytes("abracadabra abracadabra");
    byte[] pattern = ByteIndex.toBytes("abra");
    for (Algorithm algorithm : Algorithm.values()) {
      assertEquals(algorithm.findAll(text, pattern), algorithm.findAll(text, pattern));
    }
  }

  @Test
  public void doesNotModifyInput() {
    byte[] text = ByteIndex.toBytes("abcabc");
    byte[] pattern = ByteIndex.toBytes("bc");
    for (Algorithm algorithm : Algorithm.values()) {
      algorithm.findAll(text, pattern);
      assertEquals("abcabc", new String(text, StandardCharsets.UTF_8));
      assertEquals("bc", new String(pattern, StandardCharsets.UTF_8));
    }
  }

  @Test
  public void forName() {
    assertEquals(Algorithm.KMP, Algorithm.forName("kmp"));
    assertEquals(Algorithm.RABIN_KARP, Algorithm.forName("Rabin-Karp"));
    assertEquals(Algorithm.RABIN_KARP, Algorithm.forName("RABIN_KARP"));
    assertEquals(Algorithm.HORSPOOL, Algorithm.forName(" horspool "));
    assertEquals(Algorithm.BOYER_MOORE, Algorithm.forName("boyer-moore"));
    assertEquals(Algorithm.Z, Algorithm.forName("z"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void forUnknownName() {
    Algorithm.forName("bitap");
  }

  @Test
  public void rabinKarpUsesSettings() {
    SearchSettings settings = new SearchSettings(Algorithm.KMP, new RabinKarp(2, 3));
    assertEquals(Arrays.asList(new Match(0, 2), new Match(3, 5)),
                 Algorithm.RABIN_KARP.findAll(ByteIndex.toBytes("abxab"), ByteIndex.toBytes("ab"), settings));
  }
}
