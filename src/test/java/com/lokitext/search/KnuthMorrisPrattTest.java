package com.lokitext.search;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class KnuthMorrisPrattTest {

  @Test
  public void prefixTable() {
    assertArrayEquals(new int[] {0, 0, 1, 2}, KnuthMorrisPratt.prefixTable(ByteIndex.toBytes("abab")));
    assertArrayEquals(new int[] {0, 1, 0, 1, 2, 2, 3},
                      KnuthMorrisPratt.prefixTable(ByteIndex.toBytes("aabaaab")));
    assertArrayEquals(new int[] {0, 0, 0}, KnuthMorrisPratt.prefixTable(ByteIndex.toBytes("abc")));
    assertArrayEquals(new int[] {0}, KnuthMorrisPratt.prefixTable(ByteIndex.toBytes("a")));
  }

  @Test
  public void findsOverlappingOccurrences() {
    List<Match> matches = KnuthMorrisPratt.findAll(ByteIndex.toBytes("abababa"), ByteIndex.toBytes("aba"));
    assertEquals(Arrays.asList(new Match(0, 3), new Match(2, 5), new Match(4, 7)), matches);
  }

  @Test
  public void fallsBackOnMismatch() {
    List<Match> matches = KnuthMorrisPratt.findAll(ByteIndex.toBytes("aabaaabaaab"), ByteIndex.toBytes("aaab"));
    assertEquals(Arrays.asList(new Match(3, 7), new Match(7, 11)), matches);
  }

  @Test
  public void noMatch() {
    assertTrue(KnuthMorrisPratt.findAll(ByteIndex.toBytes("hello"), ByteIndex.toBytes("world")).isEmpty());
    assertTrue(KnuthMorrisPratt.findAll(new byte[0], ByteIndex.toBytes("a")).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyPattern() {
    KnuthMorrisPratt.findAll(ByteIndex.toBytes("abc"), new byte[0]);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void resultIsUnmodifiable() {
    KnuthMorrisPratt.findAll(ByteIndex.toBytes("aa"), ByteIndex.toBytes("a")).add(new Match(0, 1));
  }
}
