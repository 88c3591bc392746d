package com.lokitext.search;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class BoyerMooreTest {

  @Test
  public void badCharacterTable() {
    int[] table = BoyerMoore.badCharacterTable(ByteIndex.toBytes("abcab"));
    assertEquals(3, table['a']);
    assertEquals(4, table['b']);
    assertEquals(2, table['c']);
    assertEquals(-1, table['d']);
    assertEquals(-1, table[0xff]);
  }

  @Test
  public void goodSuffixTable() {
    assertArrayEquals(new int[] {2, 2, 2, 4, 1}, BoyerMoore.goodSuffixTable(ByteIndex.toBytes("abab")));
    // After a full match the shift is the period of the pattern.
    assertEquals(1, BoyerMoore.goodSuffixTable(ByteIndex.toBytes("aaaa"))[0]);
    assertEquals(3, BoyerMoore.goodSuffixTable(ByteIndex.toBytes("abcabcab"))[0]);
    assertEquals(3, BoyerMoore.goodSuffixTable(ByteIndex.toBytes("abc"))[0]);
  }

  @Test
  public void findAll() {
    assertEquals(Arrays.asList(new Match(17, 24)),
                 BoyerMoore.findAll(ByteIndex.toBytes("HERE IS A SIMPLE EXAMPLE"),
                                    ByteIndex.toBytes("EXAMPLE")));
    assertEquals(Arrays.asList(new Match(0, 5), new Match(3, 8), new Match(6, 11)),
                 BoyerMoore.findAll(ByteIndex.toBytes("abcabcabcab"), ByteIndex.toBytes("abcab")));
  }

  @Test
  public void highBytes() {
    byte[] text = {0x01, (byte) 0xfe, (byte) 0xfe, 0x01, (byte) 0xfe};
    byte[] pattern = {(byte) 0xfe, 0x01};
    assertEquals(Arrays.asList(new Match(2, 4)), BoyerMoore.findAll(text, pattern));
  }
}
