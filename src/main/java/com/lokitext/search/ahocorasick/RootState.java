package com.lokitext.search.ahocorasick;

import java.util.Arrays;

import com.lokitext.search.ByteIndex;

/**
 * The root state. Every scan step that fails back to the root looks up
 * its goto table, so it is a dense table over all byte values.
 */
class RootState extends State {
  private final int[] table;
  private int size;

  RootState() {
    super(0);
    this.table = new int[ByteIndex.ALPHABET_SIZE];
    Arrays.fill(this.table, NO_STATE);
    this.size = 0;
  }

  @Override
  int get(byte key) {
    return this.table[ByteIndex.unsigned(key)];
  }

  @Override
  byte[] keys() {
    byte[] keys = new byte[this.size];
    int k = 0;
    for (int i = 0; i < this.table.length; ++i) {
      if (this.table[i] != NO_STATE) keys[k++] = (byte) i;
    }
    return keys;
  }

  @Override
  void put(byte key, int state) {
    int i = ByteIndex.unsigned(key);
    if (this.table[i] == NO_STATE) ++this.size;
    this.table[i] = state;
  }
}
