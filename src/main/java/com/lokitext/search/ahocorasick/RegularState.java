package com.lokitext.search.ahocorasick;

import java.util.Arrays;

/**
 * A non-root state. Most trie states have very few children, so the goto
 * map is kept as two parallel arrays searched linearly.
 */
class RegularState extends State {
  private static final byte[] EMPTY_BYTES = new byte[0];
  private static final int[] EMPTY_INTS = new int[0];

  private byte[] keys = EMPTY_BYTES;
  private int[] targets = EMPTY_INTS;

  RegularState(int depth) {
    super(depth);
  }

  @Override
  int get(byte key) {
    byte[] keys = this.keys;
    for (int i = 0; i < keys.length; ++i) {
      if (keys[i] == key) return this.targets[i];
    }
    return NO_STATE;
  }

  @Override
  byte[] keys() {
    return this.keys;
  }

  @Override
  void put(byte key, int state) {
    for (int i = 0; i < this.keys.length; ++i) {
      if (this.keys[i] == key) {
        this.targets[i] = state;
        return;
      }
    }
    byte[] newKeys = Arrays.copyOf(this.keys, this.keys.length + 1);
    newKeys[newKeys.length - 1] = key;
    int[] newTargets = Arrays.copyOf(this.targets, this.targets.length + 1);
    newTargets[newTargets.length - 1] = state;
    this.keys = newKeys;
    this.targets = newTargets;
  }
}
