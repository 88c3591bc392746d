package com.lokitext.search.ahocorasick;

import java.util.Arrays;

/**
 * A state of the automaton. States live in an array owned by
 * {@link AhoCorasick} and refer to each other by index only.
 */
abstract class State {
  /** Returned by {@link #get(byte)} when no transition exists. */
  static final int NO_STATE = -1;

  private static final int[] EMPTY_INTS = new int[0];

  private final int depth;
  private int fail = AhoCorasick.ROOT;
  // Sorted ascending, no duplicates.
  private int[] outputs = EMPTY_INTS;

  State(int depth) {
    this.depth = depth;
  }

  void addOutput(int patternId) {
    int pos = Arrays.binarySearch(this.outputs, patternId);
    if (pos >= 0) return;
    int insertAt = -pos - 1;
    int[] newOutputs = new int[this.outputs.length + 1];
    System.arraycopy(this.outputs, 0, newOutputs, 0, insertAt);
    newOutputs[insertAt] = patternId;
    System.arraycopy(this.outputs, insertAt, newOutputs, insertAt + 1,
                     this.outputs.length - insertAt);
    this.outputs = newOutputs;
  }

  void addOutputs(int[] patternIds) {
    for (int id : patternIds) {
      this.addOutput(id);
    }
  }

  /**
   * Returns the target of the goto transition on key, or NO_STATE.
   */
  abstract int get(byte key);

  int getDepth() {
    return this.depth;
  }

  int getFail() {
    return this.fail;
  }

  /**
   * Returns the ids of all patterns ending at this state, in insertion
   * order. Callers must not modify the returned array.
   */
  int[] getOutputs() {
    return this.outputs;
  }

  /**
   * Returns the bytes that have a goto transition out of this state.
   */
  abstract byte[] keys();

  abstract void put(byte key, int state);

  void setFail(int fail) {
    this.fail = fail;
  }
}
