package com.lokitext.search.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.lokitext.search.ByteIndex;
import com.lokitext.search.Match;

/**
   <p>An implementation of the Aho-Corasick multi-pattern string searching
   automaton over bytes.</p>

   <p>The automaton is built once from a pattern set and never changes
   afterwards, so a single instance may be scanned by many threads at once.
   Pattern ids are assigned in insertion order starting at 0; the same
   pattern text may be added twice and then reports under both ids.</p>

   <p>
   Example usage:
   <code><pre>
       AhoCorasick automaton = AhoCorasick.builder()
           .add("he").add("she").add("his").add("hers")
           .build();

       Iterator&lt;Match&gt; matches = automaton.scan("ushers");
       while (matches.hasNext()) {
           Match match = matches.next();
           System.out.println(match.getPatternId() + " at " + match.getRange());
       }
   </pre></code>
   </p>
 */
public class AhoCorasick {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasick.class);

  /** Id of the root state. */
  static final int ROOT = 0;

  /**
   * Builds an automaton over the given patterns, assigning ids in list
   * order.
   *
   * @throws IllegalArgumentException if the list is empty or contains an
   *     empty pattern
   */
  public static AhoCorasick build(List<byte[]> patterns) {
    checkNotNull(patterns, "patterns cannot be null");
    Builder builder = builder();
    for (byte[] pattern : patterns) {
      builder.add(pattern);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private final State[] states;
  private final byte[][] patterns;
  private final int maxPatternLength;

  private AhoCorasick(State[] states, byte[][] patterns) {
    this.states = states;
    this.patterns = patterns;
    int max = 0;
    for (byte[] pattern : patterns) {
      max = Math.max(max, pattern.length);
    }
    this.maxPatternLength = max;
  }

  public int getMaxPatternLength() {
    return this.maxPatternLength;
  }

  /**
   * Returns a copy of the pattern with the given id.
   */
  public byte[] getPattern(int patternId) {
    checkElementIndex(patternId, this.patterns.length, "patternId");
    return this.patterns[patternId].clone();
  }

  public int getPatternCount() {
    return this.patterns.length;
  }

  public int getPatternLength(int patternId) {
    checkElementIndex(patternId, this.patterns.length, "patternId");
    return this.patterns[patternId].length;
  }

  /**
   * Returns true if bytes is a prefix of at least one pattern.
   */
  public boolean hasPrefix(byte[] bytes) {
    checkNotNull(bytes);
    int state = ROOT;
    for (byte b : bytes) {
      state = this.states[state].get(b);
      if (state == State.NO_STATE) return false;
    }
    return true;
  }

  /**
   * Starts a lazy scan over text. Matches come out in increasing start
   * order, ties broken by pattern id.
   */
  public Iterator<Match> scan(byte[] text) {
    checkNotNull(text, "text cannot be null");
    return new Searcher(this, text);
  }

  /**
   * Scans the UTF-8 encoding of text; offsets are byte offsets.
   */
  public Iterator<Match> scan(String text) {
    return scan(ByteIndex.toBytes(text));
  }

  /**
   * Eager form of {@link #scan(byte[])}.
   */
  public List<Match> scanAll(byte[] text) {
    List<Match> matches = new ArrayList<>();
    Iterator<Match> iter = this.scan(text);
    while (iter.hasNext()) {
      matches.add(iter.next());
    }
    return Collections.unmodifiableList(matches);
  }

  public List<Match> scanAll(String text) {
    return scanAll(ByteIndex.toBytes(text));
  }

  /**
   * Returns the number of states, root included.
   */
  public int size() {
    return this.states.length;
  }

  State getState(int id) {
    return this.states[id];
  }

  /**
   * Follows the goto transition on b from state, falling back along fail
   * links as needed. The root loops to itself on bytes it has no
   * transition for.
   */
  int transition(int state, byte b) {
    int next;
    while ((next = this.states[state].get(b)) == State.NO_STATE) {
      if (state == ROOT) return ROOT;
      state = this.states[state].getFail();
    }
    return next;
  }

  /**
   * Collects patterns and builds the trie as they are added. Not thread
   * safe; a builder can only be built once.
   */
  public static class Builder {
    private final List<State> states;
    private final List<byte[]> patterns;
    private boolean isBuilt;

    Builder() {
      this.states = new ArrayList<>();
      this.states.add(new RootState());
      this.patterns = new ArrayList<>();
      this.isBuilt = false;
    }

    /**
     * Adds a pattern and returns its id.
     */
    public int addPattern(byte[] pattern) {
      checkState(!this.isBuilt, "Can't add patterns after build() is called.");
      checkNotNull(pattern, "pattern cannot be null");
      checkArgument(pattern.length > 0, "pattern %s cannot be empty",
                    this.patterns.size());

      int patternId = this.patterns.size();
      this.patterns.add(pattern.clone());
      int state = ROOT;
      for (byte b : pattern) {
        state = extend(state, b);
      }
      this.states.get(state).addOutput(patternId);
      return patternId;
    }

    public Builder add(byte[] pattern) {
      this.addPattern(pattern);
      return this;
    }

    public Builder add(String pattern) {
      return this.add(ByteIndex.toBytes(pattern));
    }

    public Builder addAll(Iterable<String> patterns) {
      for (String pattern : patterns) {
        this.add(pattern);
      }
      return this;
    }

    /**
     * Links fail transitions, merges outputs along them and freezes the
     * automaton.
     *
     * @throws IllegalArgumentException if no pattern was added
     */
    public AhoCorasick build() {
      checkState(!this.isBuilt, "build() was already called.");
      checkArgument(!this.patterns.isEmpty(), "pattern set cannot be empty");

      Stopwatch stopwatch = Stopwatch.createStarted();
      linkFailTransitions();
      this.isBuilt = true;

      AhoCorasick automaton = new AhoCorasick(
          this.states.toArray(new State[0]),
          this.patterns.toArray(new byte[0][]));
      log.debug("Built automaton of {} states for {} patterns in {}",
                automaton.size(), automaton.getPatternCount(), stopwatch);
      return automaton;
    }

    private int extend(int state, byte b) {
      State current = this.states.get(state);
      int next = current.get(b);
      if (next != State.NO_STATE) return next;
      next = this.states.size();
      this.states.add(new RegularState(current.getDepth() + 1));
      current.put(b, next);
      return next;
    }

    /*
     * Breadth-first, so every fail target is shallower than the state being
     * linked and already has its final output set when it is merged in.
     */
    private void linkFailTransitions() {
      Queue<Integer> queue = new ArrayDeque<>();
      State root = this.states.get(ROOT);
      for (byte b : root.keys()) {
        int child = root.get(b);
        this.states.get(child).setFail(ROOT);
        queue.add(child);
      }

      while (!queue.isEmpty()) {
        State current = this.states.get(queue.remove());
        for (byte b : current.keys()) {
          int failState = current.getFail();
          while (failState != ROOT && this.states.get(failState).get(b) == State.NO_STATE) {
            failState = this.states.get(failState).getFail();
          }
          int nextFail = this.states.get(failState).get(b);
          if (nextFail == State.NO_STATE) nextFail = ROOT;

          int next = current.get(b);
          State nextState = this.states.get(next);
          nextState.setFail(nextFail);
          nextState.addOutputs(this.states.get(nextFail).getOutputs());
          queue.add(next);
        }
      }
    }
  }
}
