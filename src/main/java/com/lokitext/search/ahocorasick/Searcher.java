package com.lokitext.search.ahocorasick;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

import com.lokitext.search.Match;

/**
   Iterator over the matches of one scan. Holds its own cursor, so any
   number of searchers may run over the same automaton.

   <p>The automaton finds matches in order of their end offset. To hand
   them out by start offset instead, found matches wait in a small queue
   until no later match can start before them.</p>
 */
class Searcher implements Iterator<Match> {
  private final AhoCorasick automaton;
  private final byte[] text;
  private final PriorityQueue<Match> pending;
  private int state;
  private int index;  // Next text position to consume.

  Searcher(AhoCorasick automaton, byte[] text) {
    this.automaton = automaton;
    this.text = text;
    this.pending = new PriorityQueue<>();
    this.state = AhoCorasick.ROOT;
    this.index = 0;
  }

  @Override
  public boolean hasNext() {
    fill();
    return !this.pending.isEmpty();
  }

  @Override
  public Match next() {
    if (!hasNext()) throw new NoSuchElementException();
    return this.pending.poll();
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  // The head of the queue is final once it starts before any match that
  // ends at or after the next position could.
  private void fill() {
    while (this.index < this.text.length &&
           (this.pending.isEmpty() ||
            this.pending.peek().getStart() >= earliestNextStart())) {
      step();
    }
  }

  private int earliestNextStart() {
    return this.index + 1 - this.automaton.getMaxPatternLength();
  }

  private void step() {
    this.state = this.automaton.transition(this.state, this.text[this.index]);
    int end = this.index + 1;
    for (int patternId : this.automaton.getState(this.state).getOutputs()) {
      int start = end - this.automaton.getPatternLength(patternId);
      this.pending.add(new Match(start, end, patternId));
    }
    this.index = end;
  }
}
