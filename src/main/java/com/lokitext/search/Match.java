package com.lokitext.search;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Range;

/**
 * An occurrence of a pattern inside a text, as the half-open byte range
 * [start, end).
 */
public class Match implements Comparable<Match> {
  private final int start;          // Begin offset in the text.
  private final int end;            // End offset in the text (exclusively).
  private final Integer patternId;  // Null for single-pattern searches.

  public Match(int start, int end) {
    this(start, end, null);
  }

  public Match(int start, int end, Integer patternId) {
    checkArgument(start >= 0 && end >= start, "Invalid match range [%s, %s)", start, end);
    this.start = start;
    this.end = end;
    this.patternId = patternId;
  }

  @Override
  public int compareTo(Match other) {
    int r = Integer.compare(this.start, other.start);
    if (r != 0) return r;
    r = Integer.compare(this.patternId == null ? -1 : this.patternId,
                        other.patternId == null ? -1 : other.patternId);
    if (r != 0) return r;
    return Integer.compare(this.end, other.end);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Match other = (Match) obj;
    if (this.start != other.start)
      return false;
    if (this.end != other.end)
      return false;
    if (this.patternId == null) {
      if (other.patternId != null)
        return false;
    } else if (!this.patternId.equals(other.patternId))
      return false;
    return true;
  }

  public int getEnd() {
    return this.end;
  }

  /**
   * Returns the id of the matched pattern within its pattern set, or null
   * when the match comes from a single-pattern search.
   */
  public Integer getPatternId() {
    return this.patternId;
  }

  public Range<Integer> getRange() {
    return Range.closedOpen(this.start, this.end);
  }

  public int getStart() {
    return this.start;
  }

  public boolean hasPatternId() {
    return this.patternId != null;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + this.start;
    result = prime * result + this.end;
    result = prime * result + ((this.patternId == null) ? 0 : this.patternId.hashCode());
    return result;
  }

  public boolean isOverlap(Match other) {
    return this.start < other.end && this.end > other.start;
  }

  public int length() {
    return this.end - this.start;
  }

  @Override
  public String toString() {
    if (this.patternId == null) return this.getRange().toString();
    return String.format("#%d %s", this.patternId, this.getRange());
  }
}
