package com.lokitext.search;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Range;

public class MatchTest {

  @Test
  public void ordering() {
    List<Match> matches = new ArrayList<>(Arrays.asList(
        new Match(2, 6, 3), new Match(2, 4, 0), new Match(1, 4, 1)));
    Collections.sort(matches);
    assertEquals(Arrays.asList(new Match(1, 4, 1), new Match(2, 4, 0), new Match(2, 6, 3)), matches);
  }

  @Test
  public void equality() {
    assertEquals(new Match(1, 3), new Match(1, 3));
    assertEquals(new Match(1, 3).hashCode(), new Match(1, 3).hashCode());
    assertNotEquals(new Match(1, 3), new Match(1, 3, 0));
    assertNotEquals(new Match(1, 3, 1), new Match(1, 3, 0));
  }

  @Test
  public void rangeAndOverlap() {
    Match match = new Match(2, 5);
    assertEquals(Range.closedOpen(2, 5), match.getRange());
    assertEquals(3, match.length());
    assertTrue(match.isOverlap(new Match(4, 6)));
    assertFalse(match.isOverlap(new Match(5, 6)));
    assertEquals("[2..5)", match.toString());
    assertEquals("#4 [2..5)", new Match(2, 5, 4).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void invalidRange() {
    new Match(3, 2);
  }

  @Test
  public void invalidRangeMessage() {
    try {
      new Match(-1, 2, 0);
      fail("negative start accepted");
    } catch (IllegalArgumentException e) {
      assertEquals("Invalid match range [-1, 2)", e.getMessage());
    }
  }
}
