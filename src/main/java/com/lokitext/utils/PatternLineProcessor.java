package com.lokitext.utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.io.LineProcessor;

/**
 * Reads a pattern dictionary: one pattern per line, surrounding whitespace
 * trimmed, blank lines and lines starting with '#' skipped.
 */
public class PatternLineProcessor implements LineProcessor<List<String>> {
  private static final Logger log = LoggerFactory.getLogger(PatternLineProcessor.class);

  public static final String COMMENT_PREFIX = "#";
  public static final int DEFAULT_MIN_CHARS = 1;

  /**
   * Loads the dictionary at path (file or class-path resource).
   */
  public static List<String> load(String path) throws IOException {
    return load(path, DEFAULT_MIN_CHARS, false);
  }

  public static List<String> load(String path, int minChars, boolean isIgnoreCase)
      throws IOException {
    log.info("Loading patterns from: {}", path);
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<String> patterns = FileUtil.findResourceAsCharSource(path)
        .readLines(new PatternLineProcessor(minChars, isIgnoreCase));
    log.info("Loaded {} pattern(s) in {}", patterns.size(), stopwatch);
    return patterns;
  }

  private final List<String> patterns;
  private final int minChars;
  private final boolean isIgnoreCase;
  private int skipped;

  public PatternLineProcessor(int minChars, boolean isIgnoreCase) {
    this.patterns = new ArrayList<>();
    this.minChars = Math.max(1, minChars);
    this.isIgnoreCase = isIgnoreCase;
    this.skipped = 0;
  }

  @Override
  public List<String> getResult() {
    if (this.skipped > 0) {
      log.debug("Skipped {} line(s) shorter than {} chars", this.skipped, this.minChars);
    }
    return ImmutableList.copyOf(this.patterns);
  }

  @Override
  public boolean processLine(String line) throws IOException {
    line = line.trim();
    if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) return true;
    if (line.length() < this.minChars) {
      ++this.skipped;
      return true;
    }
    if (this.isIgnoreCase) line = line.toLowerCase(Locale.ROOT);
    this.patterns.add(line);
    return true;
  }
}
