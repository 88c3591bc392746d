package com.lokitext.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.io.ByteStreams;
import com.lokitext.search.Algorithm;
import com.lokitext.search.ByteIndex;
import com.lokitext.search.Match;
import com.lokitext.search.SearchSettings;
import com.lokitext.search.ahocorasick.AhoCorasick;
import com.lokitext.utils.Args;
import com.lokitext.utils.FileUtil;
import com.lokitext.utils.PatternLineProcessor;
import com.lokitext.utils.StringUtil;

import static com.lokitext.utils.Args.options;

/**
 * Command line search tool.
 *
 * <pre>
 *   loki-text [--algorithm kmp|z|rabin-karp|boyer-moore|horspool]
 *             (--pattern TEXT)... [--patterns-file PATH]
 *             [--text TEXT | --file PATH] [--json] [--count]
 * </pre>
 *
 * One pattern runs the chosen single-pattern algorithm; several patterns
 * or a patterns file run Aho-Corasick. Input is read from stdin when
 * neither --text nor --file is given. Offsets are UTF-8 byte offsets.
 */
public class SearchMain {
  private static final Logger log = LoggerFactory.getLogger(SearchMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;

  static final String USAGE = "Usage: loki-text [--algorithm NAME] (--pattern TEXT)... "
      + "[--patterns-file PATH] [--text TEXT | --file PATH] [--json] [--count]";

  String algorithmName;
  final List<String> patterns = new ArrayList<>();
  String patternsFile;
  String text;
  String file;
  boolean json;
  boolean countOnly;

  public static void main(String[] args) {
    int status = new SearchMain().run(args, System.in, System.out, System.err);
    if (status != EXIT_OK) System.exit(status);
  }

  /** Parses args into this instance's fields. */
  void parseArgs(String... args) {
    List<String> unknown = new ArrayList<>();
    Args.match()
        .on(options("--algorithm", "-a"), value -> algorithmName = value)
        .on(options("--pattern", "-p"), patterns::add)
        .on("--patterns-file", value -> patternsFile = value)
        .on(options("--text", "-t"), value -> text = value)
        .on(options("--file", "-f"), value -> file = value)
        .on("--json", () -> json = true)
        .on("--count", () -> countOnly = true)
        .rest(unknown::addAll)
        .parse(args);
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + unknown);
    }
    if (text != null && file != null) {
      throw new IllegalArgumentException("--text and --file are mutually exclusive");
    }
  }

  int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    List<Match> matches;
    byte[] input;
    AhoCorasick automaton = null;
    try {
      parseArgs(args);
      if (patternsFile != null) {
        patterns.addAll(PatternLineProcessor.load(patternsFile));
      }
      if (patterns.isEmpty()) {
        throw new IllegalArgumentException("At least one pattern is required");
      }
      input = readInput(in);

      Stopwatch stopwatch = Stopwatch.createStarted();
      if (patterns.size() == 1 && patternsFile == null) {
        SearchSettings settings = SearchSettings.getInstance();
        Algorithm algorithm = algorithmName == null
            ? settings.getDefaultAlgorithm() : Algorithm.forName(algorithmName);
        matches = algorithm.findAll(input, ByteIndex.toBytes(patterns.get(0)), settings);
        log.debug("{} found {} match(es) in {}", algorithm, matches.size(), stopwatch);
      } else {
        if (algorithmName != null) {
          log.warn("--algorithm is ignored when searching for several patterns");
        }
        automaton = AhoCorasick.builder().addAll(patterns).build();
        matches = automaton.scanAll(input);
        log.debug("Aho-Corasick found {} match(es) in {}", matches.size(), stopwatch);
      }
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      err.println(USAGE);
      return EXIT_USAGE;
    } catch (IOException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_USAGE;
    }

    print(matches, input, automaton, out);
    return EXIT_OK;
  }

  private void print(List<Match> matches, byte[] input, AhoCorasick automaton, PrintStream out) {
    if (countOnly) {
      out.println(matches.size());
    } else if (json) {
      List<MatchView> views = new ArrayList<>();
      for (Match match : matches) views.add(new MatchView(match, input));
      out.println(StringUtil.toJson(views));
    } else {
      Iterator<Match> iter = matches.iterator();
      while (iter.hasNext()) {
        Match match = iter.next();
        String matched = matchedText(match, input);
        if (automaton == null) {
          out.printf("%d\t%d\t%s%n", match.getStart(), match.getEnd(), matched);
        } else {
          out.printf("%d\t%d\t%d\t%s%n", match.getStart(), match.getEnd(),
              match.getPatternId(), matched);
        }
      }
    }
  }

  private byte[] readInput(InputStream in) throws IOException {
    if (text != null) return ByteIndex.toBytes(text);
    if (file != null) return FileUtil.readResourceAsBytes(file);
    return ByteStreams.toByteArray(in);
  }

  static String matchedText(Match match, byte[] input) {
    return ByteIndex.toString(Arrays.copyOfRange(input, match.getStart(), match.getEnd()));
  }

  /** JSON shape of one match. */
  static class MatchView {
    final int start;
    final int end;
    final Integer patternId;
    final String text;

    MatchView(Match match, byte[] input) {
      this.start = match.getStart();
      this.end = match.getEnd();
      this.patternId = match.getPatternId();
      this.text = matchedText(match, input);
    }
  }
}
