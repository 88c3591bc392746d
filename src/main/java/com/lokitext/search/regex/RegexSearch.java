package com.lokitext.search.regex;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lokitext.search.Algorithm;
import com.lokitext.search.ByteIndex;
import com.lokitext.search.Match;

/**
 * Regular-expression search on top of java.util.regex. Patterns without
 * any regex syntax skip the regex engine and go through Boyer-Moore.
 *
 * <p>Texts are expected to be well-formed UTF-16, since the literal path
 * works on their UTF-8 encoding.</p>
 */
public class RegexSearch {
  private static final Logger log = LoggerFactory.getLogger(RegexSearch.class);

  private static final String REGEX_META_CHARS = "\\^$.|?*+()[]{}";

  /**
   * Counts the non-overlapping, case-insensitive matches of regex.
   *
   * @throws PatternSyntaxException if regex is invalid
   */
  public static int countPattern(String text, String regex) {
    checkNotNull(text);
    checkNotNull(regex);
    Matcher m = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                       .matcher(text);
    int count = 0;
    while (m.find()) ++count;
    return count;
  }

  /**
   * Returns the first capture group of the first match of regex, or null if
   * regex is invalid, does not match, or has no capture group.
   */
  public static String findPattern(String text, String regex) {
    checkNotNull(text);
    checkNotNull(regex);
    Pattern pattern;
    try {
      pattern = Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      log.debug("Invalid pattern {}: {}", regex, e.getDescription());
      return null;
    }
    Matcher m = pattern.matcher(text);
    if (!m.find() || m.groupCount() < 1) return null;
    return m.group(1);
  }

  /**
   * Returns true if regex matches only itself, i.e. contains no regex
   * syntax.
   */
  public static boolean isLiteral(String regex) {
    return !regex.isEmpty() && StringUtils.containsNone(regex, REGEX_META_CHARS);
  }

  /**
   * Keeps the leftmost of every run of overlapping matches, the way a regex
   * engine reports them. Input must be sorted by start.
   */
  public static List<Match> nonOverlapping(List<Match> matches) {
    List<Match> result = new ArrayList<>();
    int lastEnd = 0;
    for (Match match : matches) {
      if (match.getStart() < lastEnd) continue;
      result.add(match);
      lastEnd = match.getEnd();
    }
    return result;
  }

  /**
   * Replaces every non-overlapping match of regex with replacement.
   *
   * <p>The replacement refers to groups as $1, $name or ${name}; the
   * unbraced form takes the longest run of letters, digits and
   * underscores. A group that does not exist or did not participate is
   * replaced by the empty string. $$ is a literal dollar sign, a $ that
   * starts no reference is kept as is, and backslashes are not special.</p>
   *
   * @throws PatternSyntaxException if regex is invalid
   */
  public static String replacePattern(String text, String regex, String replacement) {
    checkNotNull(text);
    checkNotNull(regex);
    checkNotNull(replacement);
    if (isLiteral(regex) && replacement.indexOf('$') < 0) {
      return replaceLiteral(text, regex, replacement);
    }
    Matcher m = Pattern.compile(regex).matcher(text);
    StringBuilder sb = new StringBuilder(text.length());
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(expandReplacement(m, replacement)));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /**
   * Substitutes the group references of replacement with the groups of
   * the current match of m.
   */
  static String expandReplacement(Matcher m, String replacement) {
    StringBuilder out = new StringBuilder();
    int n = replacement.length();
    int i = 0;
    while (i < n) {
      char c = replacement.charAt(i);
      if (c != '$' || i + 1 == n) {
        out.append(c);
        ++i;
        continue;
      }
      char next = replacement.charAt(i + 1);
      if (next == '$') {
        out.append('$');
        i += 2;
        continue;
      }

      int nameStart;
      int nameEnd;
      int after;
      if (next == '{') {
        int close = replacement.indexOf('}', i + 2);
        if (close <= i + 2) {  // Unclosed or empty braces.
          out.append(c);
          ++i;
          continue;
        }
        nameStart = i + 2;
        nameEnd = close;
        after = close + 1;
      } else {
        nameStart = i + 1;
        nameEnd = nameStart;
        while (nameEnd < n && isGroupNameChar(replacement.charAt(nameEnd))) ++nameEnd;
        if (nameEnd == nameStart) {
          out.append(c);
          ++i;
          continue;
        }
        after = nameEnd;
      }
      out.append(StringUtils.defaultString(group(m, replacement.substring(nameStart, nameEnd))));
      i = after;
    }
    return out.toString();
  }

  // Null if the group is unknown or did not participate in the match.
  private static String group(Matcher m, String name) {
    if (NumberUtils.isDigits(name)) {
      int index = NumberUtils.toInt(name, -1);
      if (index < 0 || index > m.groupCount()) return null;
      return m.group(index);
    }
    try {
      return m.group(name);
    } catch (IllegalArgumentException e) {
      log.debug("No group named {}", name);
      return null;
    }
  }

  private static boolean isGroupNameChar(char c) {
    return c == '_' || (c < 0x80 && Character.isLetterOrDigit(c));
  }

  static String replaceLiteral(String text, String literal, String replacement) {
    byte[] bytes = ByteIndex.toBytes(text);
    List<Match> matches = nonOverlapping(
        Algorithm.BOYER_MOORE.findAll(bytes, ByteIndex.toBytes(literal)));
    log.debug("Literal fast path for \"{}\": {} match(es)", literal, matches.size());
    if (matches.isEmpty()) return text;

    byte[] replacementBytes = ByteIndex.toBytes(replacement);
    ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
    int copied = 0;
    for (Match match : matches) {
      out.write(bytes, copied, match.getStart() - copied);
      out.write(replacementBytes, 0, replacementBytes.length);
      copied = match.getEnd();
    }
    out.write(bytes, copied, bytes.length - copied);
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private RegexSearch() {
  }
}
