package com.lokitext.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Single-pass string transforms.
 */
public class StringUtil {
  public static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

  private static final CharMatcher PUNCTUATION = CharMatcher.anyOf(ASCII_PUNCTUATION);
  private static final Pattern NUMBER_PATTERN =
      Pattern.compile("\\d+", Pattern.UNICODE_CHARACTER_CLASS);

  private static Gson gson = null;

  /**
   * Upper-cases the first character of every whitespace-separated word and
   * joins the words with single spaces.
   */
  public static String capitalizeWords(String text) {
    List<String> words = new ArrayList<>();
    for (String word : Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().split(text)) {
      int first = word.codePointAt(0);
      String head = new String(Character.toChars(first)).toUpperCase(Locale.ROOT);
      words.add(head + word.substring(Character.charCount(first)));
    }
    return Joiner.on(' ').join(words);
  }

  public static List<String> extractNumbers(String text) {
    List<String> numbers = new ArrayList<>();
    Matcher m = NUMBER_PATTERN.matcher(text);
    while (m.find()) {
      numbers.add(m.group());
    }
    return numbers;
  }

  public static synchronized Gson getGsonInstance() {
    if (gson == null) gson = new GsonBuilder().disableHtmlEscaping().create();
    return gson;
  }

  public static boolean isEmptyOrWhitespace(String text) {
    return StringUtils.isBlank(text);
  }

  /**
   * Returns true if the letters and digits of text read the same in both
   * directions, ignoring ASCII case.
   */
  public static boolean isPalindrome(String text) {
    int[] cleaned = text.codePoints().filter(Character::isLetterOrDigit).toArray();
    for (int i = 0, j = cleaned.length - 1; i < j; ++i, --j) {
      if (!equalsIgnoreAsciiCase(cleaned[i], cleaned[j])) return false;
    }
    return true;
  }

  public static String joinText(Iterable<String> parts, String delimiter) {
    return Joiner.on(delimiter).join(parts);
  }

  public static String removePunctuation(String text) {
    return PUNCTUATION.removeFrom(text);
  }

  /**
   * Reverses text by code point, so surrogate pairs stay intact.
   */
  public static String reverse(String text) {
    return new StringBuilder(text).reverse().toString();
  }

  /**
   * Splits text on every occurrence of delimiter, keeping empty pieces.
   *
   * @throws IllegalArgumentException if delimiter is empty
   */
  public static List<String> splitText(String text, String delimiter) {
    return Splitter.on(delimiter).splitToList(text);
  }

  public static String toJson(Object o) {
    return getGsonInstance().toJson(o);
  }

  public static String toLowerCase(String text) {
    return text.toLowerCase(Locale.ROOT);
  }

  public static String toUpperCase(String text) {
    return text.toUpperCase(Locale.ROOT);
  }

  public static String trimWhitespace(String text) {
    return StringUtils.strip(text);
  }

  private static boolean equalsIgnoreAsciiCase(int a, int b) {
    if (a == b) return true;
    if (a < 128 && b < 128) return Character.toLowerCase(a) == Character.toLowerCase(b);
    return false;
  }

  private StringUtil() {
  }
}
