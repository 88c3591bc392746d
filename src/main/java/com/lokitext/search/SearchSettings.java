package com.lokitext.search;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Search configuration. Defaults come from loki-text.properties on the
 * class path; system properties and then environment variables override
 * them.
 */
public class SearchSettings {
  private static final Logger log = LoggerFactory.getLogger(SearchSettings.class);

  public static final String RESOURCE_NAME = "loki-text.properties";

  public static final String ALGORITHM_KEY = "lokitext.algorithm";
  public static final String RABIN_KARP_BASE_KEY = "lokitext.rabinkarp.base";
  public static final String RABIN_KARP_MODULUS_KEY = "lokitext.rabinkarp.modulus";

  private static SearchSettings instance = null;

  public static synchronized SearchSettings getInstance() {
    if (instance == null) {
      instance = load(loadResource(RESOURCE_NAME), System.getProperties(), System.getenv());
    }
    return instance;
  }

  /**
   * Builds settings from defaults, overridden by overrides, overridden by
   * environment. Environment keys are the property keys upper-cased with
   * dots replaced by underscores, e.g. LOKITEXT_ALGORITHM.
   */
  public static SearchSettings load(Properties defaults, Properties overrides,
                                    Map<String, String> environment) {
    Properties merged = new Properties();
    merged.putAll(defaults);
    for (String key : new String[] {
        ALGORITHM_KEY, RABIN_KARP_BASE_KEY, RABIN_KARP_MODULUS_KEY }) {
      String value = overrides.getProperty(key);
      String envValue = environment.get(toEnvironmentKey(key));
      if (StringUtils.isNotBlank(envValue)) value = envValue;
      if (StringUtils.isNotBlank(value)) merged.setProperty(key, value.trim());
    }

    Algorithm algorithm = Algorithm.forName(
        merged.getProperty(ALGORITHM_KEY, Algorithm.KMP.getName()));
    long base = parseLong(merged, RABIN_KARP_BASE_KEY, RabinKarp.DEFAULT_BASE);
    long modulus = parseLong(merged, RABIN_KARP_MODULUS_KEY, RabinKarp.DEFAULT_MODULUS);
    SearchSettings settings = new SearchSettings(algorithm, new RabinKarp(base, modulus));
    log.debug("Loaded search settings: {}", settings);
    return settings;
  }

  static Properties loadResource(String name) {
    Properties properties = new Properties();
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(name)) {
      if (in == null) {
        log.warn("Could not locate {}, using built-in defaults", name);
      } else {
        properties.load(in);
      }
    } catch (IOException e) {
      log.error("Error reading {}: {}", name, e.getMessage());
    }
    return properties;
  }

  private static long parseLong(Properties properties, String key, long defaultValue) {
    String value = properties.getProperty(key);
    if (StringUtils.isBlank(value)) return defaultValue;
    if (!NumberUtils.isDigits(value)) {
      throw new IllegalArgumentException(String.format(
          "%s must be a positive integer: \"%s\"", key, value));
    }
    return NumberUtils.toLong(value, defaultValue);
  }

  static String toEnvironmentKey(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_');
  }

  private final Algorithm defaultAlgorithm;
  private final RabinKarp rabinKarp;

  public SearchSettings(Algorithm defaultAlgorithm, RabinKarp rabinKarp) {
    this.defaultAlgorithm = defaultAlgorithm;
    this.rabinKarp = rabinKarp;
  }

  public Algorithm getDefaultAlgorithm() {
    return this.defaultAlgorithm;
  }

  public RabinKarp getRabinKarp() {
    return this.rabinKarp;
  }

  @Override
  public String toString() {
    return String.format("SearchSettings(algorithm=%s, %s)", this.defaultAlgorithm, this.rabinKarp);
  }
}
