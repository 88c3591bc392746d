package com.lokitext.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.ByteStreams;
import com.google.common.io.CharSource;

public class FileUtil {

  static final Logger log = LogManager.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  /**
   * Looks up filename as a file first, then on the class path.
   *
   * @throws FileNotFoundException if it is in neither place
   */
  public static CharSource findResourceAsCharSource(String filename)
      throws IOException {
    InputStream stream = findResourceAsStream(filename);
    if (stream == null) throw new FileNotFoundException(
        "Could not locate: " + filename);
    return inputStreamToCharSource(stream);
  }

  /**
   * Returns a stream over filename, looked up as a file first and then on
   * the class path, or null if neither exists. Names ending in .gz are
   * decompressed.
   */
  public static InputStream findResourceAsStream(String filename) {
    checkNotNull(filename);
    InputStream stream = null;

    // First, lookup the file directly.
    File f = new File(filename);
    if (f.isFile()) {
      try { stream = new FileInputStream(f); }
      catch (FileNotFoundException e) {
        log.warn("Could not open {}: {}", filename, e.getMessage());
      }
    }
    if (stream == null) {
      // Second, lookup the file in class-path.
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      stream = classLoader.getResourceAsStream(filename);
    }
    if (stream != null && filename.matches(COMPRESSED_FILE_RE)) {
      try { stream = new GZIPInputStream(stream); }
      catch (IOException e) {
        log.error("Could not decompress {}: {}", filename, e.getMessage());
        closeQuietly(stream);
        stream = null;
      }
    }
    if (stream == null) log.error("Could not locate: {}", filename);
    return stream;
  }

  public static CharSource inputStreamToCharSource(
      final InputStream inputStream) {
    return new CharSource() {
        @Override
        public Reader openStream() throws IOException {
            return new BufferedReader(new InputStreamReader(inputStream,
                                      StandardCharsets.UTF_8));
        }
    };
  }

  /**
   * Reads filename (file or class-path resource) fully.
   *
   * @throws FileNotFoundException if it cannot be located
   */
  public static byte[] readResourceAsBytes(String filename) throws IOException {
    InputStream stream = findResourceAsStream(filename);
    if (stream == null) throw new FileNotFoundException(
        "Could not locate: " + filename);
    try (InputStream in = stream) {
      return ByteStreams.toByteArray(in);
    }
  }

  private static void closeQuietly(InputStream stream) {
    try {
      stream.close();
    } catch (IOException e) {
      log.debug("Error closing stream: {}", e.getMessage());
    }
  }

  private FileUtil() {
  }
}
