package com.lokitext.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileUtilTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void readsClassPathResource() throws IOException {
    String content = FileUtil.findResourceAsCharSource("keywords.dict").read();
    assertEquals("# sample dictionary", content.split("\n")[0]);
  }

  @Test
  public void readsCompressedFile() throws IOException {
    File file = folder.newFile("text.gz");
    try (OutputStream out = new GZIPOutputStream(new FileOutputStream(file))) {
      out.write("ushers".getBytes(StandardCharsets.UTF_8));
    }
    assertArrayEquals("ushers".getBytes(StandardCharsets.UTF_8),
                      FileUtil.readResourceAsBytes(file.getPath()));
  }

  @Test
  public void missingResource() {
    assertNull(FileUtil.findResourceAsStream("no-such-file.txt"));
  }

  @Test(expected = FileNotFoundException.class)
  public void missingBytes() throws IOException {
    FileUtil.readResourceAsBytes("no-such-file.txt");
  }
}
