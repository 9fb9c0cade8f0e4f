package com.cloudsec.transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;

public class TestFileUtil {
  public TestFileUtil() {}

  @Test
  public void readStringTest() throws Exception {
    Path p = Files.createTempFile("fileutil", ".txt");
    try {
      String content = "line one\nlíne twö ✓\n";
      Files.write(p, content.getBytes(StandardCharsets.UTF_8));
      assertTrue(FileUtil.exists(p.toString()));
      assertEquals(content, FileUtil.readString(p.toString()));
    } finally {
      Files.delete(p);
    }
  }

  @Test
  public void readEmptyFileTest() throws Exception {
    Path p = Files.createTempFile("fileutil", ".txt");
    try {
      assertEquals("", FileUtil.readString(p.toString()));
    } finally {
      Files.delete(p);
    }
  }

  @Test(expected = IOException.class)
  public void readMissingFileTest() throws Exception {
    assertFalse(FileUtil.exists("./target/test-classes/testdata/nothere.txt"));
    FileUtil.readString("./target/test-classes/testdata/nothere.txt");
  }
}
