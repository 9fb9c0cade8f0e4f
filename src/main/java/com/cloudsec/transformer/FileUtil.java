package com.cloudsec.transformer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.io.IOUtils;

/** Various utilities for file IO */
public class FileUtil {
  /**
   * Read file from specified path, returning an {@link InputStream} for processing
   *
   * <p>This supports both class path resources and files on the local file system. A resource
   * with the given path is preferred; if none is found the path is treated as a file system path.
   *
   * @param path Resource path or file system path to read file from
   * @throws IOException IOException
   * @return {@link InputStream} for reading resource
   */
  public static InputStream getStreamFromPath(String path) throws IOException {
    if (path == null || path.isEmpty()) {
      throw new IOException("attempt to load file with null or empty path");
    }
    InputStream in = FileUtil.class.getResourceAsStream(path);
    if (in == null) {
      Path p = Paths.get(path);
      if (Files.isRegularFile(p)) {
        in = Files.newInputStream(p);
      }
    }
    if (in == null) {
      throw new IOException(String.format("failed to read file from path %s", path));
    }
    return in;
  }

  /**
   * Read entire contents of file at specified path as a UTF-8 string
   *
   * @param path Resource path or file system path
   * @throws IOException IOException
   * @return File contents
   */
  public static String readString(String path) throws IOException {
    try (InputStream in = getStreamFromPath(path)) {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    }
  }

  /**
   * Test if a resource or file exists at the specified path
   *
   * @param path Resource path or file system path
   * @return True if readable content exists at path
   */
  public static boolean exists(String path) {
    if (path == null || path.isEmpty()) {
      return false;
    }
    if (FileUtil.class.getResource(path) != null) {
      return true;
    }
    return Files.isRegularFile(Paths.get(path));
  }
}
