package com.cloudsec.transformer.validation;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps dotted field paths of a YAML document to the line each key is declared on
 *
 * <p>The map is built by tracking key indentation, not by a full YAML parse. Keys inside block
 * scalars that happen to look like mapping keys may be recorded; lookups for real fields are
 * unaffected since those keys nest under the scalar's own key.
 */
public class LineMap {
  private static final Pattern KEY =
      Pattern.compile(
          "^(?:\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^']|'')*)'|([a-zA-Z0-9_][a-zA-Z0-9_-]*))"
              + "\\s*:(?:\\s|$)");

  private final HashMap<String, Integer> lines;
  private final String[] source;

  private static class Frame {
    final int indent;
    final String key;

    Frame(int indent, String key) {
      this.indent = indent;
      this.key = key;
    }
  }

  /**
   * Build line map from YAML text
   *
   * @param content YAML text
   * @return LineMap
   */
  public static LineMap build(String content) {
    return new LineMap(content == null ? "" : content);
  }

  private static String keyOf(Matcher m) {
    if (m.group(1) != null) {
      return m.group(1).replace("\\\"", "\"");
    }
    if (m.group(2) != null) {
      return m.group(2).replace("''", "'");
    }
    return m.group(3);
  }

  private LineMap(String content) {
    lines = new HashMap<>();
    source = content.split("\n", -1);
    Deque<Frame> stack = new ArrayDeque<>();
    for (int i = 0; i < source.length; i++) {
      String line = source[i];
      String stripped = line.replaceAll("^\\s+", "");
      if (stripped.isEmpty() || stripped.startsWith("#")) {
        continue;
      }
      int indent = line.length() - stripped.length();
      Matcher m = KEY.matcher(stripped);
      if (!m.find()) {
        continue;
      }
      String key = keyOf(m);
      while (!stack.isEmpty() && stack.peekLast().indent >= indent) {
        stack.removeLast();
      }
      StringBuilder path = new StringBuilder();
      for (Frame f : stack) {
        path.append(f.key).append('.');
      }
      path.append(key);
      lines.putIfAbsent(path.toString(), i + 1);
      stack.addLast(new Frame(indent, key));
    }
  }

  /**
   * Line a field is declared on
   *
   * @param fieldPath Dotted path, for example {@code extractors.alert_id}
   * @return Line number starting at 1, or null if unknown
   */
  public Integer get(String fieldPath) {
    return lines.get(fieldPath);
  }

  /**
   * Convert a line of the template body to a line of the file
   *
   * <p>A block scalar body ({@code template: |}) starts on the line after the key, an inline
   * value on the key's own line.
   *
   * @param templateLine Line within the template body, starting at 1
   * @return File line, or null if the template key was not found
   */
  public Integer templateLine(int templateLine) {
    Integer start = lines.get("template");
    if (start == null) {
      return null;
    }
    String value = source[start - 1].replaceFirst("^\\s*template\\s*:", "").trim();
    boolean block = value.startsWith("|") || value.startsWith(">");
    return block ? start + templateLine : start + templateLine - 1;
  }

  /**
   * All recorded paths
   *
   * @return Unmodifiable map of path to line
   */
  public Map<String, Integer> getLines() {
    return Collections.unmodifiableMap(lines);
  }
}
