package com.cloudsec.transformer.classify;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Resolve dot separated key paths such as {@code records[0].Type} against nested maps */
public class NestedValueResolver {
  private static final Pattern INDEXED = Pattern.compile("^(.+)\\[(\\d+)\\]$");
  private static final Splitter DOT = Splitter.on('.');

  private NestedValueResolver() {}

  /**
   * Resolve path against data
   *
   * @param data Root map
   * @param path Dot path, segments may carry a single array index suffix
   * @return Value at path, or null if any segment is missing
   */
  public static Object resolve(Map<String, Object> data, String path) {
    if (data == null || path == null || path.isEmpty()) {
      return null;
    }
    Object current = data;
    for (String seg : DOT.split(path)) {
      Matcher m = INDEXED.matcher(seg);
      String key = seg;
      int index = -1;
      if (m.matches()) {
        key = m.group(1);
        index = Integer.parseInt(m.group(2));
      }
      if (!(current instanceof Map)) {
        return null;
      }
      current = ((Map<?, ?>) current).get(key);
      if (current == null) {
        return null;
      }
      if (index >= 0) {
        if (!(current instanceof List)) {
          return null;
        }
        List<?> l = (List<?>) current;
        if (index >= l.size()) {
          return null;
        }
        current = l.get(index);
        if (current == null) {
          return null;
        }
      }
    }
    return current;
  }

  /**
   * Test if path resolves to a present value
   *
   * <p>Paths containing a dot must resolve to a non-null, non-empty-string value. Simple keys only
   * need to be present in the root map.
   *
   * @param data Root map
   * @param path Key or dot path
   * @return boolean
   */
  public static boolean isPresent(Map<String, Object> data, String path) {
    if (data == null || path == null) {
      return false;
    }
    if (path.indexOf('.') < 0 && !INDEXED.matcher(path).matches()) {
      return data.containsKey(path);
    }
    Object v = resolve(data, path);
    return v != null && !"".equals(v);
  }

  /**
   * Test if path resolves to a value other than null or the empty string
   *
   * @param data Root map
   * @param path Dotted path
   * @return boolean
   */
  public static boolean hasValue(Map<String, Object> data, String path) {
    Object v = resolve(data, path);
    return v != null && !"".equals(v);
  }

  /**
   * Resolve path and render the value as a string for comparison
   *
   * @param data Root map
   * @param path Dot path
   * @return String value, empty string if missing
   */
  public static String resolveString(Map<String, Object> data, String path) {
    Object v = resolve(data, path);
    if (v == null) {
      return "";
    }
    return v.toString();
  }
}
