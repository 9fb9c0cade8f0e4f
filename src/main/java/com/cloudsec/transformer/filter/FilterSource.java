package com.cloudsec.transformer.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom filter source declared by a template file
 *
 * <p>This is the trust boundary for executable filter code. Instances are created only from the
 * {@code filters} section of a template file read from the template directory; filter code is
 * never taken from event content. Declaration order is kept so later filters may call earlier
 * ones.
 */
public class FilterSource {
  private final String origin;
  private final Map<String, String> filters;

  private FilterSource(String origin, Map<String, String> filters) {
    this.origin = origin;
    this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
  }

  /**
   * Create filter source from a template file's filters section
   *
   * @param templatePath Path of the template file the code was read from
   * @param filters Filter name to Groovy source, in declaration order
   * @return FilterSource
   */
  public static FilterSource fromTemplateFile(String templatePath, Map<String, String> filters) {
    if (templatePath == null || templatePath.isEmpty()) {
      throw new IllegalArgumentException("filter source requires a template file origin");
    }
    return new FilterSource(
        templatePath, filters == null ? Collections.<String, String>emptyMap() : filters);
  }

  /**
   * Template file the source was read from
   *
   * @return Path
   */
  public String getOrigin() {
    return origin;
  }

  /**
   * Filter definitions keyed by filter name
   *
   * @return Unmodifiable map in declaration order
   */
  public Map<String, String> getFilters() {
    return filters;
  }

  public boolean isEmpty() {
    return filters.isEmpty();
  }

  /**
   * Combined script text holding every filter definition
   *
   * @return Groovy source
   */
  public String combinedSource() {
    StringBuilder sb = new StringBuilder();
    for (String code : filters.values()) {
      sb.append(code == null ? "" : code).append("\n\n");
    }
    return sb.toString();
  }
}
