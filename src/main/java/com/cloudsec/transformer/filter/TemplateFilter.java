package com.cloudsec.transformer.filter;

import java.util.List;
import java.util.Map;

/** A named function applied to a value with the {@code value | name(args)} syntax */
@FunctionalInterface
public interface TemplateFilter {
  /**
   * Apply the filter
   *
   * @param value Input value, null when the expression is undefined
   * @param args Positional arguments
   * @param kwargs Keyword arguments
   * @return Filtered value
   */
  Object apply(Object value, List<Object> args, Map<String, Object> kwargs);
}
