package com.cloudsec.transformer.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filters available to one template
 *
 * <p>Built-in filters are registered with the template engine once. Custom filters declared by
 * the template are layered on top for each render and take precedence over a built-in of the
 * same name.
 */
public class FilterRegistry {
  private static final FilterRegistry BUILTIN =
      new FilterRegistry(Collections.<String, TemplateFilter>emptyMap());

  private final Map<String, TemplateFilter> custom;

  private FilterRegistry(Map<String, TemplateFilter> custom) {
    this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(custom));
  }

  /**
   * Registry holding only built-in filters
   *
   * @return FilterRegistry
   */
  public static FilterRegistry builtin() {
    return BUILTIN;
  }

  /**
   * Create registry of built-in filters extended with custom filters
   *
   * @param custom Custom filters keyed by name
   * @return FilterRegistry
   */
  public static FilterRegistry withCustom(Map<String, TemplateFilter> custom) {
    if (custom == null || custom.isEmpty()) {
      return BUILTIN;
    }
    return new FilterRegistry(custom);
  }

  /**
   * Names of the filters in {@link BuiltinFilters}
   *
   * @return Sorted set
   */
  public static Set<String> builtinNames() {
    return Collections.unmodifiableSet(new TreeSet<>(BuiltinFilters.all().keySet()));
  }

  /**
   * Look up a filter, custom filters first
   *
   * @param name Filter name
   * @return Filter, or null if neither a custom nor a built-in filter has the name
   */
  public TemplateFilter getFilter(String name) {
    TemplateFilter f = custom.get(name);
    return f != null ? f : BuiltinFilters.all().get(name);
  }

  /**
   * Custom filters keyed by name
   *
   * @return Unmodifiable map
   */
  public Map<String, TemplateFilter> getCustom() {
    return custom;
  }

  /**
   * Custom filters wrapped for registration with the template engine
   *
   * @return List of engine filters
   */
  public List<JinjavaFilter> customEngineFilters() {
    ArrayList<JinjavaFilter> ret = new ArrayList<>();
    for (Map.Entry<String, TemplateFilter> e : custom.entrySet()) {
      ret.add(new JinjavaFilter(e.getKey(), e.getValue()));
    }
    return ret;
  }
}
