package com.cloudsec.transformer.filter;

import com.hubspot.jinjava.interpret.JinjavaInterpreter;
import com.hubspot.jinjava.lib.filter.Filter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Exposes a {@link TemplateFilter} to the Jinjava engine under a fixed name */
public class JinjavaFilter implements Filter {
  private final String name;
  private final TemplateFilter filter;

  /**
   * Create adapter
   *
   * @param name Name the filter is applied by
   * @param filter Filter implementation
   */
  public JinjavaFilter(String name, TemplateFilter filter) {
    this.name = name;
    this.filter = filter;
  }

  @Override
  public String getName() {
    return name;
  }

  public TemplateFilter getFilter() {
    return filter;
  }

  @Override
  public Object filter(
      Object var, JinjavaInterpreter interpreter, Object[] args, Map<String, Object> kwargs) {
    List<Object> a = args == null ? Collections.<Object>emptyList() : Arrays.asList(args);
    Map<String, Object> k = kwargs == null ? Collections.<String, Object>emptyMap() : kwargs;
    return filter.apply(var, a, k);
  }

  @Override
  public Object filter(Object var, JinjavaInterpreter interpreter, String... args) {
    return filter(var, interpreter, (Object[]) args, Collections.<String, Object>emptyMap());
  }
}
