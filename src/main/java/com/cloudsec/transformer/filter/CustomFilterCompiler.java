package com.cloudsec.transformer.filter;

import com.cloudsec.transformer.ScriptRunner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.codehaus.groovy.control.CompilationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the custom filters of one template
 *
 * <p>All filter definitions of a template are compiled together into a single sandboxed script
 * before any of them is registered, so a filter may call any other filter of the same template
 * by name.
 */
public class CustomFilterCompiler {
  private final Logger log = LoggerFactory.getLogger(CustomFilterCompiler.class);

  private final ScriptRunner runner;

  /** Create compiler backed by a new {@link ScriptRunner} */
  public CustomFilterCompiler() {
    runner = new ScriptRunner();
  }

  /**
   * Compile filter source into template filters
   *
   * @param source Filter source read from a template file
   * @return Filters keyed by name, in declaration order
   * @throws FilterCompilationException if the source does not compile in the sandbox or a
   *     declared filter is not defined
   */
  public Map<String, TemplateFilter> compile(FilterSource source)
      throws FilterCompilationException {
    if (source.isEmpty()) {
      return Collections.emptyMap();
    }
    String scriptName = source.getOrigin();
    try {
      runner.loadScript(scriptName, source.combinedSource());
    } catch (CompilationFailedException exc) {
      throw new FilterCompilationException(
          null,
          String.format("custom filters in %s failed to compile: %s", scriptName, exc.getMessage()),
          exc);
    }
    List<String> defined = runner.definedMethods(scriptName);
    LinkedHashMap<String, TemplateFilter> ret = new LinkedHashMap<>();
    for (String name : source.getFilters().keySet()) {
      if (!defined.contains(name)) {
        throw new FilterCompilationException(
            name,
            String.format("custom filter %s does not define a function named %s", name, name));
      }
      ret.put(name, new ScriptFilter(runner, scriptName, name));
    }
    log.info("compiled {} custom filters from {}", ret.size(), scriptName);
    return ret;
  }

  /** Filter backed by a method of a compiled script */
  private static class ScriptFilter implements TemplateFilter {
    private final ScriptRunner runner;
    private final String script;
    private final String method;

    ScriptFilter(ScriptRunner runner, String script, String method) {
      this.runner = runner;
      this.script = script;
      this.method = method;
    }

    @Override
    public Object apply(Object value, List<Object> args, Map<String, Object> kwargs) {
      ArrayList<Object> callArgs = new ArrayList<>();
      callArgs.add(value);
      for (Object a : args) {
        callArgs.add(a);
      }
      if (!kwargs.isEmpty()) {
        LinkedHashMap<String, Object> named = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : kwargs.entrySet()) {
          named.put(e.getKey(), e.getValue());
        }
        callArgs.add(named);
      }
      return normalize(runner.invokeMethod(script, method, Object.class, callArgs.toArray()));
    }

    private static Object normalize(Object o) {
      if (o instanceof CharSequence && !(o instanceof String)) {
        return o.toString();
      }
      if (o instanceof Integer || o instanceof Short || o instanceof Byte) {
        return ((Number) o).longValue();
      }
      return o;
    }
  }
}
