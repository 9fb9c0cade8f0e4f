package com.cloudsec.transformer.template;

import com.cloudsec.transformer.FileUtil;
import com.cloudsec.transformer.filter.CustomFilterCompiler;
import com.cloudsec.transformer.filter.FilterCompilationException;
import com.cloudsec.transformer.filter.FilterRegistry;
import com.cloudsec.transformer.filter.FilterSource;
import com.cloudsec.transformer.mapping.EventTypeMapping;
import com.cloudsec.transformer.mapping.MappingRegistry;
import com.cloudsec.transformer.output.OutputFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves and loads transformation templates for an event type and output format
 *
 * <p>The template reference comes from the matched mapping's format key. A null reference
 * disables the combination, an absent key falls back to {@code <event_type>_<format>.yaml} in the
 * template directory. The template directory may be a class path resource directory or a file
 * system directory.
 */
public class TemplateLoader {
  public static final String DEFAULT_TEMPLATE_DIR = "/templates";

  private final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

  private final String templateDir;
  private final MappingRegistry registry;
  private final TemplateCache cache;
  private final ObjectMapper yamlMapper;

  /**
   * Test if the mapping explicitly disables a format
   *
   * @param eventType Event type
   * @param format Output format
   * @return True if the format's template reference is null
   */
  public boolean isDisabled(String eventType, OutputFormat format) {
    EventTypeMapping m = registry.get(eventType);
    return m != null && m.isTemplateDisabled(format);
  }

  /**
   * Resolve template path for an event type and format
   *
   * @param eventType Event type
   * @param format Output format
   * @return Path, or null if the combination is disabled or the reference is invalid
   */
  public String resolvePath(String eventType, OutputFormat format) {
    EventTypeMapping m = registry.get(eventType);
    if (m != null && m.declaresTemplate(format)) {
      String ref = m.getTemplateReference(format);
      if (ref == null) {
        return null;
      }
      if (ref.isEmpty()) {
        log.warn("invalid template filename for {} ({})", eventType, format);
        return null;
      }
      return join(ref);
    }
    return join(String.format("%s_%s.yaml", eventType, format.getName()));
  }

  private String join(String filename) {
    if (templateDir.endsWith("/")) {
      return templateDir + filename;
    }
    return templateDir + "/" + filename;
  }

  /**
   * Load template for an event type and format, throwing on a broken template file
   *
   * @param eventType Event type
   * @param format Output format
   * @return Template, or null if disabled or the template file does not exist
   * @throws TemplateLoadException if the template file cannot be parsed or compiled
   */
  public TemplateDefinition loadTemplate(String eventType, OutputFormat format)
      throws TemplateLoadException {
    TemplateDefinition t = cache.get(eventType, format);
    if (t != null) {
      return t;
    }
    if (isDisabled(eventType, format)) {
      log.debug("template explicitly disabled for {} ({})", eventType, format);
      return null;
    }
    String path = resolvePath(eventType, format);
    if (path == null) {
      return null;
    }
    if (!FileUtil.exists(path)) {
      log.warn("template file not found: {}", path);
      return null;
    }
    t = loadFile(path);
    cache.put(eventType, format, t);
    log.info("loaded transformation template {} ({})", t.getName(), format);
    return t;
  }

  /**
   * Load template for an event type and format
   *
   * @param eventType Event type
   * @param format Output format
   * @return Template, or null if disabled, missing or broken
   */
  public TemplateDefinition load(String eventType, OutputFormat format) {
    try {
      return loadTemplate(eventType, format);
    } catch (TemplateLoadException exc) {
      log.error("failed to load template for {} ({}): {}", eventType, format, exc.getMessage());
      return null;
    }
  }

  /**
   * Read, check and compile one template file
   *
   * @param path Resource or file system path
   * @return Compiled template definition
   * @throws TemplateLoadException if the file cannot be read, parsed or compiled
   */
  public TemplateDefinition loadFile(String path) throws TemplateLoadException {
    TemplateDefinition t;
    try {
      t = yamlMapper.readValue(FileUtil.readString(path), TemplateDefinition.class);
    } catch (IOException exc) {
      throw new TemplateLoadException(
          String.format("failed to read template %s: %s", path, exc.getMessage()), exc);
    }
    if (t == null) {
      throw new TemplateLoadException(String.format("template %s is empty", path));
    }
    if (t.getName() == null || t.getName().isEmpty()) {
      throw new TemplateLoadException(String.format("template %s missing name", path));
    }
    if (t.getExtractors().isEmpty()) {
      throw new TemplateLoadException(String.format("template %s has no extractors", path));
    }
    if (t.getTemplate() == null || t.getTemplate().trim().isEmpty()) {
      throw new TemplateLoadException(String.format("template %s has empty template body", path));
    }
    t.setSourcePath(path);

    FilterRegistry filters = FilterRegistry.builtin();
    if (!t.getFilters().isEmpty()) {
      try {
        filters =
            FilterRegistry.withCustom(
                new CustomFilterCompiler()
                    .compile(FilterSource.fromTemplateFile(path, t.getFilters())));
      } catch (FilterCompilationException exc) {
        throw new TemplateLoadException(
            String.format("template %s has invalid custom filters: %s", path, exc.getMessage()),
            exc);
      }
    }
    CompiledTemplate compiled;
    try {
      compiled = TemplateEngine.getDefault().compile(t.getName(), t.getTemplate(), filters);
    } catch (TemplateSyntaxException exc) {
      throw new TemplateLoadException(
          String.format("template %s has a syntax error: %s", path, exc.getMessage()), exc);
    }
    t.setCompiled(compiled, filters);
    return t;
  }

  private File templateDirectory() {
    File f = new File(templateDir);
    if (f.isDirectory()) {
      return f;
    }
    URL u = TemplateLoader.class.getResource(templateDir);
    if (u != null && "file".equals(u.getProtocol())) {
      try {
        return new File(u.toURI());
      } catch (URISyntaxException exc) {
        log.warn("template directory {} is not usable: {}", templateDir, exc.getMessage());
      }
    }
    return null;
  }

  /**
   * List event types that have a conventionally named template for a format
   *
   * @param format Output format
   * @return Sorted event types
   */
  public List<String> getSupportedTemplates(OutputFormat format) {
    ArrayList<String> ret = new ArrayList<>();
    File dir = templateDirectory();
    if (dir == null) {
      return ret;
    }
    String suffix = String.format("_%s.yaml", format.getName());
    String[] names = dir.list();
    if (names == null) {
      return ret;
    }
    for (String n : names) {
      if (n.endsWith(suffix)) {
        ret.add(n.substring(0, n.length() - suffix.length()));
      }
    }
    Collections.sort(ret);
    return ret;
  }

  /**
   * List supported event types for every output format
   *
   * @return Map of format to sorted event types
   */
  public Map<OutputFormat, List<String>> getAllSupportedTemplates() {
    LinkedHashMap<OutputFormat, List<String>> ret = new LinkedHashMap<>();
    for (OutputFormat f : OutputFormat.values()) {
      ret.put(f, getSupportedTemplates(f));
    }
    return ret;
  }

  /**
   * Check that the template for an event type and format loads and compiles
   *
   * <p>The cached entry, if any, is bypassed so the file on disk is checked.
   *
   * @param eventType Event type
   * @param format Output format
   * @return Null if the template is usable or disabled, otherwise a description of the problem
   */
  public String validateTemplate(String eventType, OutputFormat format) {
    if (isDisabled(eventType, format)) {
      return null;
    }
    String path = resolvePath(eventType, format);
    if (path == null || !FileUtil.exists(path)) {
      return String.format("template not found for %s (%s)", eventType, format);
    }
    try {
      loadFile(path);
    } catch (TemplateLoadException exc) {
      return exc.getMessage();
    }
    return null;
  }

  /**
   * Check every template referenced by the registry
   *
   * <p>Only combinations with an explicit template reference are checked.
   *
   * @return Problems keyed by {@code <event_type>_<format>}, empty if all templates are usable
   */
  public Map<String, String> validateAllTemplates() {
    LinkedHashMap<String, String> ret = new LinkedHashMap<>();
    for (String eventType : registry.getSupportedEventTypes()) {
      EventTypeMapping m = registry.get(eventType);
      for (OutputFormat f : OutputFormat.values()) {
        if (!m.declaresTemplate(f) || m.isTemplateDisabled(f)) {
          continue;
        }
        String problem = validateTemplate(eventType, f);
        if (problem != null) {
          ret.put(String.format("%s_%s", eventType, f.getName()), problem);
        }
      }
    }
    return ret;
  }

  public TemplateCache getCache() {
    return cache;
  }

  public String getTemplateDir() {
    return templateDir;
  }

  /**
   * Create loader
   *
   * @param templateDir Template directory, class path resource or file system path
   * @param registry Mapping registry used for template references
   */
  public TemplateLoader(String templateDir, MappingRegistry registry) {
    this.templateDir = templateDir == null ? DEFAULT_TEMPLATE_DIR : templateDir;
    this.registry = registry;
    cache = new TemplateCache();
    yamlMapper = new ObjectMapper(new YAMLFactory());
  }
}
