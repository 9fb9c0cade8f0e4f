package com.cloudsec.transformer.template;

import com.cloudsec.transformer.filter.FilterRegistry;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transformation template read from a YAML template file
 *
 * <p>Once loaded the definition also carries the compiled template body and the filters the body
 * renders with, so neither is rebuilt per event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDefinition {
  private String name;
  private String description;
  private String inputSchema;
  private String outputSchema;
  private LinkedHashMap<String, String> extractors;
  private String template;
  private LinkedHashMap<String, String> filters;
  private LinkedHashMap<String, Object> conditionals;

  private String sourcePath;
  private CompiledTemplate compiled;
  private FilterRegistry filterRegistry;

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @JsonProperty("description")
  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  @JsonProperty("input_schema")
  public String getInputSchema() {
    return inputSchema;
  }

  public void setInputSchema(String inputSchema) {
    this.inputSchema = inputSchema;
  }

  @JsonProperty("output_schema")
  public String getOutputSchema() {
    return outputSchema;
  }

  public void setOutputSchema(String outputSchema) {
    this.outputSchema = outputSchema;
  }

  /**
   * Extractor JSONPath expressions keyed by field name
   *
   * @return Map in declaration order, never null
   */
  @JsonProperty("extractors")
  public Map<String, String> getExtractors() {
    return extractors == null ? Collections.<String, String>emptyMap() : extractors;
  }

  public void setExtractors(LinkedHashMap<String, String> extractors) {
    this.extractors = extractors;
  }

  @JsonProperty("template")
  public String getTemplate() {
    return template;
  }

  public void setTemplate(String template) {
    this.template = template;
  }

  /**
   * Custom filter source keyed by filter name
   *
   * @return Map in declaration order, never null
   */
  @JsonProperty("filters")
  public Map<String, String> getFilters() {
    return filters == null ? Collections.<String, String>emptyMap() : filters;
  }

  public void setFilters(LinkedHashMap<String, String> filters) {
    this.filters = filters;
  }

  @JsonProperty("conditionals")
  public Map<String, Object> getConditionals() {
    return conditionals == null ? Collections.<String, Object>emptyMap() : conditionals;
  }

  public void setConditionals(LinkedHashMap<String, Object> conditionals) {
    this.conditionals = conditionals;
  }

  @JsonIgnore
  public String getSourcePath() {
    return sourcePath;
  }

  void setSourcePath(String sourcePath) {
    this.sourcePath = sourcePath;
  }

  @JsonIgnore
  public CompiledTemplate getCompiled() {
    return compiled;
  }

  @JsonIgnore
  public FilterRegistry getFilterRegistry() {
    return filterRegistry;
  }

  void setCompiled(CompiledTemplate compiled, FilterRegistry filterRegistry) {
    this.compiled = compiled;
    this.filterRegistry = filterRegistry;
  }

  /**
   * Render the compiled template body
   *
   * @param context Render context
   * @return Rendered text
   */
  public String render(Map<String, Object> context) {
    if (compiled == null) {
      throw new IllegalStateException(String.format("template %s has not been compiled", name));
    }
    return compiled.render(context, filterRegistry);
  }
}
