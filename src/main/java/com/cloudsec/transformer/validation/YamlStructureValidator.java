package com.cloudsec.transformer.validation;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a template file parses as YAML and has the expected fields and field types
 *
 * <p>After {@link #validate(String)} the parsed document and line map are available to later
 * phases.
 */
public class YamlStructureValidator {
  static final List<String> REQUIRED_FIELDS =
      Arrays.asList("name", "input_schema", "output_schema", "extractors", "template");

  private static final Map<String, Class<?>> FIELD_TYPES = new LinkedHashMap<>();

  static {
    FIELD_TYPES.put("name", String.class);
    FIELD_TYPES.put("input_schema", String.class);
    FIELD_TYPES.put("output_schema", String.class);
    FIELD_TYPES.put("extractors", Map.class);
    FIELD_TYPES.put("template", String.class);
    FIELD_TYPES.put("filters", Map.class);
    FIELD_TYPES.put("conditionals", Map.class);
  }

  private final String templateFile;
  private final ObjectMapper yamlMapper;
  private LineMap lineMap;
  private Map<String, Object> parsed;

  private static String typeName(Object o) {
    if (o == null) {
      return "null";
    }
    if (o instanceof Map) {
      return "mapping";
    }
    if (o instanceof List) {
      return "sequence";
    }
    if (o instanceof String) {
      return "string";
    }
    return o.getClass().getSimpleName().toLowerCase();
  }

  private static String expectedName(Class<?> c) {
    return c == Map.class ? "mapping" : "string";
  }

  private ValidationError error(String message) {
    return new ValidationError(
        ValidationPhase.YAML_STRUCTURE, ValidationSeverity.ERROR, message, templateFile);
  }

  /**
   * Validate YAML text
   *
   * @param content Template file content
   * @return ValidationResult
   */
  @SuppressWarnings("unchecked")
  public ValidationResult validate(String content) {
    ValidationResult result = new ValidationResult(templateFile);
    lineMap = LineMap.build(content);
    parsed = null;

    if (content == null || content.trim().isEmpty()) {
      result.add(error("Template file is empty or contains only whitespace"));
      return result;
    }
    Object doc;
    try {
      doc = yamlMapper.readValue(content, Object.class);
    } catch (JsonProcessingException exc) {
      JsonLocation loc = exc.getLocation();
      result.add(
          error(String.format("YAML parsing error: %s", exc.getOriginalMessage()))
              .withLine(loc == null ? null : loc.getLineNr())
              .withColumn(loc == null ? null : loc.getColumnNr()));
      return result;
    }
    if (doc == null) {
      result.add(error("Template file is empty or contains only whitespace"));
      return result;
    }
    if (!(doc instanceof Map)) {
      result.add(
          error(String.format("Template must be a YAML mapping, got %s", typeName(doc))));
      return result;
    }
    parsed = (Map<String, Object>) doc;

    for (String f : REQUIRED_FIELDS) {
      if (!parsed.containsKey(f)) {
        result.add(
            error(String.format("Missing required field '%s'", f))
                .withFieldPath(f)
                .withSuggestion(String.format("Add the '%s' field to the template", f)));
      }
    }
    for (Map.Entry<String, Class<?>> e : FIELD_TYPES.entrySet()) {
      if (!parsed.containsKey(e.getKey())) {
        continue;
      }
      Object v = parsed.get(e.getKey());
      if (v == null && !REQUIRED_FIELDS.contains(e.getKey())) {
        continue;
      }
      if (!e.getValue().isInstance(v)) {
        result.add(
            error(
                    String.format(
                        "Field '%s' must be of type %s, got %s",
                        e.getKey(), expectedName(e.getValue()), typeName(v)))
                .withLine(lineMap.get(e.getKey()))
                .withFieldPath(e.getKey()));
      }
    }
    if (parsed.get("extractors") instanceof Map) {
      checkExtractors((Map<String, Object>) parsed.get("extractors"), result);
    }
    if (parsed.get("filters") instanceof Map) {
      checkFilters((Map<String, Object>) parsed.get("filters"), result);
    }
    return result;
  }

  private void checkExtractors(Map<String, Object> extractors, ValidationResult result) {
    if (extractors.isEmpty()) {
      result.add(
          error("Extractors section is empty - at least one extractor is required")
              .withLine(lineMap.get("extractors"))
              .withFieldPath("extractors"));
      return;
    }
    for (Map.Entry<String, Object> e : extractors.entrySet()) {
      String path = "extractors." + e.getKey();
      Object v = e.getValue();
      if (!(v instanceof String)) {
        result.add(
            error(
                    String.format(
                        "Extractor '%s' must have a string value (JSONPath expression)",
                        e.getKey()))
                .withLine(lineMap.get(path))
                .withFieldPath(path)
                .withRawValue(v == null ? null : truncate(String.valueOf(v), 100)));
      } else if (((String) v).trim().isEmpty()) {
        result.add(
            error(String.format("Extractor '%s' has an empty JSONPath expression", e.getKey()))
                .withLine(lineMap.get(path))
                .withFieldPath(path));
      }
    }
  }

  private void checkFilters(Map<String, Object> filters, ValidationResult result) {
    for (Map.Entry<String, Object> e : filters.entrySet()) {
      String path = "filters." + e.getKey();
      Object v = e.getValue();
      if (!(v instanceof String)) {
        result.add(
            error(String.format("Filter '%s' must have a string value (Groovy code)", e.getKey()))
                .withLine(lineMap.get(path))
                .withFieldPath(path));
      } else if (((String) v).trim().isEmpty()) {
        result.add(
            new ValidationError(
                    ValidationPhase.YAML_STRUCTURE,
                    ValidationSeverity.WARNING,
                    String.format("Filter '%s' has empty code", e.getKey()),
                    templateFile)
                .withLine(lineMap.get(path))
                .withFieldPath(path));
      }
    }
  }

  private static String truncate(String s, int n) {
    return s.length() > n ? s.substring(0, n) : s;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> mapField(String name) {
    if (parsed != null && parsed.get(name) instanceof Map) {
      return (Map<String, Object>) parsed.get(name);
    }
    return Collections.emptyMap();
  }

  /**
   * Parsed document
   *
   * @return Document, or null if the text did not parse to a mapping
   */
  public Map<String, Object> getParsed() {
    return parsed;
  }

  public Map<String, Object> getExtractors() {
    return mapField("extractors");
  }

  public Map<String, Object> getFilters() {
    return mapField("filters");
  }

  /**
   * Template body
   *
   * @return Body, or null if absent or not a string
   */
  public String getTemplateContent() {
    if (parsed != null && parsed.get("template") instanceof String) {
      return (String) parsed.get("template");
    }
    return null;
  }

  /**
   * Declared output schema
   *
   * @return Output schema, or null
   */
  public String getOutputSchema() {
    if (parsed != null && parsed.get("output_schema") instanceof String) {
      return (String) parsed.get("output_schema");
    }
    return null;
  }

  public LineMap getLineMap() {
    return lineMap;
  }

  /**
   * Create validator
   *
   * @param templateFile Template file path used in findings
   */
  public YamlStructureValidator(String templateFile) {
    this.templateFile = templateFile;
    yamlMapper = new ObjectMapper(new YAMLFactory());
  }
}
