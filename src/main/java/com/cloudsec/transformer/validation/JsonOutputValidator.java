package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.filter.FilterRegistry;
import com.cloudsec.transformer.filter.TemplateFilter;
import com.cloudsec.transformer.template.CompiledTemplate;
import com.cloudsec.transformer.template.TemplateEngine;
import com.cloudsec.transformer.template.TemplateRenderException;
import com.cloudsec.transformer.template.TemplateSyntaxException;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a template against synthetic data and checks that the output is a JSON document
 *
 * <p>Render failures are attributed to the synthetic data and are not reported. Custom filters
 * are replaced by pass-through functions so no template supplied code runs during validation.
 */
public class JsonOutputValidator {
  private final Logger log = LoggerFactory.getLogger(JsonOutputValidator.class);

  private static final TemplateFilter PASSTHROUGH = (value, args, kwargs) -> value;

  private final String templateFile;
  private final LineMap lineMap;
  private final ObjectMapper mapper;
  private Map<String, Object> output;

  static String suggestionFor(String message, String rendered, int offset) {
    String m = message == null ? "" : message.toLowerCase();
    if (m.contains("trailing comma")
        || (m.contains("unexpected character") && m.contains("expecting double-quote"))) {
      return "Check for trailing commas before closing braces } or ]";
    }
    if (m.contains("expecting comma") || m.contains("was expecting a colon")) {
      return "Check for missing commas between array elements or object properties";
    }
    if (m.contains("trailing token")) {
      return "Check for content after the closing brace of the JSON object";
    }
    if (m.contains("end-of-input") && m.contains("string")) {
      return "Check for unclosed quotes or unescaped special characters in strings";
    }
    if (m.contains("escape") || m.contains("control character")) {
      return "Check for improperly escaped characters - use json_escape filter for string values";
    }
    if (offset > 0 && offset < rendered.length()) {
      String around =
          rendered.substring(Math.max(0, offset - 20), Math.min(rendered.length(), offset + 20));
      if (around.contains(",]") || around.contains(", ]")) {
        return "Remove trailing comma before closing bracket ]";
      }
      if (around.contains(",}") || around.contains(", }")) {
        return "Remove trailing comma before closing brace }";
      }
      if (around.contains("}{")) {
        return "Check for missing comma between objects";
      }
    }
    return "Review the JSON structure for syntax errors";
  }

  /**
   * Build the synthetic render context
   *
   * @param extractors Mock extractor values
   * @return Context
   */
  static Map<String, Object> mockContext(Map<String, Object> extractors) {
    HashMap<String, Object> ctx = new HashMap<>();
    Map<String, Object> event = MockValues.providerEvent();
    ctx.put("extractors", extractors);
    ctx.put(
        "config",
        ImmutableMap.of(
            "event_source", "mock.source.example.com",
            "user_agent", "MockValidator/1.0",
            "ocsf_class", "security_finding"));
    ctx.put("account_id", "123456789012");
    ctx.put("aws_account_id", "123456789012");
    ctx.put("region", "us-east-1");
    ctx.put("aws_region", "us-east-1");
    ctx.put("event_type", "mock_event");
    ctx.put("timestamp", MockValues.MOCK_TIMESTAMP);
    ctx.put("azure_event", event);
    ctx.put("gcp_event", event);
    ctx.put("event", event);
    return ctx;
  }

  /**
   * Render and parse the template
   *
   * @param content Template body
   * @param compiled Parsed template, or null to parse here
   * @param extractors Declared extractor names
   * @param customFilters Declared custom filter names
   * @return ValidationResult
   */
  @SuppressWarnings("unchecked")
  public ValidationResult validate(
      String content,
      CompiledTemplate compiled,
      Collection<String> extractors,
      Collection<String> customFilters) {
    ValidationResult result = new ValidationResult(templateFile);
    output = null;
    if (content == null || content.isEmpty()) {
      return result;
    }
    if (compiled == null) {
      try {
        compiled = TemplateEngine.getDefault().parse(templateFile, content);
      } catch (TemplateSyntaxException exc) {
        log.debug("skipping output check of {}, template does not parse", templateFile);
        return result;
      }
    }
    TemplateUsage usage = TemplateUsage.of(compiled);
    LinkedHashMap<String, TemplateFilter> custom = new LinkedHashMap<>();
    for (String f : customFilters) {
      custom.put(f, PASSTHROUGH);
    }

    String rendered;
    try {
      rendered =
          compiled.render(
              mockContext(MockValues.extractors(extractors, usage)),
              FilterRegistry.withCustom(custom));
    } catch (TemplateRenderException exc) {
      log.debug("mock render of {} failed, not reported: {}", templateFile, exc.getMessage());
      return result;
    }

    Object parsed;
    try {
      parsed = mapper.readValue(rendered, Object.class);
    } catch (JsonProcessingException exc) {
      JsonLocation loc = exc.getLocation();
      int offset = loc == null ? -1 : (int) loc.getCharOffset();
      result.add(
          new ValidationError(
                  ValidationPhase.JSON_OUTPUT,
                  ValidationSeverity.ERROR,
                  String.format(
                      "Rendered template is not valid JSON: %s", exc.getOriginalMessage()),
                  templateFile)
              .withLine(
                  loc == null || lineMap == null ? null : lineMap.templateLine(loc.getLineNr()))
              .withFieldPath("template")
              .withRawValue(excerpt(rendered, offset))
              .withSuggestion(suggestionFor(exc.getOriginalMessage(), rendered, offset)));
      return result;
    }
    if (!(parsed instanceof Map)) {
      result.add(
          new ValidationError(
                  ValidationPhase.JSON_OUTPUT,
                  ValidationSeverity.ERROR,
                  "Rendered template is not a JSON object",
                  templateFile)
              .withFieldPath("template"));
      return result;
    }
    output = (Map<String, Object>) parsed;
    return result;
  }

  private static String excerpt(String rendered, int offset) {
    if (offset < 0 || offset > rendered.length()) {
      return null;
    }
    return rendered
        .substring(Math.max(0, offset - 30), Math.min(rendered.length(), offset + 30))
        .trim();
  }

  /**
   * Parsed output of the last successful render
   *
   * @return Output, or null if rendering was skipped or the output was not a JSON object
   */
  public Map<String, Object> getOutput() {
    return output;
  }

  /**
   * Create validator
   *
   * @param templateFile Template file path used in findings
   * @param lineMap Line map of the template file, may be null
   */
  public JsonOutputValidator(String templateFile, LineMap lineMap) {
    this.templateFile = templateFile;
    this.lineMap = lineMap;
    mapper = new ObjectMapper();
  }
}
