package com.cloudsec.transformer.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import freemarker.cache.ClassTemplateLoader;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;

/** Formats validation results as a console report or as JSON */
public class ValidationReport {
  private static final String TEXT_TEMPLATE = "report.ftl";
  private static final int MAX_VALUE_LENGTH = 60;

  private final boolean color;
  private final Configuration cfg;
  private final ObjectMapper mapper;

  private String ansi(String code) {
    return color ? "\u001B[" + code + "m" : "";
  }

  private String severityColor(ValidationSeverity s) {
    switch (s) {
      case ERROR:
        return ansi("91");
      case WARNING:
        return ansi("93");
      default:
        return ansi("94");
    }
  }

  static String truncate(String value) {
    if (value == null || value.length() <= MAX_VALUE_LENGTH) {
      return value;
    }
    return value.substring(0, MAX_VALUE_LENGTH - 3) + "...";
  }

  private HashMap<String, Object> issueModel(String name, ValidationError e) {
    HashMap<String, Object> m = new HashMap<>();
    m.put("color", severityColor(e.getSeverity()));
    m.put("severity", e.getSeverity().name());
    m.put("location", name + e.getLocation());
    m.put("phase", e.getPhase().getDisplayName());
    m.put("message", e.getMessage());
    if (e.getFieldPath() != null) {
      m.put("field", e.getFieldPath());
    }
    if (e.getRawValue() != null) {
      m.put("value", truncate(e.getRawValue()));
    }
    if (e.getSuggestion() != null) {
      m.put("suggestion", e.getSuggestion());
    }
    return m;
  }

  private HashMap<String, Object> model(AggregatedValidationResult results) {
    HashMap<String, Object> c = new HashMap<>();
    c.put("bold", ansi("1"));
    c.put("red", ansi("91"));
    c.put("green", ansi("92"));
    c.put("yellow", ansi("93"));
    c.put("reset", ansi("0"));

    ArrayList<HashMap<String, Object>> templates = new ArrayList<>();
    for (ValidationResult r : results.getResults().values()) {
      if (r.isValid() && r.getWarningCount() == 0) {
        continue;
      }
      String name = Paths.get(r.getTemplateFile()).getFileName().toString();
      ArrayList<HashMap<String, Object>> issues = new ArrayList<>();
      for (ValidationError e : r.getAllIssues()) {
        issues.add(issueModel(name, e));
      }
      HashMap<String, Object> t = new HashMap<>();
      t.put("name", name);
      t.put("issues", issues);
      templates.add(t);
    }

    HashMap<String, Object> ret = new HashMap<>();
    ret.put("c", c);
    ret.put("totalTemplates", results.getTotalTemplates());
    ret.put("validTemplates", results.getValidTemplates());
    ret.put("invalidTemplates", results.getInvalidTemplates());
    ret.put("totalErrors", results.getTotalErrors());
    ret.put("totalWarnings", results.getTotalWarnings());
    ret.put("templates", templates);
    return ret;
  }

  /**
   * Console report
   *
   * @param results Results
   * @return Report text
   * @throws IOException if the report template cannot be loaded
   * @throws TemplateException if the report template fails to render
   */
  public String toText(AggregatedValidationResult results) throws IOException, TemplateException {
    Template temp = cfg.getTemplate(TEXT_TEMPLATE);
    Writer out = new StringWriter();
    temp.process(model(results), out);
    return out.toString();
  }

  /**
   * JSON report
   *
   * @param results Results
   * @return JSON document
   * @throws JsonProcessingException if serialization fails
   */
  public String toJson(AggregatedValidationResult results) throws JsonProcessingException {
    return mapper.writeValueAsString(results);
  }

  /**
   * Create report formatter
   *
   * @param color Emit ANSI colour codes in the console report
   */
  public ValidationReport(boolean color) {
    this.color = color;
    cfg = new Configuration(Configuration.VERSION_2_3_32);
    cfg.setDefaultEncoding("UTF-8");
    cfg.setLogTemplateExceptions(false);
    cfg.setWrapUncheckedExceptions(true);
    cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
    cfg.setTemplateLoader(new ClassTemplateLoader(ValidationReport.class, "/validation"));
    mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }
}
