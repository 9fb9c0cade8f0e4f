package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.jsonpath.JsonPathExtractor;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import java.util.Map;

/**
 * Checks that every extractor expression compiles as JSONPath
 *
 * <p>Common mistakes get a specific message and suggestion before the expression is handed to
 * the JSONPath compiler.
 */
public class JsonPathSyntaxValidator {
  private final String templateFile;
  private final LineMap lineMap;

  private ValidationError error(String message, String name, String expr) {
    String path = "extractors." + name;
    return new ValidationError(
            ValidationPhase.JSONPATH_SYNTAX, ValidationSeverity.ERROR, message, templateFile)
        .withLine(lineMap == null ? null : lineMap.get(path))
        .withFieldPath(path)
        .withRawValue(expr);
  }

  private static String structuralSuggestion(String problem) {
    switch (problem) {
      case JsonPathExtractor.EMPTY_EXPRESSION:
        return "Provide a valid JSONPath expression starting with $";
      case JsonPathExtractor.LEADING_DESCENT:
        return "Start with $ followed by .field or ..field for recursive descent";
      case JsonPathExtractor.MISSING_ROOT:
        return "Add $ at the beginning of the expression";
      default:
        return "Check that all [ and ] brackets are properly matched";
    }
  }

  static String suggestionFor(String message, String expr) {
    String m = message == null ? "" : message.toLowerCase();
    if (m.contains("unexpected")) {
      return "Check the JSONPath syntax near the unexpected character";
    }
    if (m.contains("expect")) {
      return "Verify the expression follows JSONPath grammar rules";
    }
    if (m.contains("token") || m.contains("character")) {
      return "Check for special characters that need escaping";
    }
    if (expr.contains(".") && !expr.startsWith("$.")) {
      return "JSONPath expressions typically start with '$.' to access object properties";
    }
    return "Review JSONPath documentation for correct syntax";
  }

  /**
   * Check a single expression
   *
   * @param name Extractor name
   * @param expr Expression
   * @return Finding, or null if the expression is valid
   */
  public ValidationError check(String name, String expr) {
    String e = expr.trim();
    String problem = JsonPathExtractor.structuralProblem(e);
    if (problem != null) {
      return error(problem, name, problem.equals(JsonPathExtractor.EMPTY_EXPRESSION) ? expr : e)
          .withSuggestion(structuralSuggestion(problem));
    }
    try {
      JsonPath.compile(e);
    } catch (InvalidPathException exc) {
      return error(
              String.format("Invalid JSONPath expression for '%s': %s", name, exc.getMessage()),
              name,
              e)
          .withSuggestion(suggestionFor(exc.getMessage(), e));
    }
    return null;
  }

  /**
   * Check every extractor expression
   *
   * <p>Non-string values are skipped; the YAML structure phase reports them.
   *
   * @param extractors Extractors from the template
   * @return ValidationResult
   */
  public ValidationResult validate(Map<String, Object> extractors) {
    ValidationResult result = new ValidationResult(templateFile);
    for (Map.Entry<String, Object> e : extractors.entrySet()) {
      if (!(e.getValue() instanceof String)) {
        continue;
      }
      ValidationError err = check(e.getKey(), (String) e.getValue());
      if (err != null) {
        result.add(err);
      }
    }
    return result;
  }

  /**
   * Create validator
   *
   * @param templateFile Template file path used in findings
   * @param lineMap Line map of the template file, may be null
   */
  public JsonPathSyntaxValidator(String templateFile, LineMap lineMap) {
    this.templateFile = templateFile;
    this.lineMap = lineMap;
  }
}
