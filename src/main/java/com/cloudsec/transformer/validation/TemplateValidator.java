package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.ocsf.OcsfValidationResult;
import com.cloudsec.transformer.ocsf.OcsfValidator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static validation of template files
 *
 * <p>Runs the structural, JSONPath, template syntax, filter code and rendered output phases in
 * order. In strict mode validation of a file stops after the first phase that reports an error.
 */
public class TemplateValidator {
  private final Logger log = LoggerFactory.getLogger(TemplateValidator.class);

  /** File pattern used when scanning a directory */
  public static final String TEMPLATE_GLOB = "*.yaml";

  private final boolean strict;
  private final boolean warningsAsErrors;
  private OcsfValidator ocsfValidator;

  private boolean stop(ValidationResult result) {
    return strict && !result.isValid();
  }

  private ValidationResult finish(ValidationResult result) {
    if (warningsAsErrors) {
      result.promoteWarnings();
    }
    return result;
  }

  private OcsfValidator ocsf() {
    if (ocsfValidator == null) {
      try {
        ocsfValidator = new OcsfValidator();
      } catch (IOException exc) {
        log.warn("OCSF class dictionary unavailable, skipping schema phase: {}", exc.getMessage());
        return null;
      }
    }
    return ocsfValidator;
  }

  private void checkOcsf(String file, Map<String, Object> output, ValidationResult result) {
    OcsfValidator v = ocsf();
    if (v == null) {
      return;
    }
    OcsfValidationResult r = v.validate(output);
    // Mock data cannot prove a violation, so findings are downgraded one level
    for (String e : r.getErrors()) {
      result.add(
          new ValidationError(
                  ValidationPhase.OCSF_SCHEMA, ValidationSeverity.WARNING, e, file)
              .withFieldPath("template"));
    }
    for (String w : r.getWarnings()) {
      result.add(
          new ValidationError(ValidationPhase.OCSF_SCHEMA, ValidationSeverity.INFO, w, file)
              .withFieldPath("template"));
    }
  }

  /**
   * Validate a single template file
   *
   * @param path Template file path
   * @return ValidationResult
   */
  public ValidationResult validateTemplate(String path) {
    ValidationResult result = new ValidationResult(path);
    Path p = Paths.get(path);
    if (!Files.isRegularFile(p)) {
      result.add(
          new ValidationError(
              ValidationPhase.YAML_STRUCTURE,
              ValidationSeverity.ERROR,
              String.format("Template file not found: %s", path),
              path));
      return finish(result);
    }
    String content;
    try {
      content = new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    } catch (IOException exc) {
      result.add(
          new ValidationError(
              ValidationPhase.YAML_STRUCTURE,
              ValidationSeverity.ERROR,
              String.format("Failed to read template file: %s", exc.getMessage()),
              path));
      return finish(result);
    }
    log.debug("validating {}", path);

    YamlStructureValidator structure = new YamlStructureValidator(path);
    result.merge(structure.validate(content));
    if (structure.getParsed() == null || stop(result)) {
      return finish(result);
    }
    LineMap lineMap = structure.getLineMap();
    Map<String, Object> extractors = structure.getExtractors();
    Map<String, Object> filters = structure.getFilters();
    String templateContent = structure.getTemplateContent();
    Collection<String> extractorNames = extractors.keySet();
    Collection<String> filterNames = filters.keySet();

    if (!extractors.isEmpty()) {
      result.merge(new JsonPathSyntaxValidator(path, lineMap).validate(extractors));
      if (stop(result)) {
        return finish(result);
      }
    }

    TemplateSyntaxValidator syntax = new TemplateSyntaxValidator(path, lineMap);
    if (templateContent != null) {
      result.merge(syntax.validate(templateContent, extractorNames, filterNames));
      if (stop(result)) {
        return finish(result);
      }
    }

    if (!filters.isEmpty()) {
      result.merge(new FilterCodeValidator(path, lineMap).validate(filters));
      if (stop(result)) {
        return finish(result);
      }
    }

    if (templateContent != null && !extractors.isEmpty()) {
      JsonOutputValidator output = new JsonOutputValidator(path, lineMap);
      result.merge(
          output.validate(templateContent, syntax.getCompiled(), extractorNames, filterNames));
      String schema = structure.getOutputSchema();
      if (output.getOutput() != null
          && schema != null
          && schema.toLowerCase().contains("ocsf")) {
        checkOcsf(path, output.getOutput(), result);
      }
    }
    return finish(result);
  }

  /**
   * Validate every template file in a directory
   *
   * @param dir Directory path
   * @return AggregatedValidationResult
   * @throws IOException if the directory cannot be listed
   */
  public AggregatedValidationResult validateDirectory(String dir) throws IOException {
    AggregatedValidationResult ret = new AggregatedValidationResult();
    Path d = Paths.get(dir);
    if (!Files.isDirectory(d)) {
      ValidationResult r = new ValidationResult(dir);
      r.add(
          new ValidationError(
              ValidationPhase.YAML_STRUCTURE,
              ValidationSeverity.ERROR,
              String.format("Templates directory not found: %s", dir),
              dir));
      ret.add(r);
      return ret;
    }
    ArrayList<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> ds = Files.newDirectoryStream(d, TEMPLATE_GLOB)) {
      for (Path p : ds) {
        if (Files.isRegularFile(p)) {
          files.add(p);
        }
      }
    }
    if (files.isEmpty()) {
      ValidationResult r = new ValidationResult(dir);
      r.add(
          new ValidationError(
              ValidationPhase.YAML_STRUCTURE,
              ValidationSeverity.WARNING,
              String.format(
                  "No template files found in %s matching pattern %s", dir, TEMPLATE_GLOB),
              dir));
      ret.add(finish(r));
      return ret;
    }
    Collections.sort(files);
    log.info("validating {} template files in {}", files.size(), dir);
    for (Path p : files) {
      ret.add(validateTemplate(p.toString()));
    }
    return ret;
  }

  /**
   * Create validator
   *
   * @param strict Stop validating a file after the first phase with errors
   * @param warningsAsErrors Promote warnings to errors
   */
  public TemplateValidator(boolean strict, boolean warningsAsErrors) {
    this.strict = strict;
    this.warningsAsErrors = warningsAsErrors;
  }
}
