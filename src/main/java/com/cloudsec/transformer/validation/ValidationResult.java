package com.cloudsec.transformer.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Findings for one template file */
@JsonPropertyOrder({
  "template_file",
  "valid",
  "error_count",
  "warning_count",
  "info_count",
  "errors",
  "warnings",
  "info"
})
public class ValidationResult {
  private final String templateFile;
  private final ArrayList<ValidationError> errors;
  private final ArrayList<ValidationError> warnings;
  private final ArrayList<ValidationError> info;

  /**
   * Add a finding, filed by its severity
   *
   * @param error Finding
   */
  public void add(ValidationError error) {
    switch (error.getSeverity()) {
      case ERROR:
        errors.add(error);
        break;
      case WARNING:
        warnings.add(error);
        break;
      default:
        info.add(error);
        break;
    }
  }

  /**
   * Add every finding of another result for the same template
   *
   * @param other Result to merge
   * @throws IllegalArgumentException if the other result is for a different template
   */
  public void merge(ValidationResult other) {
    if (!templateFile.equals(other.templateFile)) {
      throw new IllegalArgumentException("cannot merge results from different templates");
    }
    errors.addAll(other.errors);
    warnings.addAll(other.warnings);
    info.addAll(other.info);
  }

  /** Convert every warning into an error */
  public void promoteWarnings() {
    for (ValidationError w : warnings) {
      w.setSeverity(ValidationSeverity.ERROR);
      errors.add(w);
    }
    warnings.clear();
  }

  /**
   * Test if any finding of a phase was recorded at the given severity
   *
   * @param phase Phase
   * @param severity Severity
   * @return boolean
   */
  public boolean has(ValidationPhase phase, ValidationSeverity severity) {
    for (ValidationError e : getAllIssues()) {
      if (e.getPhase() == phase && e.getSeverity() == severity) {
        return true;
      }
    }
    return false;
  }

  @JsonProperty("template_file")
  public String getTemplateFile() {
    return templateFile;
  }

  @JsonProperty("valid")
  public boolean isValid() {
    return errors.isEmpty();
  }

  @JsonProperty("error_count")
  public int getErrorCount() {
    return errors.size();
  }

  @JsonProperty("warning_count")
  public int getWarningCount() {
    return warnings.size();
  }

  @JsonProperty("info_count")
  public int getInfoCount() {
    return info.size();
  }

  @JsonProperty("errors")
  public List<ValidationError> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  @JsonProperty("warnings")
  public List<ValidationError> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  @JsonProperty("info")
  public List<ValidationError> getInfo() {
    return Collections.unmodifiableList(info);
  }

  /**
   * Errors, then warnings, then info
   *
   * @return List of findings
   */
  @JsonIgnore
  public List<ValidationError> getAllIssues() {
    ArrayList<ValidationError> ret = new ArrayList<>(errors);
    ret.addAll(warnings);
    ret.addAll(info);
    return ret;
  }

  /**
   * Create empty result
   *
   * @param templateFile Template file path
   */
  public ValidationResult(String templateFile) {
    this.templateFile = templateFile;
    errors = new ArrayList<>();
    warnings = new ArrayList<>();
    info = new ArrayList<>();
  }
}
