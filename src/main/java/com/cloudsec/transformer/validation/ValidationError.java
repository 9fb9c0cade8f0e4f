package com.cloudsec.transformer.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A single finding produced by a template validation phase */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({
  "phase",
  "severity",
  "message",
  "template_file",
  "line_number",
  "column_number",
  "field_path",
  "suggestion",
  "raw_value"
})
public class ValidationError {
  private final ValidationPhase phase;
  private ValidationSeverity severity;
  private final String message;
  private final String templateFile;
  private Integer lineNumber;
  private Integer columnNumber;
  private String fieldPath;
  private String suggestion;
  private String rawValue;

  /**
   * Create new finding
   *
   * @param phase Phase that produced the finding
   * @param severity Severity
   * @param message Description
   * @param templateFile Template file the finding applies to
   */
  public ValidationError(
      ValidationPhase phase, ValidationSeverity severity, String message, String templateFile) {
    this.phase = phase;
    this.severity = severity;
    this.message = message;
    this.templateFile = templateFile;
  }

  /**
   * Set source line
   *
   * @param lineNumber Line number, ignored if null or less than 1
   * @return ValidationError
   */
  public ValidationError withLine(Integer lineNumber) {
    if (lineNumber != null && lineNumber > 0) {
      this.lineNumber = lineNumber;
    }
    return this;
  }

  /**
   * Set source column
   *
   * @param columnNumber Column number, ignored if null or less than 1
   * @return ValidationError
   */
  public ValidationError withColumn(Integer columnNumber) {
    if (columnNumber != null && columnNumber > 0) {
      this.columnNumber = columnNumber;
    }
    return this;
  }

  public ValidationError withFieldPath(String fieldPath) {
    this.fieldPath = fieldPath;
    return this;
  }

  public ValidationError withSuggestion(String suggestion) {
    this.suggestion = suggestion;
    return this;
  }

  public ValidationError withRawValue(String rawValue) {
    this.rawValue = rawValue;
    return this;
  }

  void setSeverity(ValidationSeverity severity) {
    this.severity = severity;
  }

  @JsonIgnore
  public ValidationPhase getPhase() {
    return phase;
  }

  @JsonProperty("phase")
  public String getPhaseName() {
    return phase.getDisplayName();
  }

  @JsonProperty("severity")
  public ValidationSeverity getSeverity() {
    return severity;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("template_file")
  public String getTemplateFile() {
    return templateFile;
  }

  @JsonProperty("line_number")
  public Integer getLineNumber() {
    return lineNumber;
  }

  @JsonProperty("column_number")
  public Integer getColumnNumber() {
    return columnNumber;
  }

  @JsonProperty("field_path")
  public String getFieldPath() {
    return fieldPath;
  }

  @JsonProperty("suggestion")
  public String getSuggestion() {
    return suggestion;
  }

  @JsonProperty("raw_value")
  public String getRawValue() {
    return rawValue;
  }

  /**
   * Source location as {@code :line[:column]}
   *
   * @return Location, empty if the line is unknown
   */
  @JsonIgnore
  public String getLocation() {
    if (lineNumber == null) {
      return "";
    }
    if (columnNumber == null) {
      return ":" + lineNumber;
    }
    return String.format(":%d:%d", lineNumber, columnNumber);
  }

  @Override
  public String toString() {
    return String.format("[%s] %s%s %s: %s", severity, templateFile, getLocation(), phase, message);
  }
}
