package com.cloudsec.transformer.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Validation results for a set of template files */
@JsonPropertyOrder({"summary", "results"})
public class AggregatedValidationResult {
  private final LinkedHashMap<String, ValidationResult> results;

  /** Summary counters */
  @JsonPropertyOrder({
    "total_templates",
    "valid_templates",
    "invalid_templates",
    "total_errors",
    "total_warnings",
    "all_valid"
  })
  public static class Summary {
    private final AggregatedValidationResult r;

    Summary(AggregatedValidationResult r) {
      this.r = r;
    }

    @JsonProperty("total_templates")
    public int getTotalTemplates() {
      return r.getTotalTemplates();
    }

    @JsonProperty("valid_templates")
    public int getValidTemplates() {
      return r.getValidTemplates();
    }

    @JsonProperty("invalid_templates")
    public int getInvalidTemplates() {
      return r.getInvalidTemplates();
    }

    @JsonProperty("total_errors")
    public int getTotalErrors() {
      return r.getTotalErrors();
    }

    @JsonProperty("total_warnings")
    public int getTotalWarnings() {
      return r.getTotalWarnings();
    }

    @JsonProperty("all_valid")
    public boolean getAllValid() {
      return r.isAllValid();
    }
  }

  /**
   * Add result, replacing any earlier result for the same file
   *
   * @param result Result
   */
  public void add(ValidationResult result) {
    results.put(result.getTemplateFile(), result);
  }

  @JsonProperty("summary")
  public Summary getSummary() {
    return new Summary(this);
  }

  @JsonProperty("results")
  public Map<String, ValidationResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  @JsonIgnore
  public int getTotalTemplates() {
    return results.size();
  }

  @JsonIgnore
  public int getValidTemplates() {
    int n = 0;
    for (ValidationResult r : results.values()) {
      if (r.isValid()) {
        n++;
      }
    }
    return n;
  }

  @JsonIgnore
  public int getInvalidTemplates() {
    return getTotalTemplates() - getValidTemplates();
  }

  @JsonIgnore
  public int getTotalErrors() {
    int n = 0;
    for (ValidationResult r : results.values()) {
      n += r.getErrorCount();
    }
    return n;
  }

  @JsonIgnore
  public int getTotalWarnings() {
    int n = 0;
    for (ValidationResult r : results.values()) {
      n += r.getWarningCount();
    }
    return n;
  }

  /**
   * Test if every template is valid
   *
   * @return True if no template has an error
   */
  @JsonIgnore
  public boolean isAllValid() {
    return getInvalidTemplates() == 0;
  }

  /** Create empty aggregate */
  public AggregatedValidationResult() {
    results = new LinkedHashMap<>();
  }
}
