package com.cloudsec.transformer.ocsf;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of validating one OCSF event */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OcsfValidationResult {
  private final ArrayList<String> errors;
  private final ArrayList<String> warnings;
  private String classUid;
  private String version;
  private List<String> profiles;

  void addError(String msg) {
    errors.add(msg);
  }

  void addWarning(String msg) {
    warnings.add(msg);
  }

  @JsonProperty("valid")
  public boolean isValid() {
    return errors.isEmpty();
  }

  @JsonProperty("errors")
  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  @JsonProperty("warnings")
  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  @JsonProperty("class_uid")
  public String getClassUid() {
    return classUid;
  }

  void setClassUid(String classUid) {
    this.classUid = classUid;
  }

  @JsonProperty("version")
  public String getVersion() {
    return version;
  }

  void setVersion(String version) {
    this.version = version;
  }

  @JsonProperty("profiles")
  public List<String> getProfiles() {
    return profiles == null ? Collections.<String>emptyList() : profiles;
  }

  void setProfiles(List<String> profiles) {
    this.profiles = profiles;
  }

  /**
   * Test if any error contains the given text
   *
   * @param text Text to look for
   * @return boolean
   */
  public boolean hasErrorContaining(String text) {
    for (String e : errors) {
      if (e.contains(text)) {
        return true;
      }
    }
    return false;
  }

  OcsfValidationResult() {
    errors = new ArrayList<>();
    warnings = new ArrayList<>();
  }
}
