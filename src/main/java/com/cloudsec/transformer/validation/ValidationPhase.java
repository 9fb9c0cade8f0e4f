package com.cloudsec.transformer.validation;

/** Template validation phases, in the order they run */
public enum ValidationPhase {
  YAML_STRUCTURE,
  JSONPATH_SYNTAX,
  JINJA2_SYNTAX,
  FILTER_CODE,
  JSON_OUTPUT,
  OCSF_SCHEMA;

  /**
   * Human readable phase name, for example {@code Jsonpath Syntax}
   *
   * @return String
   */
  public String getDisplayName() {
    StringBuilder sb = new StringBuilder();
    for (String w : name().split("_")) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(w.charAt(0)).append(w.substring(1).toLowerCase());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return getDisplayName();
  }
}
