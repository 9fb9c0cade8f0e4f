package com.cloudsec.transformer.mapping;

/** Comparison applied between a mapping's expected event type value and the event's value */
public enum MatchMode {
  /** Case-insensitive substring */
  CONTAINS("contains"),
  /** String equality */
  EXACT("exact"),
  /** String equality, used for values reached through a nested key path */
  NESTED_EXACT("nested_exact"),
  /** Case-insensitive prefix */
  STARTSWITH("startswith");

  private final String configName;

  MatchMode(String configName) {
    this.configName = configName;
  }

  /**
   * Name used for this mode in mapping configuration
   *
   * @return String
   */
  public String getConfigName() {
    return configName;
  }

  /**
   * Test if actual satisfies expected under this mode
   *
   * @param expected Value from mapping configuration
   * @param actual Value found in event
   * @return True on match
   */
  public boolean matches(String expected, String actual) {
    if (expected == null || actual == null) {
      return false;
    }
    switch (this) {
      case CONTAINS:
        return actual.toLowerCase().contains(expected.toLowerCase());
      case STARTSWITH:
        return actual.toLowerCase().startsWith(expected.toLowerCase());
      case EXACT:
      case NESTED_EXACT:
      default:
        return expected.equals(actual);
    }
  }

  /**
   * Resolve a mode from its configuration name
   *
   * @param name Configuration name, null selects {@link #CONTAINS}
   * @return MatchMode
   * @throws IllegalArgumentException for unknown names
   */
  public static MatchMode fromConfigName(String name) {
    if (name == null) {
      return CONTAINS;
    }
    for (MatchMode m : values()) {
      if (m.configName.equals(name)) {
        return m;
      }
    }
    throw new IllegalArgumentException(String.format("unknown event_type_match_mode %s", name));
  }
}
