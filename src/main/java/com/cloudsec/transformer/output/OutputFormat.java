package com.cloudsec.transformer.output;

/** Target schemas an event can be transformed into */
public enum OutputFormat {
  CLOUDTRAIL("cloudtrail"),
  OCSF("ocsf"),
  ASFF("asff");

  private final String name;

  OutputFormat(String name) {
    this.name = name;
  }

  /**
   * Lower case name used in template file names and mapping keys
   *
   * @return String
   */
  public String getName() {
    return name;
  }

  /**
   * Key in mapping configuration holding the template reference for this format
   *
   * @return String such as ocsf_template
   */
  public String templateKey() {
    return name + "_template";
  }

  /**
   * Resolve format from name, case-insensitive
   *
   * @param name Format name
   * @return OutputFormat
   * @throws IllegalArgumentException for unknown formats
   */
  public static OutputFormat fromName(String name) {
    if (name != null) {
      for (OutputFormat f : values()) {
        if (f.name.equalsIgnoreCase(name.trim())) {
          return f;
        }
      }
    }
    throw new IllegalArgumentException(String.format("unknown output format %s", name));
  }

  @Override
  public String toString() {
    return name;
  }
}
