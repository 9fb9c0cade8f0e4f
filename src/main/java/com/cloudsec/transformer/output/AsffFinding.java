package com.cloudsec.transformer.output;

import java.util.Map;

/** Security Hub finding in AWS Security Finding Format */
public class AsffFinding extends JsonObjectEvent {
  private static final long serialVersionUID = 1L;

  /**
   * Create finding
   *
   * @param fields Rendered fields
   */
  public AsffFinding(Map<String, Object> fields) {
    super(fields);
  }

  @Override
  public OutputFormat getFormat() {
    return OutputFormat.ASFF;
  }
}
