package com.cloudsec.transformer.output;

import java.util.Map;

/** OCSF event as rendered by its template */
public class OcsfEvent extends JsonObjectEvent {
  private static final long serialVersionUID = 1L;

  /**
   * Create OCSF event
   *
   * @param fields Rendered fields
   */
  public OcsfEvent(Map<String, Object> fields) {
    super(fields);
  }

  @Override
  public OutputFormat getFormat() {
    return OutputFormat.OCSF;
  }

  /**
   * Class identifier of the event
   *
   * @return class_uid value, or null
   */
  public Object getClassUid() {
    return getFields().get("class_uid");
  }
}
