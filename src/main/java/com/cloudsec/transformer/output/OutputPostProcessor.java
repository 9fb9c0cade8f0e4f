package com.cloudsec.transformer.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.UUID;

/** Format-specific finishing of a rendered template */
public class OutputPostProcessor {
  private final ObjectMapper mapper;

  /**
   * Finish rendered output for the requested format
   *
   * <p>CloudTrail output always receives a freshly generated id. The source event's own id is
   * kept only inside the encoded event data. OCSF and ASFF output is returned unmodified.
   *
   * @param format Output format
   * @param rendered Parsed template output
   * @return TransformedEvent
   * @throws JsonProcessingException if CloudTrail event data cannot be encoded
   */
  public TransformedEvent finish(OutputFormat format, Map<String, Object> rendered)
      throws JsonProcessingException {
    switch (format) {
      case CLOUDTRAIL:
        Object data = rendered.containsKey("eventData") ? rendered.get("eventData") : rendered;
        return new CloudTrailAuditEvent(
            UUID.randomUUID().toString(), mapper.writeValueAsString(data));
      case OCSF:
        return new OcsfEvent(rendered);
      case ASFF:
        return new AsffFinding(rendered);
      default:
        throw new IllegalArgumentException("unsupported output format " + format);
    }
  }

  /** Create post processor */
  public OutputPostProcessor() {
    mapper = new ObjectMapper();
  }
}
