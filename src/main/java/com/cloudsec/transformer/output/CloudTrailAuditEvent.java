package com.cloudsec.transformer.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Audit event payload accepted by CloudTrail Lake, event data carried as a JSON string */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CloudTrailAuditEvent implements Serializable, TransformedEvent {
  private static final long serialVersionUID = 1L;

  private String id;
  private String eventData;
  private String eventDataChecksum;

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  @JsonProperty("eventData")
  public String getEventData() {
    return eventData;
  }

  public void setEventData(String eventData) {
    this.eventData = eventData;
  }

  @JsonProperty("eventDataChecksum")
  public String getEventDataChecksum() {
    return eventDataChecksum;
  }

  public void setEventDataChecksum(String eventDataChecksum) {
    this.eventDataChecksum = eventDataChecksum;
  }

  @Override
  @JsonIgnore
  public OutputFormat getFormat() {
    return OutputFormat.CLOUDTRAIL;
  }

  @Override
  public Map<String, Object> toMap() {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("eventData", eventData);
    ret.put("id", id);
    if (eventDataChecksum != null && !eventDataChecksum.isEmpty()) {
      ret.put("eventDataChecksum", eventDataChecksum);
    }
    return ret;
  }

  @Override
  public String toJSON() {
    ObjectMapper mapper = new ObjectMapper();
    try {
      return mapper.writeValueAsString(this);
    } catch (JsonProcessingException exc) {
      return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CloudTrailAuditEvent)) {
      return false;
    }
    CloudTrailAuditEvent t = (CloudTrailAuditEvent) o;
    return Objects.equals(id, t.id)
        && Objects.equals(eventData, t.eventData)
        && Objects.equals(eventDataChecksum, t.eventDataChecksum);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, eventData, eventDataChecksum);
  }

  /**
   * Create audit event
   *
   * @param id Event id
   * @param eventData JSON encoded event data
   */
  public CloudTrailAuditEvent(String id, String eventData) {
    this.id = id;
    this.eventData = eventData;
  }

  /** Create empty audit event, used for deserialization */
  public CloudTrailAuditEvent() {}
}
