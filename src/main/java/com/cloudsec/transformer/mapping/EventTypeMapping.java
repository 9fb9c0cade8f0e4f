package com.cloudsec.transformer.mapping;

import static com.fasterxml.jackson.annotation.JsonInclude.Include;

import com.cloudsec.transformer.output.OutputFormat;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one event type: how to recognize it and which templates render it
 *
 * <p>Template references distinguish an explicit null (combination disabled) from an absent key
 * (fall back to the conventional template file name).
 */
@JsonInclude(Include.NON_EMPTY)
public class EventTypeMapping implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Reserved name of the universal fallback mapping */
  public static final String GENERIC = "generic";

  private String name;
  private String eventSource;
  private String eventNamePrefix;
  private String userAgent;
  private String ocsfClass;
  private String eventTypeKey;
  private String eventTypeValue;
  private String eventTypeMatchMode;
  private ArrayList<String> detectionKeys;
  private String asffProductName;
  private String asffProductId;
  private EnumMap<OutputFormat, String> templateRefs;
  private LinkedHashMap<String, Object> additional;

  /**
   * Get mapping name, the event type key this mapping is registered under
   *
   * @return String
   */
  @JsonIgnore
  public String getName() {
    return name;
  }

  /**
   * Set mapping name
   *
   * @param name Event type name
   */
  @JsonIgnore
  public void setName(String name) {
    this.name = name;
  }

  /**
   * Test if this is the reserved fallback mapping
   *
   * @return boolean
   */
  @JsonIgnore
  public boolean isGeneric() {
    return GENERIC.equals(name);
  }

  @JsonProperty("event_source")
  public String getEventSource() {
    return eventSource;
  }

  @JsonProperty("event_source")
  public void setEventSource(String eventSource) {
    this.eventSource = eventSource;
  }

  @JsonProperty("event_name_prefix")
  public String getEventNamePrefix() {
    return eventNamePrefix;
  }

  @JsonProperty("event_name_prefix")
  public void setEventNamePrefix(String eventNamePrefix) {
    this.eventNamePrefix = eventNamePrefix;
  }

  @JsonProperty("user_agent")
  public String getUserAgent() {
    return userAgent;
  }

  @JsonProperty("user_agent")
  public void setUserAgent(String userAgent) {
    this.userAgent = userAgent;
  }

  @JsonProperty("ocsf_class")
  public String getOcsfClass() {
    return ocsfClass;
  }

  @JsonProperty("ocsf_class")
  public void setOcsfClass(String ocsfClass) {
    this.ocsfClass = ocsfClass;
  }

  /**
   * Dot path within the provider payload holding the value compared against {@link
   * #getEventTypeValue()}
   *
   * @return String
   */
  @JsonProperty("event_type_key")
  public String getEventTypeKey() {
    return eventTypeKey;
  }

  @JsonProperty("event_type_key")
  public void setEventTypeKey(String eventTypeKey) {
    this.eventTypeKey = eventTypeKey;
  }

  @JsonProperty("event_type_value")
  public String getEventTypeValue() {
    return eventTypeValue;
  }

  @JsonProperty("event_type_value")
  public void setEventTypeValue(String eventTypeValue) {
    this.eventTypeValue = eventTypeValue;
  }

  @JsonProperty("event_type_match_mode")
  public String getEventTypeMatchMode() {
    return eventTypeMatchMode;
  }

  @JsonProperty("event_type_match_mode")
  public void setEventTypeMatchMode(String eventTypeMatchMode) {
    this.eventTypeMatchMode = eventTypeMatchMode;
  }

  /**
   * Get configured match mode, defaulting to {@link MatchMode#CONTAINS}
   *
   * @return MatchMode
   */
  @JsonIgnore
  public MatchMode getMatchMode() {
    return MatchMode.fromConfigName(eventTypeMatchMode);
  }

  /**
   * Dot paths whose presence in the provider payload identifies this event type
   *
   * @return List of paths, null if none configured
   */
  @JsonProperty("detection_keys")
  public List<String> getDetectionKeys() {
    return detectionKeys;
  }

  @JsonProperty("detection_keys")
  public void setDetectionKeys(List<String> detectionKeys) {
    this.detectionKeys = detectionKeys == null ? null : new ArrayList<>(detectionKeys);
  }

  /**
   * Test if detection keys are configured
   *
   * @return boolean
   */
  @JsonIgnore
  public boolean hasDetectionKeys() {
    return detectionKeys != null && !detectionKeys.isEmpty();
  }

  /**
   * Test if both event type key and value are configured
   *
   * @return boolean
   */
  @JsonIgnore
  public boolean hasEventTypeMatch() {
    return eventTypeKey != null
        && !eventTypeKey.isEmpty()
        && eventTypeValue != null
        && !eventTypeValue.isEmpty();
  }

  @JsonProperty("asff_product_name")
  public String getAsffProductName() {
    return asffProductName;
  }

  @JsonProperty("asff_product_name")
  public void setAsffProductName(String asffProductName) {
    this.asffProductName = asffProductName;
  }

  @JsonProperty("asff_product_id")
  public String getAsffProductId() {
    return asffProductId;
  }

  @JsonProperty("asff_product_id")
  public void setAsffProductId(String asffProductId) {
    this.asffProductId = asffProductId;
  }

  @JsonProperty("cloudtrail_template")
  public void setCloudtrailTemplate(String ref) {
    templateRefs.put(OutputFormat.CLOUDTRAIL, ref);
  }

  @JsonProperty("ocsf_template")
  public void setOcsfTemplate(String ref) {
    templateRefs.put(OutputFormat.OCSF, ref);
  }

  @JsonProperty("asff_template")
  public void setAsffTemplate(String ref) {
    templateRefs.put(OutputFormat.ASFF, ref);
  }

  /**
   * Test if a template reference key is present for the format, whether or not it is null
   *
   * @param format Output format
   * @return boolean
   */
  public boolean declaresTemplate(OutputFormat format) {
    return templateRefs.containsKey(format);
  }

  /**
   * Get template reference for the format
   *
   * @param format Output format
   * @return Template file name, null if absent or explicitly disabled
   */
  public String getTemplateReference(OutputFormat format) {
    return templateRefs.get(format);
  }

  /**
   * Test if the format has been explicitly disabled with a null template reference
   *
   * @param format Output format
   * @return boolean
   */
  public boolean isTemplateDisabled(OutputFormat format) {
    return templateRefs.containsKey(format) && templateRefs.get(format) == null;
  }

  @JsonAnySetter
  public void setAdditional(String key, Object value) {
    additional.put(key, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getAdditional() {
    return additional;
  }

  /**
   * Convert mapping into a plain map as exposed to templates under the config key
   *
   * @return Map
   */
  public Map<String, Object> toMap() {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>(additional);
    ret.put("event_source", eventSource);
    ret.put("event_name_prefix", eventNamePrefix);
    ret.put("user_agent", userAgent);
    ret.put("ocsf_class", ocsfClass);
    if (eventTypeKey != null) {
      ret.put("event_type_key", eventTypeKey);
    }
    if (eventTypeValue != null) {
      ret.put("event_type_value", eventTypeValue);
    }
    if (eventTypeMatchMode != null) {
      ret.put("event_type_match_mode", eventTypeMatchMode);
    }
    if (detectionKeys != null) {
      ret.put("detection_keys", new ArrayList<>(detectionKeys));
    }
    if (asffProductName != null) {
      ret.put("asff_product_name", asffProductName);
    }
    if (asffProductId != null) {
      ret.put("asff_product_id", asffProductId);
    }
    for (Map.Entry<OutputFormat, String> e : templateRefs.entrySet()) {
      ret.put(e.getKey().templateKey(), e.getValue());
    }
    return ret;
  }

  /** Create new empty {@link EventTypeMapping} */
  public EventTypeMapping() {
    templateRefs = new EnumMap<>(OutputFormat.class);
    additional = new LinkedHashMap<>();
  }
}
