package com.cloudsec.transformer.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Output that is the rendered JSON object itself */
public abstract class JsonObjectEvent implements Serializable, TransformedEvent {
  private static final long serialVersionUID = 1L;

  private final LinkedHashMap<String, Object> fields;

  protected JsonObjectEvent(Map<String, Object> fields) {
    this.fields = new LinkedHashMap<>(fields);
  }

  /**
   * Rendered fields
   *
   * @return Unmodifiable map
   */
  public Map<String, Object> getFields() {
    return Collections.unmodifiableMap(fields);
  }

  @Override
  public Map<String, Object> toMap() {
    return getFields();
  }

  @Override
  public String toJSON() {
    ObjectMapper mapper = new ObjectMapper();
    try {
      return mapper.writeValueAsString(fields);
    } catch (JsonProcessingException exc) {
      return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    return fields.equals(((JsonObjectEvent) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return toJSON();
  }
}
