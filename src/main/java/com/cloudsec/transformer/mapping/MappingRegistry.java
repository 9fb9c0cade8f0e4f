package com.cloudsec.transformer.mapping;

import com.cloudsec.transformer.FileUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable table of {@link EventTypeMapping} entries keyed by event type
 *
 * <p>The registry is loaded once from a JSON document of the form {@code {"event_type": {...}}}
 * and validated on load. Classification candidates are ordered by specificity at load time.
 */
public class MappingRegistry implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Default resource path for mapping configuration */
  public static final String DEFAULT_PATH = "/mapping/event_type_mappings.json";

  private static final Comparator<EventTypeMapping> SPECIFICITY =
      Comparator.comparing((EventTypeMapping m) -> m.hasDetectionKeys() ? 0 : 1)
          .thenComparing(
              m -> m.getEventTypeValue() == null ? 0 : m.getEventTypeValue().length(),
              Comparator.reverseOrder())
          .thenComparing(EventTypeMapping::getName);

  private final Map<String, EventTypeMapping> mappings;
  private final List<EventTypeMapping> candidates;

  /**
   * Load registry from a resource or file system path
   *
   * @param path Resource path or file path
   * @return MappingRegistry
   * @throws IOException if the document cannot be read or parsed
   * @throws IllegalArgumentException if a mapping entry is invalid
   */
  public static MappingRegistry load(String path) throws IOException {
    try (InputStream in = FileUtil.getStreamFromPath(path)) {
      return load(in);
    }
  }

  /**
   * Load registry from a stream containing the JSON mapping document
   *
   * @param in Input stream
   * @return MappingRegistry
   * @throws IOException if the document cannot be parsed
   * @throws IllegalArgumentException if a mapping entry is invalid
   */
  public static MappingRegistry load(InputStream in) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    LinkedHashMap<String, EventTypeMapping> m =
        mapper.readValue(in, new TypeReference<LinkedHashMap<String, EventTypeMapping>>() {});
    if (m == null) {
      throw new IOException("mapping configuration is empty");
    }
    return new MappingRegistry(m);
  }

  /**
   * Validate a single mapping entry
   *
   * @param m Mapping, with name set
   * @throws IllegalArgumentException describing the first problem found
   */
  public static void validate(EventTypeMapping m) {
    String name = m.getName();
    if (isBlank(m.getEventSource())
        || isBlank(m.getEventNamePrefix())
        || isBlank(m.getUserAgent())
        || isBlank(m.getOcsfClass())) {
      throw new IllegalArgumentException(
          String.format(
              "mapping %s requires event_source, event_name_prefix, user_agent and ocsf_class",
              name));
    }
    if (!m.isGeneric()) {
      boolean hasKey = !isBlank(m.getEventTypeKey());
      boolean hasValue = !isBlank(m.getEventTypeValue());
      if (hasKey != hasValue) {
        throw new IllegalArgumentException(
            String.format(
                "mapping %s must set both event_type_key and event_type_value, or neither", name));
      }
      if (!hasKey && !m.hasDetectionKeys()) {
        throw new IllegalArgumentException(
            String.format("mapping %s has neither detection_keys nor an event type match", name));
      }
    }
    // Raises for unknown mode names
    m.getMatchMode();
  }

  private static boolean isBlank(String s) {
    return s == null || s.trim().isEmpty();
  }

  /**
   * Get mapping for an event type
   *
   * @param eventType Event type
   * @return Mapping, or null if not registered
   */
  public EventTypeMapping get(String eventType) {
    return mappings.get(eventType);
  }

  /**
   * Get all mappings keyed by event type, in load order
   *
   * @return Unmodifiable map
   */
  public Map<String, EventTypeMapping> getMappings() {
    return mappings;
  }

  /**
   * Get supported event types, in load order
   *
   * @return List of event type names
   */
  public List<String> getSupportedEventTypes() {
    return new ArrayList<>(mappings.keySet());
  }

  /**
   * Get non-generic mappings ordered for classification
   *
   * <p>Mappings with detection keys come first, then longer event type values. Mappings of equal
   * specificity are ordered by name so the result never depends on configuration file order.
   *
   * @return Unmodifiable list
   */
  public List<EventTypeMapping> getClassificationCandidates() {
    return candidates;
  }

  /**
   * Create registry from already parsed mappings
   *
   * @param in Mappings keyed by event type
   * @throws IllegalArgumentException if a mapping entry is invalid
   */
  public MappingRegistry(Map<String, EventTypeMapping> in) {
    LinkedHashMap<String, EventTypeMapping> m = new LinkedHashMap<>();
    ArrayList<EventTypeMapping> c = new ArrayList<>();
    for (Map.Entry<String, EventTypeMapping> e : in.entrySet()) {
      if (e.getValue() == null) {
        throw new IllegalArgumentException(String.format("mapping %s is null", e.getKey()));
      }
      EventTypeMapping etm = e.getValue();
      etm.setName(e.getKey());
      validate(etm);
      m.put(e.getKey(), etm);
      if (!etm.isGeneric()) {
        c.add(etm);
      }
    }
    c.sort(SPECIFICITY);
    mappings = Collections.unmodifiableMap(m);
    candidates = Collections.unmodifiableList(c);
    Logger log = LoggerFactory.getLogger(MappingRegistry.class);
    log.info("loaded {} event type mappings", mappings.size());
  }
}
