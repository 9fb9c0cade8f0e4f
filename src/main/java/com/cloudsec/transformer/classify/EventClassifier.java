package com.cloudsec.transformer.classify;

import com.cloudsec.transformer.mapping.EventTypeMapping;
import com.cloudsec.transformer.mapping.MappingRegistry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolve raw events to exactly one event type using a {@link MappingRegistry}
 *
 * <p>Classification never fails; events that match no mapping classify as {@link
 * EventTypeMapping#GENERIC}.
 */
public class EventClassifier {
  private final Logger log;
  private final MappingRegistry registry;

  /**
   * Classify a raw event
   *
   * @param event Raw event
   * @return Event type name
   */
  public String classify(Map<String, Object> event) {
    return classify(ProviderEnvelope.unwrap(event));
  }

  /**
   * Classify an already unwrapped event
   *
   * @param envelope Provider envelope
   * @return Event type name
   */
  public String classify(ProviderEnvelope envelope) {
    if (!envelope.isRecognized()) {
      log.debug("no provider payload located, classifying as generic");
      return EventTypeMapping.GENERIC;
    }
    Map<String, Object> payload = envelope.getPayload();
    for (EventTypeMapping m : registry.getClassificationCandidates()) {
      if (matches(m, payload)) {
        log.debug("classified as {}", m.getName());
        return m.getName();
      }
    }
    return EventTypeMapping.GENERIC;
  }

  /**
   * Test a single mapping against a provider payload
   *
   * <p>When both detection keys and an event type match are configured, both must succeed, and
   * every detection key must then resolve to a non-empty value.
   *
   * @param m Mapping
   * @param payload Provider payload
   * @return boolean
   */
  public static boolean matches(EventTypeMapping m, Map<String, Object> payload) {
    boolean detect = m.hasDetectionKeys();
    boolean typed = m.hasEventTypeMatch();
    if (!detect && !typed) {
      return false;
    }
    if (detect) {
      for (String key : m.getDetectionKeys()) {
        boolean found =
            typed
                ? NestedValueResolver.hasValue(payload, key)
                : NestedValueResolver.isPresent(payload, key);
        if (!found) {
          return false;
        }
      }
    }
    if (typed) {
      String actual = NestedValueResolver.resolveString(payload, m.getEventTypeKey());
      return m.getMatchMode().matches(m.getEventTypeValue(), actual);
    }
    return true;
  }

  /**
   * Create classifier
   *
   * @param registry Mapping registry
   */
  public EventClassifier(MappingRegistry registry) {
    log = LoggerFactory.getLogger(EventClassifier.class);
    this.registry = registry;
  }
}
