package com.cloudsec.transformer.classify;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Provider payload located inside a raw event
 *
 * <p>Raw events arrive in one of a few envelope shapes. {@link #unwrap(Map)} identifies the
 * shape once, so classification and templates work against the payload without probing.
 */
public class ProviderEnvelope {
  /** Envelope shapes understood by the engine */
  public enum Kind {
    /** Payload under a top level event_data object */
    EVENT_DATA,
    /** Payload under data.event_data, as produced by the pub/sub poller for flow logs */
    DATA_EVENT_DATA,
    /** Payload directly under a top level data object */
    DATA,
    /** No object payload could be located */
    UNRECOGNIZED
  }

  private final Kind kind;
  private final Map<String, Object> payload;

  private ProviderEnvelope(Kind kind, Map<String, Object> payload) {
    this.kind = kind;
    this.payload = payload;
  }

  /**
   * Identify envelope shape of a raw event
   *
   * @param event Raw event
   * @return ProviderEnvelope, never null
   */
  @SuppressWarnings("unchecked")
  public static ProviderEnvelope unwrap(Map<String, Object> event) {
    if (event == null) {
      return new ProviderEnvelope(Kind.UNRECOGNIZED, null);
    }
    Object ed = event.get("event_data");
    if (ed instanceof Map && !((Map<String, Object>) ed).isEmpty()) {
      return new ProviderEnvelope(Kind.EVENT_DATA, (Map<String, Object>) ed);
    }
    if (isPresent(ed)) {
      // Non-object event_data is not a payload we can classify
      return new ProviderEnvelope(Kind.UNRECOGNIZED, null);
    }
    Object data = event.get("data");
    if (data instanceof Map) {
      Map<String, Object> d = (Map<String, Object>) data;
      if (d.containsKey("event_data")) {
        Object inner = d.get("event_data");
        if (inner instanceof Map) {
          return new ProviderEnvelope(Kind.DATA_EVENT_DATA, (Map<String, Object>) inner);
        }
        return new ProviderEnvelope(Kind.UNRECOGNIZED, null);
      }
      return new ProviderEnvelope(Kind.DATA, d);
    }
    return new ProviderEnvelope(Kind.UNRECOGNIZED, null);
  }

  private static boolean isPresent(Object o) {
    if (o == null) {
      return false;
    }
    if (o instanceof String) {
      return !((String) o).isEmpty();
    }
    if (o instanceof Collection) {
      return !((Collection<?>) o).isEmpty();
    }
    if (o instanceof Map) {
      return !((Map<?, ?>) o).isEmpty();
    }
    if (o instanceof Boolean) {
      return (Boolean) o;
    }
    return true;
  }

  /**
   * Envelope shape
   *
   * @return Kind
   */
  public Kind getKind() {
    return kind;
  }

  /**
   * Test if a payload was located
   *
   * @return boolean
   */
  public boolean isRecognized() {
    return kind != Kind.UNRECOGNIZED;
  }

  /**
   * Provider payload
   *
   * @return Unmodifiable payload map, empty if unrecognized
   */
  public Map<String, Object> getPayload() {
    if (payload == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(payload);
  }
}
