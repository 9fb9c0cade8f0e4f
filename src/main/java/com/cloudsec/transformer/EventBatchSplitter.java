package com.cloudsec.transformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a delivered message body into individual cloud events
 *
 * <p>A list body is a list of events. An object with an {@code events} member yields that list.
 * An object whose {@code event_data.records} is a non-empty list yields one event per record,
 * each wrapped as {@code {"event_data": record}}. Any other object is a single event.
 */
public class EventBatchSplitter {
  private static final Logger log = LoggerFactory.getLogger(EventBatchSplitter.class);

  private EventBatchSplitter() {}

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> eventsOf(List<?> in) {
    ArrayList<Map<String, Object>> ret = new ArrayList<>();
    for (Object o : in) {
      if (o instanceof Map) {
        ret.add((Map<String, Object>) o);
      } else {
        log.warn("ignoring non-object entry in event list");
      }
    }
    return ret;
  }

  /**
   * Split a parsed message body into events
   *
   * @param body Parsed message body
   * @return Events, empty if the body holds none
   */
  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> split(Object body) {
    if (body instanceof List) {
      return eventsOf((List<?>) body);
    }
    if (!(body instanceof Map)) {
      return Collections.emptyList();
    }
    Map<String, Object> m = (Map<String, Object>) body;
    if (m.containsKey("events")) {
      Object events = m.get("events");
      if (events instanceof List) {
        return eventsOf((List<?>) events);
      }
      return Collections.emptyList();
    }
    Object data = m.get("event_data");
    if (data instanceof Map && ((Map<?, ?>) data).containsKey("records")) {
      Object records = ((Map<?, ?>) data).get("records");
      if (records instanceof List && !((List<?>) records).isEmpty()) {
        ArrayList<Map<String, Object>> ret = new ArrayList<>();
        for (Object r : (List<?>) records) {
          LinkedHashMap<String, Object> e = new LinkedHashMap<>();
          e.put("event_data", r);
          ret.add(e);
        }
        log.info("unwrapped {} records from event_data.records", ret.size());
        return ret;
      }
    }
    return Collections.singletonList(m);
  }
}
