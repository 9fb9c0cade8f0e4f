package com.cloudsec.transformer.template;

import com.cloudsec.transformer.output.OutputFormat;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loaded templates keyed by event type and output format
 *
 * <p>Owned by one loader instance. Entries live until explicitly invalidated.
 */
public class TemplateCache {
  private final ConcurrentHashMap<String, TemplateDefinition> entries;

  private static String key(String eventType, OutputFormat format) {
    return eventType + "_" + format.getName();
  }

  /**
   * Get cached template
   *
   * @param eventType Event type
   * @param format Output format
   * @return TemplateDefinition or null if not cached
   */
  public TemplateDefinition get(String eventType, OutputFormat format) {
    return entries.get(key(eventType, format));
  }

  /**
   * Cache template
   *
   * @param eventType Event type
   * @param format Output format
   * @param t Template
   */
  public void put(String eventType, OutputFormat format, TemplateDefinition t) {
    entries.put(key(eventType, format), t);
  }

  /**
   * Drop one cached template so the next use reloads it from disk
   *
   * @param eventType Event type
   * @param format Output format
   * @return True if an entry was removed
   */
  public boolean invalidate(String eventType, OutputFormat format) {
    return entries.remove(key(eventType, format)) != null;
  }

  /** Drop every cached template */
  public void invalidateAll() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  /** Create empty cache */
  public TemplateCache() {
    entries = new ConcurrentHashMap<>();
  }
}
