package com.cloudsec.transformer.output;

import java.util.Map;

/** Finished output of a transformation in one of the supported target formats */
public interface TransformedEvent {
  /**
   * Format of this output
   *
   * @return OutputFormat
   */
  OutputFormat getFormat();

  /**
   * Output as a plain map suitable for handing to a delivery client
   *
   * @return Map
   */
  Map<String, Object> toMap();

  /**
   * Output encoded as JSON
   *
   * @return JSON string
   */
  String toJSON();
}
