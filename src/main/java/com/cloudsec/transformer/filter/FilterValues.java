package com.cloudsec.transformer.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Value coercions shared by the filters
 *
 * <p>Filter inputs are JSON shaped Java objects: maps, lists, strings, numbers, booleans and
 * null.
 */
public class FilterValues {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private FilterValues() {}

  /**
   * Truthiness as templates evaluate it
   *
   * @param o Value
   * @return boolean
   */
  public static boolean isTruthy(Object o) {
    if (o == null) {
      return false;
    }
    if (o instanceof Boolean) {
      return (Boolean) o;
    }
    if (o instanceof Number) {
      return ((Number) o).doubleValue() != 0.0;
    }
    if (o instanceof CharSequence) {
      return ((CharSequence) o).length() > 0;
    }
    if (o instanceof Collection) {
      return !((Collection<?>) o).isEmpty();
    }
    if (o instanceof Map) {
      return !((Map<?, ?>) o).isEmpty();
    }
    return true;
  }

  /**
   * Convert a value to text
   *
   * <p>Null produces an empty string, booleans JSON literals, and containers JSON.
   *
   * @param o Value
   * @return String
   */
  public static String toStr(Object o) {
    if (o == null) {
      return "";
    }
    if (o instanceof String) {
      return (String) o;
    }
    if (o instanceof Boolean) {
      return ((Boolean) o) ? "true" : "false";
    }
    if (o instanceof Map || o instanceof Collection) {
      return toJson(o);
    }
    return o.toString();
  }

  /**
   * Encode a value as JSON
   *
   * @param o Value
   * @return JSON text, "null" for null
   * @throws IllegalArgumentException if the value cannot be encoded
   */
  public static String toJson(Object o) {
    try {
      return MAPPER.writeValueAsString(o);
    } catch (JsonProcessingException exc) {
      throw new IllegalArgumentException(
          "value cannot be encoded as JSON: " + exc.getOriginalMessage(), exc);
    }
  }

  /**
   * Coerce a value to a number
   *
   * @param o Number, numeric string or boolean
   * @return Long for integral values, Double otherwise
   * @throws NumberFormatException if the value is not numeric
   */
  public static Number toNumber(Object o) {
    if (o instanceof Boolean) {
      return ((Boolean) o) ? 1L : 0L;
    }
    if (o instanceof Integer
        || o instanceof Long
        || o instanceof Short
        || o instanceof Byte
        || o instanceof BigInteger) {
      return ((Number) o).longValue();
    }
    if (o instanceof BigDecimal || o instanceof Number) {
      return ((Number) o).doubleValue();
    }
    if (o instanceof String) {
      String s = ((String) o).trim();
      try {
        return Long.parseLong(s);
      } catch (NumberFormatException exc) {
        return Double.parseDouble(s);
      }
    }
    throw new NumberFormatException("not a number: " + toStr(o));
  }

  /**
   * Coerce a value to a double
   *
   * @param o Value
   * @return double
   * @throws NumberFormatException if the value is not numeric
   */
  public static double toDouble(Object o) {
    return toNumber(o).doubleValue();
  }
}
