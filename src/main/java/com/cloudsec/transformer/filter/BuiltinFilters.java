package com.cloudsec.transformer.filter;

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.apache.commons.validator.routines.InetAddressValidator;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in filters available to every template
 *
 * <p>Event specific converters: timestamps, severity and status enumerations, Azure resource
 * identifier parsing and address splitting. General purpose filters such as {@code default},
 * {@code lower} or {@code tojson} come with the template engine; {@code truncate} is replaced by
 * the variant here.
 */
public class BuiltinFilters {
  private static final Logger log = LoggerFactory.getLogger(BuiltinFilters.class);

  private static final DateTimeFormatter PARSER = ISODateTimeFormat.dateTimeParser().withZoneUTC();
  private static final DateTimeFormatter SECONDS =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZoneUTC();
  private static final DateTimeFormatter MILLIS =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZoneUTC();

  private static final Map<String, Long> AZURE_SEVERITY =
      ImmutableMap.<String, Long>builder()
          .put("Informational", 1L)
          .put("Low", 2L)
          .put("Medium", 3L)
          .put("High", 4L)
          .put("Critical", 5L)
          .build();

  private static final Map<String, Long> ALERT_STATUS =
      ImmutableMap.<String, Long>builder()
          .put("New", 1L)
          .put("Active", 1L)
          .put("InProgress", 2L)
          .put("Dismissed", 3L)
          .put("Resolved", 4L)
          .put("Closed", 4L)
          .build();

  private static final Map<String, Long> CONFIDENCE =
      ImmutableMap.of("High", 3L, "Medium", 2L, "Low", 1L, "Unknown", 0L);

  private static final Map<String, String> MITRE_TACTICS =
      ImmutableMap.<String, String>builder()
          .put("DefenseEvasion", "TA0005")
          .put("LateralMovement", "TA0008")
          .put("PrivilegeEscalation", "TA0004")
          .put("Persistence", "TA0003")
          .put("InitialAccess", "TA0001")
          .put("Execution", "TA0002")
          .put("Discovery", "TA0007")
          .put("Collection", "TA0009")
          .put("Exfiltration", "TA0010")
          .put("Impact", "TA0040")
          .build();

  private static final Map<String, String> SEVERITY_NAMES =
      ImmutableMap.of(
          "informational", "Low", "low", "Low", "medium", "Medium", "high", "High", "critical",
          "Critical");

  private static final Map<String, Long> ASFF_NORMALIZED =
      ImmutableMap.of(
          "informational", 0L, "low", 30L, "medium", 60L, "high", 80L, "critical", 100L);

  private static final Map<String, String> ASFF_TYPES =
      ImmutableMap.<String, String>builder()
          .put("Backdoor", "TTPs/Defense Evasion")
          .put("Malware", "Effects/Data Exfiltration")
          .put("Crypto", "Effects/Resource Consumption")
          .put("SQLInjection", "TTPs/Initial Access")
          .put("Phishing", "TTPs/Initial Access")
          .put("Brute", "TTPs/Credential Access")
          .put("Exploit", "TTPs/Execution")
          .put("Vulnerability", "Software and Configuration Checks/Vulnerabilities")
          .build();

  private static final String DEFAULT_ASFF_TYPE = "Security Monitoring/Threat Detection";

  private static final Map<String, String> COMPLIANCE_STATUS =
      ImmutableMap.<String, String>builder()
          .put("passed", "PASSED")
          .put("pass", "PASSED")
          .put("failed", "FAILED")
          .put("fail", "FAILED")
          .put("not_applicable", "NOT_APPLICABLE")
          .put("notapplicable", "NOT_APPLICABLE")
          .put("unknown", "UNKNOWN")
          .build();

  private static final Map<String, String> REASON_CODES =
      ImmutableMap.<String, String>builder()
          .put("passed", "PASSED")
          .put("pass", "PASSED")
          .put("healthy", "PASSED")
          .put("compliant", "PASSED")
          .put("failed", "FAILED")
          .put("fail", "FAILED")
          .put("unhealthy", "FAILED")
          .put("non-compliant", "FAILED")
          .put("noncompliant", "FAILED")
          .put("warning", "WARNING")
          .put("degraded", "WARNING")
          .put("not_applicable", "NOT_AVAILABLE")
          .put("notapplicable", "NOT_AVAILABLE")
          .put("unknown", "NOT_AVAILABLE")
          .put("pending", "NOT_AVAILABLE")
          .put("nodata", "NO_DATA_AVAILABLE")
          .put("no_data", "NO_DATA_AVAILABLE")
          .build();

  private static final Map<String, String> OCSF_COMPLIANCE =
      ImmutableMap.<String, String>builder()
          .put("healthy", "Pass")
          .put("unhealthy", "Fail")
          .put("notapplicable", "Skip")
          .put("not_applicable", "Skip")
          .put("unknown", "Unknown")
          .put("low", "Pass")
          .put("medium", "Fail")
          .put("high", "Fail")
          .put("critical", "Fail")
          .build();

  private static final Map<String, Long> OCSF_COMPLIANCE_ID =
      ImmutableMap.<String, Long>builder()
          .put("healthy", 1L)
          .put("unhealthy", 2L)
          .put("notapplicable", 3L)
          .put("not_applicable", 3L)
          .put("unknown", 99L)
          .put("low", 1L)
          .put("medium", 2L)
          .put("high", 2L)
          .put("critical", 2L)
          .build();

  private static final Map<Long, String> SEVERITY_ID_NAMES =
      ImmutableMap.of(1L, "Informational", 2L, "Low", 3L, "Medium", 4L, "High", 5L, "Critical");

  private static final Map<String, TemplateFilter> FILTERS = build();

  private BuiltinFilters() {}

  /**
   * All built-in filters keyed by name
   *
   * @return Unmodifiable map
   */
  public static Map<String, TemplateFilter> all() {
    return FILTERS;
  }

  /**
   * Random UUID, also available to templates as the {@code generate_uuid()} function
   *
   * @return UUID text
   */
  public static String generateUuid() {
    return UUID.randomUUID().toString();
  }

  private static Object arg(
      List<Object> args, Map<String, Object> kwargs, int idx, String name, Object def) {
    if (idx < args.size()) {
      return args.get(idx);
    }
    if (kwargs.containsKey(name)) {
      return kwargs.get(name);
    }
    return def;
  }

  private static String string(Object v) {
    return v instanceof String ? (String) v : null;
  }

  private static String nonEmptyString(Object v) {
    String s = string(v);
    return s == null || s.isEmpty() ? null : s;
  }

  /**
   * Parse an ISO-8601 timestamp, assuming UTC when no offset is given
   *
   * @param s Timestamp text, a space may separate date and time
   * @return DateTime in UTC
   * @throws IllegalArgumentException if the text cannot be parsed
   */
  public static DateTime parseTimestamp(String s) {
    String t = s.trim();
    if (t.length() > 10 && t.charAt(10) == ' ') {
      t = t.substring(0, 10) + "T" + t.substring(11);
    }
    return PARSER.parseDateTime(t).withZone(DateTimeZone.UTC);
  }

  static String normalizeTimestamp(Object v) {
    String s = string(v);
    if (!FilterValues.isTruthy(v)) {
      return SECONDS.print(DateTime.now(DateTimeZone.UTC));
    }
    try {
      return SECONDS.print(parseTimestamp(s == null ? FilterValues.toStr(v) : s));
    } catch (IllegalArgumentException exc) {
      log.warn("could not normalize timestamp {}: {}", v, exc.getMessage());
      return SECONDS.print(DateTime.now(DateTimeZone.UTC));
    }
  }

  static long toUnixTimestampMillis(Object v) {
    if (v instanceof Number) {
      return ((Number) v).longValue();
    }
    String s = nonEmptyString(v);
    if (s == null) {
      return DateTime.now(DateTimeZone.UTC).getMillis();
    }
    try {
      return parseTimestamp(s).getMillis();
    } catch (IllegalArgumentException exc) {
      log.warn("could not parse timestamp {}: {}", s, exc.getMessage());
      return DateTime.now(DateTimeZone.UTC).getMillis();
    }
  }

  static Object addOneSecond(Object v) {
    String s = nonEmptyString(v);
    if (s == null) {
      return v;
    }
    try {
      return MILLIS.print(parseTimestamp(s).plusSeconds(1));
    } catch (IllegalArgumentException exc) {
      log.warn("failed to add one second to timestamp {}: {}", s, exc.getMessage());
      return s;
    }
  }

  static String jsonEscape(Object v) {
    String s = nonEmptyString(v);
    if (s == null) {
      return "";
    }
    String enc = FilterValues.toJson(s);
    return enc.substring(1, enc.length() - 1);
  }

  static String extractSubscriptionId(Object v) {
    if (v instanceof List && !((List<?>) v).isEmpty()) {
      v = ((List<?>) v).get(0);
    }
    return subscriptionFrom(string(v));
  }

  private static String subscriptionFrom(String resourceId) {
    if (resourceId != null && resourceId.contains("/subscriptions/")) {
      String rest = resourceId.split("/subscriptions/", -1)[1];
      return rest.split("/", -1)[0];
    }
    return "unknown";
  }

  static String extractResourceName(Object v) {
    if (!FilterValues.isTruthy(v)) {
      return "unknown";
    }
    String s = FilterValues.toStr(v);
    if (s.contains("/")) {
      return s.substring(s.lastIndexOf('/') + 1);
    }
    return s;
  }

  static String extractAzureResourceType(Object v) {
    String s = string(v);
    if (s != null && s.contains("/providers/")) {
      String rest = s.split("/providers/", -1)[1];
      return rest.split("/", -1)[0];
    }
    return "Subscription";
  }

  static String extractAzureSubscription(Object v) {
    if (!(v instanceof List)) {
      return "unknown";
    }
    for (Object o : (List<?>) v) {
      if (o instanceof Map && "AzureResource".equals(((Map<?, ?>) o).get("Type"))) {
        Object id = ((Map<?, ?>) o).get("AzureResourceId");
        String sub = subscriptionFrom(id instanceof String ? (String) id : "");
        if (!sub.equals("unknown")) {
          return sub;
        }
      }
    }
    return "unknown";
  }

  static String extractAzureTenant(Object v) {
    if (!(v instanceof List)) {
      return "";
    }
    for (Object o : (List<?>) v) {
      if (o instanceof Map && "AAD".equals(((Map<?, ?>) o).get("Type"))) {
        Object t = ((Map<?, ?>) o).get("AadTenantId");
        return t == null ? "" : FilterValues.toStr(t);
      }
    }
    return "";
  }

  static Object extractSourceIp(Object v) {
    if (!(v instanceof List)) {
      return null;
    }
    for (Object o : (List<?>) v) {
      if (!(o instanceof Map)) {
        continue;
      }
      Map<?, ?> entity = (Map<?, ?>) o;
      Object type = entity.get("Type");
      String t = type instanceof String ? (String) type : "";
      if (!t.toLowerCase().contains("ip")) {
        continue;
      }
      for (String field : new String[] {"Address", "SourceAddress", "address"}) {
        if (entity.containsKey(field)) {
          Object a = entity.get(field);
          if (a instanceof Map) {
            return ((Map<?, ?>) a).get("Address");
          }
          return a;
        }
      }
    }
    return null;
  }

  static Object truncate(Object v, int length) {
    String s = string(v);
    if (s != null && s.length() > length) {
      return s.substring(0, length) + "...";
    }
    return v;
  }

  static long complianceSeverity(Object current, Object max) {
    if (!FilterValues.isTruthy(current) || !FilterValues.isTruthy(max)) {
      return 3L;
    }
    try {
      double m = FilterValues.toDouble(max);
      if (m == 0.0) {
        return 3L;
      }
      double pct = FilterValues.toDouble(current) / m;
      if (pct >= 0.9) {
        return 1L;
      } else if (pct >= 0.7) {
        return 2L;
      } else if (pct >= 0.5) {
        return 3L;
      } else if (pct >= 0.3) {
        return 4L;
      }
      return 5L;
    } catch (NumberFormatException exc) {
      return 3L;
    }
  }

  /**
   * Convert score arguments to a percentage
   *
   * <p>With a single argument the score is already a percentage.
   *
   * @return Percentage, or null when the maximum is zero
   * @throws NumberFormatException for non-numeric input
   */
  private static Double scorePercentage(Object current, Object max) {
    if (max == null) {
      return FilterValues.toDouble(current);
    }
    double m = FilterValues.toDouble(max);
    if (m == 0.0) {
      return null;
    }
    return FilterValues.toDouble(current) / m * 100.0;
  }

  static String scoreToSeverity(Object current, Object max) {
    try {
      Double pct = scorePercentage(current, max);
      if (pct == null) {
        return "MEDIUM";
      }
      if (pct >= 90) {
        return "INFORMATIONAL";
      } else if (pct >= 70) {
        return "LOW";
      } else if (pct >= 50) {
        return "MEDIUM";
      }
      return "HIGH";
    } catch (NumberFormatException exc) {
      return "MEDIUM";
    }
  }

  static long scoreToSeverityNormalized(Object current, Object max) {
    try {
      Double pct = scorePercentage(current, max);
      if (pct == null) {
        return 50L;
      }
      long n = (long) (100 - pct);
      return Math.max(0L, Math.min(100L, n));
    } catch (NumberFormatException exc) {
      return 50L;
    }
  }

  static String scoreToComplianceStatus(Object current, Object max) {
    try {
      Double pct = scorePercentage(current, max);
      if (pct == null) {
        return "NOT_AVAILABLE";
      }
      if (pct >= 90) {
        return "PASSED";
      } else if (pct >= 70) {
        return "WARNING";
      }
      return "FAILED";
    } catch (NumberFormatException exc) {
      return "NOT_AVAILABLE";
    }
  }

  /**
   * Test if a value carries usable content
   *
   * <p>Null, blank strings, the strings none, unknown and n/a in any case, and empty containers
   * are invalid.
   *
   * @param v Value
   * @return boolean
   */
  public static boolean isValid(Object v) {
    if (v == null) {
      return false;
    }
    if (v instanceof String) {
      String s = ((String) v).trim().toLowerCase();
      if (s.isEmpty() || s.equals("none") || s.equals("unknown") || s.equals("n/a")) {
        return false;
      }
    }
    if (v instanceof Collection && ((Collection<?>) v).isEmpty()) {
      return false;
    }
    if (v instanceof Map && ((Map<?, ?>) v).isEmpty()) {
      return false;
    }
    return true;
  }

  static String extractIp(Object v) {
    String a = nonEmptyString(v);
    if (a == null) {
      return "";
    }
    if (!a.contains(":") || InetAddressValidator.getInstance().isValidInet6Address(a)) {
      return a;
    }
    if (a.startsWith("[")) {
      int end = a.indexOf(']');
      return end > 0 ? a.substring(1, end) : a;
    }
    if (a.indexOf(':') == a.lastIndexOf(':')) {
      return a.substring(0, a.indexOf(':'));
    }
    return a;
  }

  static Long extractPort(Object v) {
    String a = nonEmptyString(v);
    if (a == null || !a.contains(":")) {
      return null;
    }
    String port = null;
    if (a.startsWith("[")) {
      int end = a.indexOf(']');
      if (end > 0 && end < a.length() - 1) {
        port = end + 2 <= a.length() ? a.substring(end + 2) : "";
      }
    } else if (a.indexOf(':') == a.lastIndexOf(':')) {
      port = a.substring(a.indexOf(':') + 1);
    }
    if (port == null) {
      return null;
    }
    try {
      return Long.parseLong(port.trim());
    } catch (NumberFormatException exc) {
      return null;
    }
  }

  static String slugify(Object v) {
    if (v == null) {
      return "";
    }
    String s = FilterValues.toStr(v);
    if (s.trim().isEmpty()) {
      return "";
    }
    String slug = s.toLowerCase().replaceAll("[^a-z0-9]+", "-");
    slug = slug.replaceAll("^-+", "").replaceAll("-+$", "");
    return slug.replaceAll("-+", "-");
  }

  private static String lowerOrNull(Object v) {
    String s = nonEmptyString(v);
    return s == null ? null : s.toLowerCase();
  }

  private static Map<String, TemplateFilter> build() {
    HashMap<String, TemplateFilter> m = new HashMap<>();

    // Event conversion filters
    m.put("normalize_timestamp", (v, a, k) -> normalizeTimestamp(v));
    m.put(
        "format_severity",
        (v, a, k) -> {
          if (!FilterValues.isTruthy(v)) {
            return "Unknown";
          }
          String s = FilterValues.toStr(v);
          return SEVERITY_NAMES.getOrDefault(s.toLowerCase(), s);
        });
    m.put("generate_uuid", (v, a, k) -> generateUuid());
    m.put("to_json", (v, a, k) -> FilterValues.isTruthy(v) ? FilterValues.toJson(v) : "{}");
    m.put(
        "safe_get",
        (v, a, k) -> {
          Object def = arg(a, k, 1, "default", null);
          Object key = arg(a, k, 0, "key", null);
          if (v instanceof Map && key != null && ((Map<?, ?>) v).containsKey(key.toString())) {
            return ((Map<?, ?>) v).get(key.toString());
          }
          return def;
        });
    m.put("json_escape", (v, a, k) -> jsonEscape(v));
    m.put("to_unix_timestamp", (v, a, k) -> toUnixTimestampMillis(v));
    m.put("to_unix_timestamp_ms", (v, a, k) -> toUnixTimestampMillis(v));
    m.put(
        "map_azure_severity_to_ocsf",
        (v, a, k) -> AZURE_SEVERITY.getOrDefault(FilterValues.toStr(v), 99L));
    m.put("map_alert_status", (v, a, k) -> ALERT_STATUS.getOrDefault(FilterValues.toStr(v), 99L));
    m.put("map_confidence_level", (v, a, k) -> CONFIDENCE.getOrDefault(FilterValues.toStr(v), 99L));
    m.put("extract_subscription_id", (v, a, k) -> extractSubscriptionId(v));
    m.put("extract_azure_region", (v, a, k) -> "unknown");
    m.put("extract_resource_name", (v, a, k) -> extractResourceName(v));
    m.put("extract_azure_resource_type", (v, a, k) -> extractAzureResourceType(v));
    m.put(
        "map_mitre_tactic",
        (v, a, k) -> MITRE_TACTICS.getOrDefault(FilterValues.toStr(v), "TA0000"));
    m.put(
        "truncate",
        (v, a, k) -> truncate(v, FilterValues.toNumber(arg(a, k, 0, "length", 500L)).intValue()));
    m.put("extract_azure_subscription", (v, a, k) -> extractAzureSubscription(v));
    m.put("extract_source_ip", (v, a, k) -> extractSourceIp(v));
    m.put("extract_azure_tenant", (v, a, k) -> extractAzureTenant(v));
    m.put(
        "calculate_compliance_severity",
        (v, a, k) -> complianceSeverity(v, arg(a, k, 0, "max_score", null)));
    m.put(
        "calculate_compliance_severity_name",
        (v, a, k) ->
            SEVERITY_ID_NAMES.getOrDefault(
                complianceSeverity(v, arg(a, k, 0, "max_score", null)), "Medium"));
    m.put("safe_string", (v, a, k) -> v == null ? "Unknown" : FilterValues.toStr(v));

    // ASFF filters
    m.put(
        "asff_severity_label",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          if (s == null || !SEVERITY_NAMES.containsKey(s)) {
            return "INFORMATIONAL";
          }
          return s.toUpperCase();
        });
    m.put(
        "asff_severity_normalized",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          return s == null ? 0L : ASFF_NORMALIZED.getOrDefault(s, 0L);
        });
    m.put(
        "to_asff_types",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          if (s != null) {
            for (Map.Entry<String, String> e : ASFF_TYPES.entrySet()) {
              if (s.contains(e.getKey().toLowerCase())) {
                return FilterValues.toJson(Collections.singletonList(e.getValue()));
              }
            }
          }
          return FilterValues.toJson(Collections.singletonList(DEFAULT_ASFF_TYPE));
        });
    m.put(
        "compliance_status",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          return s == null ? "FAILED" : COMPLIANCE_STATUS.getOrDefault(s, "FAILED");
        });
    m.put(
        "asff_record_state",
        (v, a, k) -> {
          String s = nonEmptyString(v);
          if (s == null) {
            return "ACTIVE";
          }
          String u = s.toUpperCase();
          return u.equals("PASSED") || u.equals("PASS") || u.equals("HEALTHY")
              ? "ARCHIVED"
              : "ACTIVE";
        });
    m.put("score_to_severity", (v, a, k) -> scoreToSeverity(v, arg(a, k, 0, "max_score", null)));
    m.put(
        "score_to_severity_normalized",
        (v, a, k) -> scoreToSeverityNormalized(v, arg(a, k, 0, "max_score", null)));
    m.put(
        "score_to_compliance_status",
        (v, a, k) -> scoreToComplianceStatus(v, arg(a, k, 0, "max_score", null)));
    m.put(
        "score_to_reason_code",
        (v, a, k) -> scoreToComplianceStatus(v, arg(a, k, 0, "max_score", null)));
    m.put(
        "compliance_reason_code",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          return s == null ? "NOT_AVAILABLE" : REASON_CODES.getOrDefault(s, "NOT_AVAILABLE");
        });

    // Validity helpers
    m.put("is_valid", (v, a, k) -> isValid(v));
    m.put(
        "default_if_invalid",
        (v, a, k) -> isValid(v) ? v : arg(a, k, 0, "default", null));
    m.put("omit_if_invalid", (v, a, k) -> isValid(v) ? v : null);

    m.put("add_one_second", (v, a, k) -> addOneSecond(v));
    m.put("extract_ip", (v, a, k) -> extractIp(v));
    m.put("extract_port", (v, a, k) -> extractPort(v));
    m.put(
        "map_compliance_status",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          return s == null ? "Unknown" : OCSF_COMPLIANCE.getOrDefault(s, "Unknown");
        });
    m.put(
        "map_compliance_status_id",
        (v, a, k) -> {
          String s = lowerOrNull(v);
          return s == null ? 99L : OCSF_COMPLIANCE_ID.getOrDefault(s, 99L);
        });
    m.put("slugify", (v, a, k) -> slugify(v));

    return Collections.unmodifiableMap(m);
  }
}
