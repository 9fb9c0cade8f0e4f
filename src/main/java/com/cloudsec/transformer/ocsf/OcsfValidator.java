package com.cloudsec.transformer.ocsf;

import com.cloudsec.transformer.FileUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates OCSF events against supported schema versions and the finding class dictionary
 *
 * <p>Required identification fields and class consistency produce errors. Structural hints such
 * as recommended fields or type_uid consistency produce warnings. Deep schema validation is best
 * effort and degrades to a warning when no schema is bundled for the version.
 */
public class OcsfValidator {
  public static final List<String> SUPPORTED_VERSIONS =
      Collections.unmodifiableList(Arrays.asList("1.7.0", "1.1.0", "1.0.0-rc.2"));

  public static final String DEPRECATED_CLASS_UID = "2001";

  private static final String SCHEMA_PATH = "/ocsf/schema/%s/finding.json";

  private static final List<String> RECOMMENDED_FIELDS =
      Arrays.asList("category_uid", "activity_id", "time");

  private static final List<String> TIMESTAMP_FIELDS =
      Arrays.asList("time", "start_time", "end_time");

  private static final long MAX_TIMESTAMP = 9999999999999L;

  private static final Map<String, Set<Long>> ENUMS = new TreeMap<>();

  static {
    ENUMS.put("severity_id", new HashSet<>(Arrays.asList(0L, 1L, 2L, 3L, 4L, 5L, 6L, 99L)));
    ENUMS.put("confidence_id", new HashSet<>(Arrays.asList(0L, 1L, 2L, 3L, 99L)));
    ENUMS.put("status_id", new HashSet<>(Arrays.asList(0L, 1L, 2L, 3L, 4L, 5L, 6L, 99L)));
    ENUMS.put("activity_id", new HashSet<>(Arrays.asList(0L, 1L, 2L, 3L, 99L)));
  }

  private final Logger log = LoggerFactory.getLogger(OcsfValidator.class);

  private final OcsfClassDictionary dictionary;
  private final ObjectMapper mapper;
  private final JsonSchemaFactory schemaFactory;
  private final ConcurrentHashMap<String, Optional<JsonSchema>> schemas;

  private static Long integral(Object o) {
    if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
      return ((Number) o).longValue();
    }
    if (o instanceof BigInteger) {
      return ((BigInteger) o).longValue();
    }
    return null;
  }

  /**
   * Validate an OCSF event
   *
   * @param event Event fields
   * @return OcsfValidationResult
   */
  public OcsfValidationResult validate(Map<String, Object> event) {
    OcsfValidationResult result = new OcsfValidationResult();

    if (!event.containsKey("class_uid") || event.get("class_uid") == null) {
      result.addError("The class_uid field has not been defined");
      return result;
    }
    Object metadata = event.get("metadata");
    if (!(metadata instanceof Map) || ((Map<?, ?>) metadata).get("version") == null) {
      result.addError("The version field has not been defined within metadata");
      return result;
    }
    Map<?, ?> meta = (Map<?, ?>) metadata;
    String classUid = String.valueOf(event.get("class_uid"));
    String version = String.valueOf(meta.get("version"));
    result.setClassUid(classUid);
    result.setVersion(version);
    Object profiles = meta.get("profiles");
    if (profiles instanceof List) {
      ArrayList<String> p = new ArrayList<>();
      for (Object o : (List<?>) profiles) {
        p.add(String.valueOf(o));
      }
      result.setProfiles(p);
    }

    if (!SUPPORTED_VERSIONS.contains(version)) {
      result.addError(
          String.format(
              "%s is not a supported OCSF schema version. Please ensure the schema version is one"
                  + " of the following: %s",
              version, String.join(", ", SUPPORTED_VERSIONS)));
      return result;
    }
    OcsfClassInfo info = dictionary.get(version, classUid);
    if (info == null) {
      result.addError(
          String.format("The class_uid: %s is not defined within OCSF %s", classUid, version));
      return result;
    }

    checkConsistency(event, classUid, info, result);
    if (classUid.equals(DEPRECATED_CLASS_UID)) {
      result.addWarning(
          String.format("OCSF event class: %s (%s) is deprecated!", info.getClassName(), classUid));
    }
    checkStructure(event, result);
    checkEnums(event, result);
    checkTimestamps(event, result);
    checkSchema(event, version, result);

    if (result.isValid()) {
      log.debug("valid OCSF {} event (class_uid: {})", version, classUid);
    } else {
      log.warn("invalid OCSF event (class_uid: {}): {}", classUid, result.getErrors());
    }
    return result;
  }

  private void checkConsistency(
      Map<String, Object> event, String classUid, OcsfClassInfo info, OcsfValidationResult result) {
    if (event.containsKey("class_name") && !info.getClassName().equals(event.get("class_name"))) {
      result.addError(
          String.format(
              "The input contains the 'class name' value: %s. Using OCSF class uid %s requires"
                  + " the 'class name' value: %s",
              event.get("class_name"), classUid, info.getClassName()));
    }
    if (event.containsKey("category_name")
        && !info.getCategoryName().equals(event.get("category_name"))) {
      result.addError(
          String.format(
              "The input contains the 'category name' value: %s. Using OCSF class uid %s requires"
                  + " the 'category name' value: %s",
              event.get("category_name"), classUid, info.getCategoryName()));
    }
    if (event.containsKey("category_uid")) {
      Long cat = integral(event.get("category_uid"));
      if (cat == null || cat != info.getCategoryUid()) {
        result.addError(
            String.format(
                "The input contains the 'category uid' value: %s. Using OCSF class uid %s"
                    + " requires the 'category uid' value: %d",
                event.get("category_uid"), classUid, info.getCategoryUid()));
      }
    }
  }

  private void checkStructure(Map<String, Object> event, OcsfValidationResult result) {
    for (String f : RECOMMENDED_FIELDS) {
      if (!event.containsKey(f) || event.get(f) == null) {
        result.addWarning(String.format("Missing recommended OCSF field: %s", f));
      }
    }
    Long cls = integral(event.get("class_uid"));
    if (cls == null) {
      try {
        cls = Long.parseLong(String.valueOf(event.get("class_uid")));
      } catch (NumberFormatException exc) {
        log.debug("class_uid {} is not numeric, skipping type_uid check", event.get("class_uid"));
      }
    }
    Long activity = integral(event.get("activity_id"));
    if (event.containsKey("type_uid") && cls != null && activity != null) {
      long expected = cls * 100 + activity;
      Long typeUid = integral(event.get("type_uid"));
      if (typeUid == null || typeUid != expected) {
        result.addWarning(
            String.format("type_uid should be %d (class_uid * 100 + activity_id)", expected));
      }
    }
  }

  private void checkEnums(Map<String, Object> event, OcsfValidationResult result) {
    for (Map.Entry<String, Set<Long>> e : ENUMS.entrySet()) {
      if (!event.containsKey(e.getKey())) {
        continue;
      }
      Long v = integral(event.get(e.getKey()));
      if (v == null || !e.getValue().contains(v)) {
        result.addError(
            String.format(
                "Invalid %s value: %s. Valid values: %s",
                e.getKey(), event.get(e.getKey()), sorted(e.getValue())));
      }
    }
  }

  private static List<Long> sorted(Set<Long> s) {
    ArrayList<Long> ret = new ArrayList<>(s);
    Collections.sort(ret);
    return ret;
  }

  private void checkTimestamps(Map<String, Object> event, OcsfValidationResult result) {
    for (String f : TIMESTAMP_FIELDS) {
      if (!event.containsKey(f)) {
        continue;
      }
      Object v = event.get(f);
      Long ts = integral(v);
      if (ts == null) {
        result.addError(
            String.format(
                "%s should be timestamp_t (integer milliseconds), got %s",
                f, v == null ? "null" : v.getClass().getSimpleName()));
      } else if (ts < 0 || ts > MAX_TIMESTAMP) {
        result.addWarning(String.format("%s timestamp seems out of reasonable range: %d", f, ts));
      }
    }
  }

  private Optional<JsonSchema> schemaFor(String version) {
    return schemas.computeIfAbsent(
        version,
        v -> {
          String path = String.format(SCHEMA_PATH, v);
          if (!FileUtil.exists(path)) {
            return Optional.empty();
          }
          try (InputStream in = FileUtil.getStreamFromPath(path)) {
            return Optional.of(schemaFactory.getSchema(in));
          } catch (IOException exc) {
            log.warn("failed to load OCSF schema {}: {}", path, exc.getMessage());
            return Optional.empty();
          }
        });
  }

  private void checkSchema(Map<String, Object> event, String version, OcsfValidationResult result) {
    Optional<JsonSchema> schema = schemaFor(version);
    if (!schema.isPresent()) {
      result.addWarning(
          String.format("no OCSF %s schema available, skipping schema validation", version));
      return;
    }
    JsonNode node = mapper.valueToTree(event);
    for (ValidationMessage m : schema.get().validate(node)) {
      result.addError(String.format("schema: %s", m.getMessage()));
    }
  }

  public OcsfClassDictionary getDictionary() {
    return dictionary;
  }

  /**
   * Create validator using the given class dictionary
   *
   * @param dictionary Class dictionary
   */
  public OcsfValidator(OcsfClassDictionary dictionary) {
    this.dictionary = dictionary;
    mapper = new ObjectMapper();
    schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    schemas = new ConcurrentHashMap<>();
  }

  /**
   * Create validator using the bundled class dictionary
   *
   * @throws IOException if the bundled dictionary cannot be read
   */
  public OcsfValidator() throws IOException {
    this(OcsfClassDictionary.load());
  }
}
