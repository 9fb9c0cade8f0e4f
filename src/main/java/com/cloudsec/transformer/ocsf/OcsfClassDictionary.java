package com.cloudsec.transformer.ocsf;

import com.cloudsec.transformer.FileUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per schema version dictionary of OCSF finding classes */
public class OcsfClassDictionary {
  public static final String DEFAULT_PATH = "/ocsf/class_dictionary.json";

  private final LinkedHashMap<String, LinkedHashMap<String, OcsfClassInfo>> versions;

  /**
   * Load dictionary from resource or file
   *
   * @param path Resource path or file system path
   * @return OcsfClassDictionary
   * @throws IOException IOException
   */
  public static OcsfClassDictionary load(String path) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    try (InputStream in = FileUtil.getStreamFromPath(path)) {
      return new OcsfClassDictionary(
          mapper.readValue(
              in,
              new TypeReference<LinkedHashMap<String, LinkedHashMap<String, OcsfClassInfo>>>() {}));
    }
  }

  /**
   * Load the bundled dictionary
   *
   * @return OcsfClassDictionary
   * @throws IOException IOException
   */
  public static OcsfClassDictionary load() throws IOException {
    return load(DEFAULT_PATH);
  }

  /**
   * Supported schema versions
   *
   * @return Versions in dictionary order
   */
  public List<String> getVersions() {
    return Collections.unmodifiableList(new ArrayList<>(versions.keySet()));
  }

  public boolean supportsVersion(String version) {
    return versions.containsKey(version);
  }

  /**
   * Look up class information
   *
   * @param version Schema version
   * @param classUid Class identifier as text
   * @return OcsfClassInfo, or null if the class is not defined for the version
   */
  public OcsfClassInfo get(String version, String classUid) {
    Map<String, OcsfClassInfo> classes = versions.get(version);
    if (classes == null) {
      return null;
    }
    return classes.get(classUid);
  }

  OcsfClassDictionary(LinkedHashMap<String, LinkedHashMap<String, OcsfClassInfo>> versions) {
    this.versions = versions;
  }
}
