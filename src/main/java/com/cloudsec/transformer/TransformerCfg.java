package com.cloudsec.transformer;

import static com.fasterxml.jackson.annotation.JsonInclude.Include;

import com.cloudsec.transformer.jsonpath.JsonPathExtractor;
import com.cloudsec.transformer.mapping.MappingRegistry;
import com.cloudsec.transformer.template.TemplateLoader;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;

/** Configuration used to construct an {@link EventTransformer} */
@JsonInclude(Include.NON_EMPTY)
public class TransformerCfg implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_REGION = "us-east-1";

  private String mappingPath;
  private String templateDirectory;
  private Boolean enforceOcsfValidation;
  private String region;
  private Integer extractorCacheSize;

  /**
   * Resolve default region from the environment
   *
   * <p>AWS_REGION is preferred, then AWS_DEFAULT_REGION, then {@link #DEFAULT_REGION}.
   *
   * @return Region
   */
  public static String regionFromEnvironment() {
    String r = System.getenv("AWS_REGION");
    if (r == null || r.isEmpty()) {
      r = System.getenv("AWS_DEFAULT_REGION");
    }
    if (r == null || r.isEmpty()) {
      return DEFAULT_REGION;
    }
    return r;
  }

  /**
   * Resolve OCSF enforcement from the VALIDATE_OCSF environment variable
   *
   * @return True if VALIDATE_OCSF is set to true
   */
  public static boolean enforceOcsfFromEnvironment() {
    String v = System.getenv("VALIDATE_OCSF");
    return v != null && v.equalsIgnoreCase("true");
  }

  /**
   * Create configuration using defaults and environment
   *
   * @return TransformerCfg
   */
  public static TransformerCfg fromEnvironment() {
    TransformerCfg cfg = new TransformerCfg();
    cfg.setEnforceOcsfValidation(enforceOcsfFromEnvironment());
    cfg.setRegion(regionFromEnvironment());
    return cfg;
  }

  /**
   * Create configuration from pipeline {@link TransformerOptions}
   *
   * @param options Pipeline options
   * @return TransformerCfg
   */
  public static TransformerCfg fromTransformerOptions(TransformerOptions options) {
    TransformerCfg cfg = new TransformerCfg();
    cfg.setMappingPath(options.getMappingPath());
    cfg.setTemplateDirectory(options.getTemplateDirectory());
    cfg.setEnforceOcsfValidation(options.getEnforceOcsfValidation());
    cfg.setRegion(options.getRegion() != null ? options.getRegion() : regionFromEnvironment());
    cfg.setExtractorCacheSize(options.getExtractorCacheSize());
    return cfg;
  }

  /**
   * Load configuration from a JSON document
   *
   * @param path Resource path or file system path
   * @return TransformerCfg
   * @throws IOException IOException
   */
  public static TransformerCfg load(String path) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    try (InputStream in = FileUtil.getStreamFromPath(path)) {
      return mapper.readValue(in, TransformerCfg.class);
    }
  }

  @JsonProperty("mapping_path")
  public String getMappingPath() {
    return mappingPath != null ? mappingPath : MappingRegistry.DEFAULT_PATH;
  }

  public void setMappingPath(String mappingPath) {
    this.mappingPath = mappingPath;
  }

  @JsonProperty("template_directory")
  public String getTemplateDirectory() {
    return templateDirectory != null ? templateDirectory : TemplateLoader.DEFAULT_TEMPLATE_DIR;
  }

  public void setTemplateDirectory(String templateDirectory) {
    this.templateDirectory = templateDirectory;
  }

  @JsonProperty("enforce_ocsf_validation")
  public Boolean getEnforceOcsfValidation() {
    return enforceOcsfValidation != null ? enforceOcsfValidation : false;
  }

  public void setEnforceOcsfValidation(Boolean enforceOcsfValidation) {
    this.enforceOcsfValidation = enforceOcsfValidation;
  }

  @JsonProperty("region")
  public String getRegion() {
    return region != null ? region : DEFAULT_REGION;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  @JsonProperty("extractor_cache_size")
  public Integer getExtractorCacheSize() {
    return extractorCacheSize != null ? extractorCacheSize : JsonPathExtractor.DEFAULT_CACHE_SIZE;
  }

  public void setExtractorCacheSize(Integer extractorCacheSize) {
    this.extractorCacheSize = extractorCacheSize;
  }

  /** Create new empty configuration */
  public TransformerCfg() {}
}
