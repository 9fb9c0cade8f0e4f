package com.cloudsec.transformer;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;

/** Pipeline options that configure an {@link EventTransformer} */
public interface TransformerOptions extends PipelineOptions {
  @Description("Path to event type mapping configuration; resource path or file system path")
  @Default.String("/mapping/event_type_mappings.json")
  String getMappingPath();

  void setMappingPath(String value);

  @Description("Template directory; resource directory or file system directory")
  @Default.String("/templates")
  String getTemplateDirectory();

  void setTemplateDirectory(String value);

  @Description("Output format; cloudtrail, ocsf or asff")
  @Default.String("ocsf")
  String getOutputFormat();

  void setOutputFormat(String value);

  @Description("Account id of the recipient account")
  @Default.String("000000000000")
  String getAccountId();

  void setAccountId(String value);

  @Description("Region to report in transformed events; defaults to AWS_REGION")
  String getRegion();

  void setRegion(String value);

  @Description("Fail OCSF output that does not validate against the OCSF schema")
  @Default.Boolean(false)
  Boolean getEnforceOcsfValidation();

  void setEnforceOcsfValidation(Boolean value);

  @Description("Maximum number of compiled JSONPath expressions to cache")
  @Default.Integer(128)
  Integer getExtractorCacheSize();

  void setExtractorCacheSize(Integer value);
}
