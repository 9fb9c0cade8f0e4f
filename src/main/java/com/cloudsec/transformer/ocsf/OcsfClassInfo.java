package com.cloudsec.transformer.ocsf;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.Serializable;

/** Canonical naming of an OCSF event class */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OcsfClassInfo implements Serializable {
  private static final long serialVersionUID = 1L;

  private String url;
  private String className;
  private String categoryName;
  private long categoryUid;

  @JsonProperty("url")
  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  @JsonProperty("class_name")
  public String getClassName() {
    return className;
  }

  public void setClassName(String className) {
    this.className = className;
  }

  @JsonProperty("category_name")
  public String getCategoryName() {
    return categoryName;
  }

  public void setCategoryName(String categoryName) {
    this.categoryName = categoryName;
  }

  @JsonProperty("category_uid")
  public long getCategoryUid() {
    return categoryUid;
  }

  public void setCategoryUid(long categoryUid) {
    this.categoryUid = categoryUid;
  }
}
