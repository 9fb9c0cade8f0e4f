package com.cloudsec.transformer.template;

/** A template file exists but could not be read, parsed or compiled */
public class TemplateLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Create exception
   *
   * @param message Detail
   * @param cause Cause
   */
  public TemplateLoadException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Create exception
   *
   * @param message Detail
   */
  public TemplateLoadException(String message) {
    super(message);
  }
}
