package com.cloudsec.transformer.filter;

/** Custom filter source could not be compiled into usable filters */
public class FilterCompilationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String filterName;

  /**
   * Create exception
   *
   * @param filterName Name of the offending filter, or null if not attributable to one
   * @param message Detail
   */
  public FilterCompilationException(String filterName, String message) {
    super(message);
    this.filterName = filterName;
  }

  /**
   * Create exception with cause
   *
   * @param filterName Name of the offending filter, or null if not attributable to one
   * @param message Detail
   * @param cause Cause
   */
  public FilterCompilationException(String filterName, String message, Throwable cause) {
    super(message, cause);
    this.filterName = filterName;
  }

  public String getFilterName() {
    return filterName;
  }
}
