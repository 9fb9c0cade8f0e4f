package com.cloudsec.transformer.template;

/** Template text could not be compiled */
public class TemplateSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final String detail;

  /**
   * Create exception
   *
   * @param detail Description of the problem
   * @param line Line number, starting at 1
   */
  public TemplateSyntaxException(String detail, int line) {
    super(String.format("%s (line %d)", detail, line));
    this.detail = detail;
    this.line = line;
  }

  /**
   * Description of the problem without position information
   *
   * @return String
   */
  public String getDetail() {
    return detail;
  }

  public int getLine() {
    return line;
  }
}
