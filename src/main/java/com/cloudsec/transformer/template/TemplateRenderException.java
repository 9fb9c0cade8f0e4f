package com.cloudsec.transformer.template;

/** Runtime failure while rendering a compiled template */
public class TemplateRenderException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private int line;

  /**
   * Create exception
   *
   * @param message Message
   */
  public TemplateRenderException(String message) {
    super(message);
  }

  /**
   * Create exception wrapping a cause
   *
   * @param message Message
   * @param cause Cause
   */
  public TemplateRenderException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Template line the failure occurred on
   *
   * @return Line number, 0 if unknown
   */
  public int getLine() {
    return line;
  }

  /**
   * Set template line, keeping the innermost line if already set
   *
   * @param line Line number
   * @return this
   */
  public TemplateRenderException atLine(int line) {
    if (this.line == 0) {
      this.line = line;
    }
    return this;
  }

  @Override
  public String getMessage() {
    if (line > 0) {
      return String.format("line %d: %s", line, super.getMessage());
    }
    return super.getMessage();
  }
}
