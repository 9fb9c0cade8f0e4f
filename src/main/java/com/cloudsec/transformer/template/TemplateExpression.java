package com.cloudsec.transformer.template;

/** An expression found in a parsed template, with the place it occurs in */
public class TemplateExpression {
  /** Position of an expression within the template */
  public enum Role {
    /** Written to the output, {@code {{ expr }}} */
    OUTPUT,
    /** Test of an {@code if} or {@code elif} tag */
    CONDITION,
    /** Sequence a {@code for} tag iterates */
    ITERABLE,
    /** Right hand side of a {@code set} tag */
    ASSIGNMENT
  }

  private final String text;
  private final int line;
  private final Role role;

  TemplateExpression(String text, int line, Role role) {
    this.text = text;
    this.line = line;
    this.role = role;
  }

  /**
   * Expression source without delimiters
   *
   * @return String
   */
  public String getText() {
    return text;
  }

  /**
   * Template line the expression starts on
   *
   * @return Line number, starting at 1
   */
  public int getLine() {
    return line;
  }

  public Role getRole() {
    return role;
  }

  @Override
  public String toString() {
    return String.format("%s@%d[%s]", role, line, text);
  }
}
