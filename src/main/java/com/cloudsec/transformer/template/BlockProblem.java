package com.cloudsec.transformer.template;

/** A block tag without a matching partner */
public class BlockProblem {
  /** Problem kinds */
  public enum Kind {
    /** End tag with no open block */
    UNEXPECTED,
    /** End tag closing a different block than the innermost open one */
    MISMATCHED,
    /** Block still open at the end of the template */
    UNCLOSED
  }

  private final Kind kind;
  private final String tag;
  private final String openBlock;
  private final int line;
  private final int openLine;

  BlockProblem(Kind kind, String tag, String openBlock, int line, int openLine) {
    this.kind = kind;
    this.tag = tag;
    this.openBlock = openBlock;
    this.line = line;
    this.openLine = openLine;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Tag the problem was found at
   *
   * @return End tag name, or the block name for {@link Kind#UNCLOSED}
   */
  public String getTag() {
    return tag;
  }

  /**
   * Innermost open block when the problem was found
   *
   * @return Block name, null for {@link Kind#UNEXPECTED}
   */
  public String getOpenBlock() {
    return openBlock;
  }

  /**
   * Template line the problem is reported at
   *
   * @return Line number, starting at 1
   */
  public int getLine() {
    return line;
  }

  /**
   * Line the innermost open block started on
   *
   * @return Line number, 0 for {@link Kind#UNEXPECTED}
   */
  public int getOpenLine() {
    return openLine;
  }

  /**
   * Describe the problem
   *
   * @return Message
   */
  public String getMessage() {
    switch (kind) {
      case UNEXPECTED:
        return String.format("Unexpected '%s' without matching '%s'", tag, tag.substring(3));
      case MISMATCHED:
        return String.format("Mismatched block: found '%s' but expected 'end%s'", tag, openBlock);
      default:
        return String.format("Unclosed '%s' block - missing 'end%s'", tag, tag);
    }
  }

  @Override
  public String toString() {
    return String.format("%s (line %d)", getMessage(), line);
  }
}
