package com.cloudsec.transformer.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits template expression text into tokens for static analysis
 *
 * <p>Only classifies tokens; evaluation is left to the template engine. Text inside string
 * literals never produces operator or name tokens.
 */
public class ExpressionTokens {
  /** Token classes */
  public enum Type {
    NAME,
    NUMBER,
    STRING,
    OPERATOR
  }

  private static final Set<String> TWO_CHAR_OPERATORS =
      new HashSet<>(Arrays.asList("**", "//", "==", "!=", "<=", ">=", "||", "&&"));

  /** A single token with its offset in the expression text */
  public static class Token {
    private final Type type;
    private final String text;
    private final int offset;

    Token(Type type, String text, int offset) {
      this.type = type;
      this.text = text;
      this.offset = offset;
    }

    public Type getType() {
      return type;
    }

    /**
     * Token text, the unquoted value for string literals
     *
     * @return String
     */
    public String getText() {
      return text;
    }

    public int getOffset() {
      return offset;
    }

    public boolean isName(String name) {
      return type == Type.NAME && text.equals(name);
    }

    public boolean isOperator(String op) {
      return type == Type.OPERATOR && text.equals(op);
    }

    @Override
    public String toString() {
      return type + ":" + text;
    }
  }

  private ExpressionTokens() {}

  /**
   * Tokenize expression text
   *
   * @param expr Expression without delimiters
   * @return Tokens in source order
   */
  public static List<Token> tokenize(String expr) {
    if (expr == null) {
      return Collections.emptyList();
    }
    ArrayList<Token> ret = new ArrayList<>();
    int i = 0;
    int n = expr.length();
    while (i < n) {
      char c = expr.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < n && (Character.isLetterOrDigit(expr.charAt(i)) || expr.charAt(i) == '_')) {
          i++;
        }
        ret.add(new Token(Type.NAME, expr.substring(start, i), start));
      } else if (Character.isDigit(c)) {
        int start = i;
        while (i < n && Character.isDigit(expr.charAt(i))) {
          i++;
        }
        if (i + 1 < n && expr.charAt(i) == '.' && Character.isDigit(expr.charAt(i + 1))) {
          i++;
          while (i < n && Character.isDigit(expr.charAt(i))) {
            i++;
          }
        }
        ret.add(new Token(Type.NUMBER, expr.substring(start, i), start));
      } else if (c == '\'' || c == '"') {
        int start = i;
        StringBuilder sb = new StringBuilder();
        i++;
        while (i < n && expr.charAt(i) != c) {
          if (expr.charAt(i) == '\\' && i + 1 < n) {
            i++;
          }
          sb.append(expr.charAt(i));
          i++;
        }
        i++;
        ret.add(new Token(Type.STRING, sb.toString(), start));
      } else if (i + 1 < n && TWO_CHAR_OPERATORS.contains(expr.substring(i, i + 2))) {
        ret.add(new Token(Type.OPERATOR, expr.substring(i, i + 2), i));
        i += 2;
      } else {
        ret.add(new Token(Type.OPERATOR, String.valueOf(c), i));
        i++;
      }
    }
    return ret;
  }

  /**
   * Names of the filters an expression applies
   *
   * @param tokens Tokens of one expression
   * @return Name tokens directly following a {@code |}, in source order
   */
  public static List<Token> filterNames(List<Token> tokens) {
    ArrayList<Token> ret = new ArrayList<>();
    for (int i = 0; i + 1 < tokens.size(); i++) {
      if (tokens.get(i).isOperator("|") && tokens.get(i + 1).getType() == Type.NAME) {
        ret.add(tokens.get(i + 1));
      }
    }
    return ret;
  }

  /**
   * Number of line breaks before an offset
   *
   * @param expr Expression text
   * @param offset Offset into the text
   * @return Lines to add to the expression's starting line
   */
  public static int lineOffset(String expr, int offset) {
    int lines = 0;
    for (int i = 0; i < offset && i < expr.length(); i++) {
      if (expr.charAt(i) == '\n') {
        lines++;
      }
    }
    return lines;
  }
}
