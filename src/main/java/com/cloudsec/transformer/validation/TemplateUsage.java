package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.template.CompiledTemplate;
import com.cloudsec.transformer.template.ExpressionTokens;
import com.cloudsec.transformer.template.ExpressionTokens.Token;
import com.cloudsec.transformer.template.TemplateExpression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects extractor references, filter uses and the way each extractor value is used in a
 * parsed template
 *
 * <p>Works on the expressions of the template's node tree. The kind of use is inferred from the
 * tokens directly around each reference.
 */
public class TemplateUsage {
  /** How a value is used by the template */
  public enum ValueKind {
    LIST,
    MAP,
    NUMBER,
    STRING,
    BOOLEAN
  }

  /** A reference to a name at a template line */
  public static class Reference {
    private final String name;
    private final int line;

    Reference(String name, int line) {
      this.name = name;
      this.line = line;
    }

    public String getName() {
      return name;
    }

    public int getLine() {
      return line;
    }
  }

  private static final Set<String> NUMERIC_FILTERS =
      new HashSet<>(
          Arrays.asList(
              "abs",
              "round",
              "int",
              "float",
              "score_to_severity",
              "score_to_severity_normalized",
              "score_to_compliance_status",
              "score_to_reason_code",
              "calculate_compliance_severity",
              "calculate_compliance_severity_name",
              "asff_severity_normalized"));

  private static final Set<String> LIST_FILTERS =
      new HashSet<>(
          Arrays.asList(
              "join", "first", "last", "sort", "unique", "list", "sum", "min", "max", "reverse"));

  private static final Set<String> MAP_FILTERS =
      new HashSet<>(Arrays.asList("items", "dictsort", "safe_get"));

  private static final Set<String> MAP_METHODS =
      new HashSet<>(Arrays.asList("items", "keys", "values", "get"));

  private static final Set<String> STRING_METHODS =
      new HashSet<>(
          Arrays.asList(
              "lower", "upper", "strip", "split", "startswith", "endswith", "replace"));

  private static final Set<String> ARITHMETIC =
      new HashSet<>(Arrays.asList("-", "*", "/", "//", "%", "**"));

  private static final Set<String> ORDERING =
      new HashSet<>(Arrays.asList("<", ">", "<=", ">=", "lt", "gt", "le", "ge"));

  private static final Set<String> EQUALITY =
      new HashSet<>(Arrays.asList("==", "!=", "eq", "ne"));

  private static final Set<String> LOGICAL =
      new HashSet<>(Arrays.asList("and", "or", "&&", "||"));

  private final ArrayList<Reference> extractorRefs;
  private final ArrayList<Reference> filterUses;
  private final HashMap<String, EnumSet<ValueKind>> kinds;

  /**
   * Analyse a parsed template
   *
   * @param template Parsed template
   * @return TemplateUsage
   */
  public static TemplateUsage of(CompiledTemplate template) {
    TemplateUsage u = new TemplateUsage();
    for (TemplateExpression e : template.getExpressions()) {
      u.visit(e);
    }
    return u;
  }

  private TemplateUsage() {
    extractorRefs = new ArrayList<>();
    filterUses = new ArrayList<>();
    kinds = new HashMap<>();
  }

  private static Token at(List<Token> tokens, int i) {
    return i >= 0 && i < tokens.size() ? tokens.get(i) : null;
  }

  private static boolean isOperator(Token t, Set<String> ops) {
    if (t == null) {
      return false;
    }
    if (t.getType() == ExpressionTokens.Type.OPERATOR) {
      return ops.contains(t.getText());
    }
    return t.getType() == ExpressionTokens.Type.NAME && ops.contains(t.getText());
  }

  private static boolean isLiteral(Token t, ExpressionTokens.Type type) {
    return t != null && t.getType() == type;
  }

  private static boolean isBooleanLiteral(Token t) {
    return t != null
        && t.getType() == ExpressionTokens.Type.NAME
        && (t.getText().equalsIgnoreCase("true") || t.getText().equalsIgnoreCase("false"));
  }

  /**
   * Length of the {@code extractors.X} or {@code extractors['X']} reference starting at a token
   *
   * @return Number of tokens, 0 if no reference starts there
   */
  private static int referenceLength(List<Token> tokens, int i) {
    Token t = at(tokens, i);
    if (t == null || !t.isName("extractors")) {
      return 0;
    }
    Token prev = at(tokens, i - 1);
    if (prev != null && prev.isOperator(".")) {
      return 0;
    }
    Token next = at(tokens, i + 1);
    Token name = at(tokens, i + 2);
    if (next != null && next.isOperator(".") && isLiteral(name, ExpressionTokens.Type.NAME)) {
      return 3;
    }
    Token close = at(tokens, i + 3);
    if (next != null
        && next.isOperator("[")
        && isLiteral(name, ExpressionTokens.Type.STRING)
        && close != null
        && close.isOperator("]")) {
      return 4;
    }
    return 0;
  }

  private void visit(TemplateExpression expr) {
    List<Token> tokens = ExpressionTokens.tokenize(expr.getText());
    for (Token f : ExpressionTokens.filterNames(tokens)) {
      filterUses.add(new Reference(f.getText(), lineOf(expr, f)));
    }
    for (int i = 0; i < tokens.size(); i++) {
      int len = referenceLength(tokens, i);
      if (len == 0) {
        continue;
      }
      String name = tokens.get(i + 2).getText();
      extractorRefs.add(new Reference(name, lineOf(expr, tokens.get(i))));
      EnumSet<ValueKind> set = kinds.get(name);
      if (set == null) {
        set = EnumSet.noneOf(ValueKind.class);
        kinds.put(name, set);
      }
      ValueKind k = kindAt(tokens, i, i + len, expr.getRole());
      if (k != null) {
        set.add(k);
      }
    }
  }

  private static int lineOf(TemplateExpression expr, Token t) {
    return expr.getLine() + ExpressionTokens.lineOffset(expr.getText(), t.getOffset());
  }

  /**
   * Kind of use of the reference spanning tokens {@code [start, end)}
   */
  private static ValueKind kindAt(
      List<Token> tokens, int start, int end, TemplateExpression.Role role) {
    Token next = at(tokens, end);
    Token after = at(tokens, end + 1);
    Token prev = at(tokens, start - 1);
    Token before = at(tokens, start - 2);

    if (next != null && next.isOperator(".") && isLiteral(after, ExpressionTokens.Type.NAME)) {
      Token call = at(tokens, end + 2);
      if (call != null && call.isOperator("(")) {
        if (MAP_METHODS.contains(after.getText())) {
          return ValueKind.MAP;
        }
        return STRING_METHODS.contains(after.getText()) ? ValueKind.STRING : null;
      }
      return ValueKind.MAP;
    }
    if (next != null && next.isOperator("[")) {
      return ValueKind.MAP;
    }
    if (next != null && next.isOperator("|") && isLiteral(after, ExpressionTokens.Type.NAME)) {
      if (NUMERIC_FILTERS.contains(after.getText())) {
        return ValueKind.NUMBER;
      }
      if (LIST_FILTERS.contains(after.getText())) {
        return ValueKind.LIST;
      }
      return MAP_FILTERS.contains(after.getText()) ? ValueKind.MAP : null;
    }

    ValueKind k = kindFromOperator(next, after);
    if (k == null) {
      k = kindFromOperator(prev, before);
    }
    if (k != null) {
      return k;
    }
    if (prev != null && prev.isName("in")) {
      return isLiteral(before, ExpressionTokens.Type.STRING) ? ValueKind.STRING : ValueKind.LIST;
    }
    if (isOperator(prev, LOGICAL) || isOperator(next, LOGICAL)) {
      return ValueKind.BOOLEAN;
    }
    if (prev != null && (prev.isName("not") || prev.isOperator("!") || prev.isName("if"))) {
      return ValueKind.BOOLEAN;
    }
    if (next != null && next.isName("is")) {
      return ValueKind.BOOLEAN;
    }
    boolean whole = start == 0 && end == tokens.size();
    if (whole && role == TemplateExpression.Role.CONDITION) {
      return ValueKind.BOOLEAN;
    }
    if (whole && role == TemplateExpression.Role.ITERABLE) {
      return ValueKind.LIST;
    }
    return null;
  }

  /**
   * Kind implied by a binary operator next to the reference
   *
   * @param op Operator token adjacent to the reference
   * @param other Operand on the far side of the operator
   */
  private static ValueKind kindFromOperator(Token op, Token other) {
    if (op == null) {
      return null;
    }
    if (isOperator(op, ARITHMETIC) || isOperator(op, ORDERING)) {
      return ValueKind.NUMBER;
    }
    if (op.isOperator("+")) {
      if (isLiteral(other, ExpressionTokens.Type.NUMBER)) {
        return ValueKind.NUMBER;
      }
      return isLiteral(other, ExpressionTokens.Type.STRING) ? ValueKind.STRING : null;
    }
    if (isOperator(op, EQUALITY)) {
      if (isLiteral(other, ExpressionTokens.Type.NUMBER)) {
        return ValueKind.NUMBER;
      }
      if (isBooleanLiteral(other)) {
        return ValueKind.BOOLEAN;
      }
      return isLiteral(other, ExpressionTokens.Type.STRING) ? ValueKind.STRING : null;
    }
    return null;
  }

  /**
   * Every {@code extractors.X} reference in source order
   *
   * @return List of references
   */
  public List<Reference> getExtractorReferences() {
    return Collections.unmodifiableList(extractorRefs);
  }

  /**
   * Every filter application in source order
   *
   * @return List of references
   */
  public List<Reference> getFilterUses() {
    return Collections.unmodifiableList(filterUses);
  }

  /**
   * Most specific way the template uses an extractor's value
   *
   * <p>When a value is used in more than one way the first kind in {@link ValueKind} order wins.
   *
   * @param extractor Extractor name
   * @return Kind, or null if the value is only rendered or passed through filters
   */
  public ValueKind kindOf(String extractor) {
    EnumSet<ValueKind> set = kinds.get(extractor);
    if (set == null || set.isEmpty()) {
      return null;
    }
    return set.iterator().next();
  }

  /**
   * Names of all referenced extractors
   *
   * @return Set of names
   */
  public Set<String> getReferencedExtractors() {
    return Collections.unmodifiableSet(kinds.keySet());
  }
}
