package com.cloudsec.transformer.template;

import com.cloudsec.transformer.filter.FilterRegistry;
import com.hubspot.jinjava.tree.ExpressionNode;
import com.hubspot.jinjava.tree.Node;
import com.hubspot.jinjava.tree.TagNode;
import com.hubspot.jinjava.tree.parse.ExpressionToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template parsed once into a Jinjava node tree
 *
 * <p>Rendering only reaches values placed in the context and the filters the engine and the
 * {@link FilterRegistry} supply. Instances are immutable and may be rendered concurrently.
 */
public class CompiledTemplate {
  private static final Pattern FOR_IN = Pattern.compile("\\s+in\\s+");
  private static final Pattern ASSIGN = Pattern.compile("(?<![=!<>])=(?!=)");

  private final TemplateEngine engine;
  private final String name;
  private final Node root;
  private final List<TemplateExpression> expressions;

  CompiledTemplate(TemplateEngine engine, String name, Node root) {
    this.engine = engine;
    this.name = name;
    this.root = root;
    ArrayList<TemplateExpression> l = new ArrayList<>();
    collect(root, l);
    expressions = Collections.unmodifiableList(l);
  }

  private static void collect(Node node, List<TemplateExpression> out) {
    if (node instanceof ExpressionNode) {
      String expr = ((ExpressionToken) node.getMaster()).getExpr();
      out.add(new TemplateExpression(expr, node.getLineNumber(), TemplateExpression.Role.OUTPUT));
    } else if (node instanceof TagNode) {
      TagNode tag = (TagNode) node;
      String helpers = tag.getHelpers() == null ? "" : tag.getHelpers().trim();
      int line = tag.getLineNumber();
      switch (tag.getName()) {
        case "if":
        case "elif":
          out.add(new TemplateExpression(helpers, line, TemplateExpression.Role.CONDITION));
          break;
        case "for":
          Matcher in = FOR_IN.matcher(helpers);
          if (in.find()) {
            out.add(
                new TemplateExpression(
                    helpers.substring(in.end()).trim(), line, TemplateExpression.Role.ITERABLE));
          }
          break;
        case "set":
          Matcher eq = ASSIGN.matcher(helpers);
          if (eq.find()) {
            out.add(
                new TemplateExpression(
                    helpers.substring(eq.end()).trim(),
                    line,
                    TemplateExpression.Role.ASSIGNMENT));
          }
          break;
        case "print":
        case "do":
          out.add(new TemplateExpression(helpers, line, TemplateExpression.Role.OUTPUT));
          break;
        default:
          break;
      }
    }
    for (Node c : node.getChildren()) {
      collect(c, out);
    }
  }

  public String getName() {
    return name;
  }

  Node getRoot() {
    return root;
  }

  /**
   * Expressions of the template in source order
   *
   * @return Unmodifiable list
   */
  public List<TemplateExpression> getExpressions() {
    return expressions;
  }

  /**
   * Render template
   *
   * @param context Root variables
   * @param filters Filters available to the template
   * @return Rendered text
   * @throws TemplateRenderException on any runtime failure
   */
  public String render(Map<String, Object> context, FilterRegistry filters) {
    return engine.render(this, context, filters);
  }
}
