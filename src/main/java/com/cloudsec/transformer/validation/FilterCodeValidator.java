package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.ScriptRunner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.codehaus.groovy.ast.CodeVisitorSupport;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.IfStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.Statement;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.MultipleCompilationErrorsException;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.messages.ExceptionMessage;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;

/**
 * Checks custom filter source
 *
 * <p>Each filter is compiled, without generating classes, under the same sandbox configuration
 * used at load time. The filter must define a function named after its key.
 */
public class FilterCodeValidator {
  private final String templateFile;
  private final LineMap lineMap;

  private static class ReturnFinder extends CodeVisitorSupport {
    boolean found;

    @Override
    public void visitReturnStatement(ReturnStatement statement) {
      found = true;
      super.visitReturnStatement(statement);
    }
  }

  private ValidationError finding(
      ValidationSeverity severity, String message, String name, Integer line) {
    return new ValidationError(ValidationPhase.FILTER_CODE, severity, message, templateFile)
        .withLine(line)
        .withFieldPath("filters." + name);
  }

  private Integer keyLine(String name) {
    return lineMap == null ? null : lineMap.get("filters." + name);
  }

  static String syntaxSuggestion(String message) {
    String m = message.toLowerCase();
    if (m.contains("unexpected input") || m.contains("unexpected token")) {
      return "Check for missing braces, parentheses or quotes";
    }
    if (m.contains("unexpected end") || m.contains("eof")) {
      return "Check for incomplete statements or missing closing brackets";
    }
    if (m.contains("not allowed") || m.contains("security")) {
      return "Filters may only use their arguments and other filters of the template";
    }
    return "Review the Groovy code for syntax errors";
  }

  /**
   * Test if the last statement of a method body yields a value
   *
   * @param code Method body
   * @return boolean
   */
  static boolean yieldsValue(Statement code) {
    ReturnFinder f = new ReturnFinder();
    code.visit(f);
    if (f.found) {
      return true;
    }
    Statement last = code;
    while (last instanceof BlockStatement) {
      List<Statement> stmts = ((BlockStatement) last).getStatements();
      if (stmts.isEmpty()) {
        return false;
      }
      last = stmts.get(stmts.size() - 1);
    }
    return last instanceof ExpressionStatement || last instanceof IfStatement;
  }

  private List<MethodNode> parse(String name, String source) throws CompilationFailedException {
    CompilationUnit cu = new CompilationUnit(ScriptRunner.sandboxConfiguration());
    cu.addSource(String.format("filter_%s.groovy", name), source);
    cu.compile(Phases.CANONICALIZATION);
    ArrayList<MethodNode> ret = new ArrayList<>();
    for (ModuleNode m : cu.getAST().getModules()) {
      ret.addAll(m.getMethods());
    }
    return ret;
  }

  private void reportCompileFailure(
      String name, CompilationFailedException exc, ValidationResult result) {
    Integer base = keyLine(name);
    if (exc instanceof MultipleCompilationErrorsException) {
      List<? extends Message> errors =
          ((MultipleCompilationErrorsException) exc).getErrorCollector().getErrors();
      if (errors != null && !errors.isEmpty()) {
        Message msg = errors.get(0);
        if (msg instanceof SyntaxErrorMessage) {
          SyntaxException se = ((SyntaxErrorMessage) msg).getCause();
          Integer line = base;
          if (base != null && se.getLine() > 0) {
            line = base + se.getLine();
          }
          result.add(
              finding(
                      ValidationSeverity.ERROR,
                      String.format(
                          "Groovy syntax error in filter '%s': %s", name, se.getOriginalMessage()),
                      name,
                      line)
                  .withColumn(se.getStartColumn())
                  .withSuggestion(syntaxSuggestion(se.getOriginalMessage())));
          return;
        }
        if (msg instanceof ExceptionMessage) {
          Exception cause = ((ExceptionMessage) msg).getCause();
          result.add(
              finding(
                      ValidationSeverity.ERROR,
                      String.format(
                          "Filter '%s' is not allowed in the sandbox: %s",
                          name, cause.getMessage()),
                      name,
                      base)
                  .withSuggestion(syntaxSuggestion("not allowed")));
          return;
        }
      }
    }
    result.add(
        finding(
                ValidationSeverity.ERROR,
                String.format("Filter '%s' failed to compile: %s", name, exc.getMessage()),
                name,
                base)
            .withSuggestion(syntaxSuggestion(String.valueOf(exc.getMessage()))));
  }

  private void check(String name, String source, ValidationResult result) {
    if (source.trim().isEmpty()) {
      result.add(
          finding(
              ValidationSeverity.WARNING,
              String.format("Filter '%s' has empty code", name),
              name,
              keyLine(name)));
      return;
    }
    List<MethodNode> methods;
    try {
      methods = parse(name, source.trim());
    } catch (CompilationFailedException exc) {
      reportCompileFailure(name, exc, result);
      return;
    }
    if (methods.isEmpty()) {
      result.add(
          finding(
                  ValidationSeverity.ERROR,
                  String.format("Filter '%s' does not define a function", name),
                  name,
                  keyLine(name))
              .withSuggestion(
                  String.format("Add a function definition: def %s(value) { ... }", name)));
      return;
    }
    ArrayList<String> defined = new ArrayList<>();
    MethodNode target = null;
    for (MethodNode m : methods) {
      defined.add(m.getName());
      if (m.getName().equals(name) && target == null) {
        target = m;
      }
    }
    if (target == null) {
      result.add(
          finding(
                  ValidationSeverity.ERROR,
                  String.format(
                      "Filter '%s' defines function(s) %s instead of '%s'", name, defined, name),
                  name,
                  keyLine(name))
              .withSuggestion(
                  String.format(
                      "Rename the function to '%s' or change the filter key to match the"
                          + " function name",
                      name)));
      return;
    }
    if (target.getCode() == null || !yieldsValue(target.getCode())) {
      result.add(
          finding(
                  ValidationSeverity.WARNING,
                  String.format("Filter function '%s' may not return a value", name),
                  name,
                  keyLine(name))
              .withSuggestion("Ensure the function returns a value to be used in the template"));
    }
  }

  /**
   * Check every custom filter
   *
   * <p>Non-string values are skipped; the YAML structure phase reports them.
   *
   * @param filters Filters from the template
   * @return ValidationResult
   */
  public ValidationResult validate(Map<String, Object> filters) {
    ValidationResult result = new ValidationResult(templateFile);
    for (Map.Entry<String, Object> e : filters.entrySet()) {
      if (e.getValue() instanceof String) {
        check(e.getKey(), (String) e.getValue(), result);
      }
    }
    return result;
  }

  /**
   * Create validator
   *
   * @param templateFile Template file path used in findings
   * @param lineMap Line map of the template file, may be null
   */
  public FilterCodeValidator(String templateFile, LineMap lineMap) {
    this.templateFile = templateFile;
    this.lineMap = lineMap;
  }
}
