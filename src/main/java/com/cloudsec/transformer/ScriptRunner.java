package com.cloudsec.transformer;

import groovy.lang.GroovyShell;
import groovy.lang.MissingMethodException;
import groovy.lang.Script;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.PropertyExpression;
import org.codehaus.groovy.ast.expr.StaticMethodCallExpression;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.customizers.SecureASTCustomizer;

/**
 * Execute sandboxed Groovy scripts
 *
 * <p>Scripts are compiled with a {@link SecureASTCustomizer} that disallows imports, package and
 * class definitions, calls on host classes such as {@link System} or {@link Runtime}, and
 * reflective access through class or meta class references. All methods defined in one script
 * share a namespace and may call each other.
 */
public class ScriptRunner {
  private static final List<String> BLOCKED_RECEIVERS =
      Arrays.asList(
          "java.lang.System",
          "java.lang.Runtime",
          "java.lang.Class",
          "java.lang.ClassLoader",
          "java.lang.Thread",
          "java.lang.ProcessBuilder",
          "java.lang.Process",
          "java.io.File",
          "java.nio.file.Files",
          "java.nio.file.Paths",
          "java.net.URL",
          "java.net.Socket",
          "groovy.lang.GroovyShell",
          "groovy.lang.GroovyClassLoader",
          "groovy.util.Eval");

  private static final Set<String> BLOCKED_NAMES =
      new HashSet<>(
          Arrays.asList(
              "getClass",
              "class",
              "forName",
              "getClassLoader",
              "metaClass",
              "getMetaClass",
              "setMetaClass",
              "execute",
              "evaluate",
              "invokeMethod",
              "setProperty",
              "getProperty",
              "exit",
              "binding",
              "getBinding",
              "setBinding",
              "run"));

  private final GroovyShell shell;
  private HashMap<String, Script> loadedScripts;

  private static boolean isAuthorized(Expression e) {
    if (e instanceof MethodCallExpression) {
      return !BLOCKED_NAMES.contains(((MethodCallExpression) e).getMethodAsString());
    }
    if (e instanceof StaticMethodCallExpression) {
      return !BLOCKED_NAMES.contains(((StaticMethodCallExpression) e).getMethod());
    }
    if (e instanceof PropertyExpression) {
      Expression prop = ((PropertyExpression) e).getProperty();
      if (prop instanceof ConstantExpression) {
        return !BLOCKED_NAMES.contains(String.valueOf(((ConstantExpression) prop).getValue()));
      }
    }
    return true;
  }

  /**
   * Build the compiler configuration used for sandboxed scripts
   *
   * @return CompilerConfiguration
   */
  public static CompilerConfiguration sandboxConfiguration() {
    SecureASTCustomizer secure = new SecureASTCustomizer();
    secure.setPackageAllowed(false);
    secure.setMethodDefinitionAllowed(true);
    secure.setImportsWhitelist(Collections.<String>emptyList());
    secure.setStarImportsWhitelist(Collections.<String>emptyList());
    secure.setStaticImportsWhitelist(Collections.<String>emptyList());
    secure.setStaticStarImportsWhitelist(Collections.<String>emptyList());
    secure.setReceiversBlackList(BLOCKED_RECEIVERS);
    secure.addExpressionCheckers(ScriptRunner::isAuthorized);

    CompilerConfiguration cc = new CompilerConfiguration();
    cc.addCompilationCustomizers(secure);
    return cc;
  }

  /**
   * Compile script source into the script runner
   *
   * <p>The caller is responsible for ensuring source comes from a trusted origin. The sandbox
   * limits what a script can reach, it does not make untrusted input safe to run.
   *
   * @param name Name to register script with
   * @param source Groovy source text
   * @throws CompilationFailedException if the source does not compile or violates the sandbox
   */
  public void loadScript(String name, String source) throws CompilationFailedException {
    loadedScripts.put(name, shell.parse(source, scriptClassName(name)));
  }

  /**
   * Test if a script has been loaded under the given name
   *
   * @param name Script name
   * @return True if loaded
   */
  public boolean hasScript(String name) {
    return loadedScripts.containsKey(name);
  }

  /**
   * Return the names of methods defined directly in a loaded script
   *
   * @param name Script name
   * @return List of method names, empty if the script is not loaded
   */
  public List<String> definedMethods(String name) {
    ArrayList<String> ret = new ArrayList<>();
    Script s = loadedScripts.get(name);
    if (s == null) {
      return ret;
    }
    for (Method m : s.getClass().getDeclaredMethods()) {
      if (!Modifier.isPublic(m.getModifiers()) || m.isSynthetic()) {
        continue;
      }
      if (m.getName().equals("run") || m.getName().equals("main") || m.getName().contains("$")) {
        continue;
      }
      if (!ret.contains(m.getName())) {
        ret.add(m.getName());
      }
    }
    return ret;
  }

  /**
   * Invoke method within loaded script
   *
   * @param name Script name
   * @param method Method to execute
   * @param clazz Class for return type
   * @param args Arguments to method
   * @param <T> T
   * @return T
   */
  public <T> T invokeMethod(String name, String method, Class<T> clazz, Object... args) {
    Script s = loadedScripts.get(name);
    if (s == null) {
      throw new IllegalArgumentException(String.format("script %s not loaded", name));
    }
    try {
      return clazz.cast(s.invokeMethod(method, args));
    } catch (MissingMethodException exc) {
      throw new IllegalArgumentException(exc.getMessage());
    }
  }

  private static String scriptClassName(String name) {
    StringBuilder sb = new StringBuilder("Script_");
    for (char c : name.toCharArray()) {
      sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
    }
    return sb.toString();
  }

  /** Initialize new {@link ScriptRunner} with the sandboxed compiler configuration */
  public ScriptRunner() {
    shell = new GroovyShell(sandboxConfiguration());
    loadedScripts = new HashMap<String, Script>();
  }
}
