package com.cloudsec.transformer.template;

import com.cloudsec.transformer.filter.BuiltinFilters;
import com.cloudsec.transformer.filter.FilterRegistry;
import com.cloudsec.transformer.filter.JinjavaFilter;
import com.cloudsec.transformer.filter.TemplateFilter;
import com.google.common.collect.ImmutableSet;
import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.JinjavaConfig;
import com.hubspot.jinjava.interpret.Context;
import com.hubspot.jinjava.interpret.JinjavaInterpreter;
import com.hubspot.jinjava.interpret.TemplateError;
import com.hubspot.jinjava.lib.filter.Filter;
import com.hubspot.jinjava.lib.fn.ELFunctionDefinition;
import com.hubspot.jinjava.tree.Node;
import com.hubspot.jinjava.tree.TreeParser;
import com.hubspot.jinjava.tree.parse.TagToken;
import com.hubspot.jinjava.tree.parse.Token;
import com.hubspot.jinjava.tree.parse.TokenScanner;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jinja template engine shared by every template
 *
 * <p>Wraps a single sandboxed {@link Jinjava} instance with the {@link BuiltinFilters} and the
 * {@code generate_uuid()} function registered globally. Templates are parsed once into a node
 * tree; each render gets its own interpreter with the template's custom filters layered over
 * the global ones, so compiled templates may be rendered concurrently.
 */
public class TemplateEngine {
  private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

  /** Methods templates may not call on any value */
  public static final Set<String> RESTRICTED_METHODS =
      ImmutableSet.of(
          "getClass",
          "getClassLoader",
          "forName",
          "newInstance",
          "getMethod",
          "getDeclaredMethod",
          "invoke",
          "getRuntime",
          "exec",
          "exit",
          "wait",
          "notify",
          "notifyAll",
          "clone",
          "finalize");

  /** Properties templates may not read on any value */
  public static final Set<String> RESTRICTED_PROPERTIES =
      ImmutableSet.of("class", "classLoader", "declaringClass", "module", "protectionDomain");

  private static final Set<String> BLOCK_TAGS =
      ImmutableSet.of("if", "for", "macro", "call", "filter", "block", "raw");

  private static final TemplateEngine DEFAULT = new TemplateEngine();

  private final Jinjava jinjava;

  /**
   * Engine shared by the loader and the validator
   *
   * @return TemplateEngine
   */
  public static TemplateEngine getDefault() {
    return DEFAULT;
  }

  /** Create engine with the built-in filters and functions registered */
  public TemplateEngine() {
    JinjavaConfig config =
        JinjavaConfig.newBuilder()
            .withRestrictedMethods(RESTRICTED_METHODS)
            .withRestrictedProperties(RESTRICTED_PROPERTIES)
            .build();
    jinjava = new Jinjava(config);
    Context global = jinjava.getGlobalContext();
    for (Map.Entry<String, TemplateFilter> e : BuiltinFilters.all().entrySet()) {
      global.registerFilter(new JinjavaFilter(e.getKey(), e.getValue()));
    }
    global.registerFunction(
        new ELFunctionDefinition("", "generate_uuid", BuiltinFilters.class, "generateUuid"));
  }

  private JinjavaInterpreter interpreter(Context context) {
    return new JinjavaInterpreter(jinjava, context, jinjava.getGlobalConfig());
  }

  private static TemplateError firstError(
      JinjavaInterpreter interp, TemplateError.ErrorReason reason) {
    for (TemplateError err : interp.getErrors()) {
      if (err.getSeverity() != TemplateError.ErrorType.FATAL) {
        continue;
      }
      if (reason == null || err.getReason() == reason) {
        return err;
      }
    }
    return null;
  }

  /**
   * Check that block tags are properly paired
   *
   * @param source Template text
   * @return Problems in source order, unclosed blocks last, empty if the blocks pair up
   */
  public List<BlockProblem> checkBlocks(String source) {
    ArrayList<BlockProblem> ret = new ArrayList<>();
    Deque<TagToken> stack = new ArrayDeque<>();
    TokenScanner scanner = new TokenScanner(source, jinjava.getGlobalConfig());
    while (scanner.hasNext()) {
      Token t = scanner.next();
      if (!(t instanceof TagToken)) {
        continue;
      }
      TagToken tag = (TagToken) t;
      String name = tag.getTagName();
      if (BLOCK_TAGS.contains(name)) {
        stack.push(tag);
        continue;
      }
      if (!name.startsWith("end") || !BLOCK_TAGS.contains(name.substring(3))) {
        continue;
      }
      if (stack.isEmpty()) {
        ret.add(
            new BlockProblem(BlockProblem.Kind.UNEXPECTED, name, null, tag.getLineNumber(), 0));
      } else if (!stack.peek().getTagName().equals(name.substring(3))) {
        TagToken open = stack.peek();
        ret.add(
            new BlockProblem(
                BlockProblem.Kind.MISMATCHED,
                name,
                open.getTagName(),
                tag.getLineNumber(),
                open.getLineNumber()));
      } else {
        stack.pop();
      }
    }
    while (!stack.isEmpty()) {
      TagToken open = stack.pollLast();
      ret.add(
          new BlockProblem(
              BlockProblem.Kind.UNCLOSED,
              open.getTagName(),
              open.getTagName(),
              open.getLineNumber(),
              open.getLineNumber()));
    }
    return ret;
  }

  /**
   * Parse template text without checking filter names
   *
   * @param name Template name used in messages
   * @param source Template text
   * @return CompiledTemplate
   * @throws TemplateSyntaxException on unpaired blocks, unknown tags or invalid expressions
   */
  public CompiledTemplate parse(String name, String source) throws TemplateSyntaxException {
    if (source == null) {
      throw new TemplateSyntaxException("template is empty", 1);
    }
    List<BlockProblem> blocks = checkBlocks(source);
    if (!blocks.isEmpty()) {
      throw new TemplateSyntaxException(blocks.get(0).getMessage(), blocks.get(0).getLine());
    }
    JinjavaInterpreter interp = interpreter(new Context(jinjava.getGlobalContext()));
    JinjavaInterpreter.pushCurrent(interp);
    try {
      Node root = new TreeParser(interp, source).buildTree();
      TemplateError err = firstError(interp, null);
      if (err != null) {
        throw new TemplateSyntaxException(err.getMessage(), Math.max(1, err.getLineno()));
      }
      CompiledTemplate ret = new CompiledTemplate(this, name, root);
      // Evaluating against an empty context surfaces expression syntax errors
      for (TemplateExpression e : ret.getExpressions()) {
        interp.resolveELExpression(e.getText(), e.getLine());
      }
      err = firstError(interp, TemplateError.ErrorReason.SYNTAX_ERROR);
      if (err != null) {
        throw new TemplateSyntaxException(err.getMessage(), Math.max(1, err.getLineno()));
      }
      return ret;
    } finally {
      JinjavaInterpreter.popCurrent();
    }
  }

  /**
   * Compile template text for rendering with the given filters
   *
   * @param name Template name used in messages
   * @param source Template text
   * @param filters Filters the template renders with
   * @return CompiledTemplate
   * @throws TemplateSyntaxException on invalid syntax or an unknown filter
   */
  public CompiledTemplate compile(String name, String source, FilterRegistry filters)
      throws TemplateSyntaxException {
    CompiledTemplate ret = parse(name, source);
    Set<String> known = filterNames(filters);
    for (TemplateExpression e : ret.getExpressions()) {
      for (ExpressionTokens.Token f :
          ExpressionTokens.filterNames(ExpressionTokens.tokenize(e.getText()))) {
        if (!known.contains(f.getText())) {
          throw new TemplateSyntaxException(
              String.format("unknown filter '%s'", f.getText()),
              e.getLine() + ExpressionTokens.lineOffset(e.getText(), f.getOffset()));
        }
      }
    }
    log.debug("compiled template {}", name);
    return ret;
  }

  /**
   * Names of every filter a template can apply
   *
   * @param filters Template filters, may be null for engine filters only
   * @return Sorted set of engine filters and the template's custom filters
   */
  public Set<String> filterNames(FilterRegistry filters) {
    TreeSet<String> ret = new TreeSet<>();
    for (Filter f : jinjava.getGlobalContext().getAllFilters()) {
      ret.add(f.getName());
    }
    if (filters != null) {
      ret.addAll(filters.getCustom().keySet());
    }
    return Collections.unmodifiableSet(ret);
  }

  /**
   * Render a compiled template
   *
   * @param template Compiled template
   * @param context Root variables
   * @param filters Filters the template renders with
   * @return Rendered text
   * @throws TemplateRenderException on any runtime failure
   */
  String render(CompiledTemplate template, Map<String, Object> context, FilterRegistry filters) {
    Context ctx = new Context(jinjava.getGlobalContext(), context);
    if (filters != null) {
      for (JinjavaFilter f : filters.customEngineFilters()) {
        ctx.registerFilter(f);
      }
    }
    JinjavaInterpreter interp = interpreter(ctx);
    JinjavaInterpreter.pushCurrent(interp);
    String out;
    try {
      out = interp.render(template.getRoot());
    } catch (TemplateRenderException exc) {
      throw exc;
    } catch (RuntimeException exc) {
      throw new TemplateRenderException(
          String.format("template %s failed: %s", template.getName(), exc.toString()), exc);
    } catch (StackOverflowError exc) {
      throw new TemplateRenderException(
          String.format("template %s recursed too deeply", template.getName()));
    } finally {
      JinjavaInterpreter.popCurrent();
    }
    TemplateError err = firstError(interp, null);
    if (err != null) {
      throw new TemplateRenderException(
              String.format("template %s failed: %s", template.getName(), err.getMessage()))
          .atLine(err.getLineno());
    }
    return out;
  }
}
