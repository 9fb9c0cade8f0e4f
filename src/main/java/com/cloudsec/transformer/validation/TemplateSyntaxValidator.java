package com.cloudsec.transformer.validation;

import com.cloudsec.transformer.StringDistance;
import com.cloudsec.transformer.template.BlockProblem;
import com.cloudsec.transformer.template.CompiledTemplate;
import com.cloudsec.transformer.template.TemplateEngine;
import com.cloudsec.transformer.template.TemplateSyntaxException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks template syntax, block pairing, extractor references and filter names
 *
 * <p>Block pairing is checked on the engine's tag tokens before parsing, so every mismatch is
 * reported at the line it occurs on. References and filter uses are collected from the parsed
 * node tree, or from the raw text when the template does not parse.
 */
public class TemplateSyntaxValidator {
  private static final Pattern EXTRACTOR_REF =
      Pattern.compile("extractors\\.([a-zA-Z_][a-zA-Z0-9_]*)");
  private static final Pattern FILTER_REF = Pattern.compile("\\|\\s*([a-zA-Z_][a-zA-Z0-9_]*)");

  private final String templateFile;
  private final LineMap lineMap;
  private final TemplateEngine engine;
  private CompiledTemplate compiled;

  private Integer fileLine(int templateLine) {
    if (lineMap == null) {
      return templateLine;
    }
    Integer l = lineMap.templateLine(templateLine);
    return l == null ? templateLine : l;
  }

  private ValidationError finding(ValidationSeverity severity, String message, int templateLine) {
    return new ValidationError(ValidationPhase.JINJA2_SYNTAX, severity, message, templateFile)
        .withLine(fileLine(templateLine))
        .withFieldPath("template");
  }

  static String suggestName(String name, Collection<String> candidates) {
    String best = StringDistance.closest(name, candidates, 0.5);
    if (best == null) {
      for (String c : candidates) {
        if (c.startsWith(name) || name.startsWith(c)) {
          best = c;
          break;
        }
      }
    }
    return best == null ? null : String.format("Did you mean '%s'?", best);
  }

  static String syntaxSuggestion(String detail) {
    String d = detail.toLowerCase();
    if (d.contains("unexpected end")) {
      return "Check for unclosed braces {{ }} or {% %}";
    }
    if (d.contains("expected")) {
      return "Check for missing closing delimiters or syntax errors";
    }
    if (d.contains("unexpected char")) {
      return "Check for special characters that need escaping";
    }
    if (d.contains("unknown tag")) {
      return "Check the tag name inside {% %}";
    }
    return null;
  }

  private void reportBlocks(List<BlockProblem> problems, ValidationResult result) {
    for (BlockProblem p : problems) {
      ValidationError e = finding(ValidationSeverity.ERROR, p.getMessage(), p.getLine());
      if (p.getKind() == BlockProblem.Kind.MISMATCHED) {
        e.withSuggestion(
            String.format(
                "Check the '%s' block that started around line %d",
                p.getOpenBlock(), fileLine(p.getOpenLine())));
      } else if (p.getKind() == BlockProblem.Kind.UNCLOSED) {
        e.withSuggestion(String.format("Add '{%% end%s %%}' to close the block", p.getTag()));
      }
      result.add(e);
    }
  }

  private static int lineOf(String content, int pos) {
    int line = 1;
    for (int i = 0; i < pos; i++) {
      if (content.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  private void checkExtractor(String name, int line, Set<String> extractors, ValidationResult r) {
    if (extractors.contains(name)) {
      return;
    }
    r.add(
        finding(
                ValidationSeverity.WARNING,
                String.format("Reference to undefined extractor: 'extractors.%s'", name),
                line)
            .withRawValue("extractors." + name)
            .withSuggestion(suggestName(name, extractors)));
  }

  private void checkFilter(String name, int line, Set<String> known, ValidationResult r) {
    if (known.contains(name)) {
      return;
    }
    r.add(
        finding(ValidationSeverity.ERROR, String.format("Unknown filter: '%s'", name), line)
            .withRawValue(name)
            .withSuggestion(suggestName(name, known)));
  }

  /**
   * Validate template text
   *
   * @param content Template body
   * @param extractors Declared extractor names
   * @param customFilters Declared custom filter names
   * @return ValidationResult
   */
  public ValidationResult validate(
      String content, Collection<String> extractors, Collection<String> customFilters) {
    ValidationResult result = new ValidationResult(templateFile);
    compiled = null;
    if (content == null || content.isEmpty()) {
      result.add(
          new ValidationError(
                  ValidationPhase.JINJA2_SYNTAX,
                  ValidationSeverity.ERROR,
                  "Template content is empty",
                  templateFile)
              .withLine(lineMap == null ? null : lineMap.get("template"))
              .withFieldPath("template"));
      return result;
    }
    Set<String> declared = new TreeSet<>(extractors);
    Set<String> known = new TreeSet<>(engine.filterNames(null));
    known.addAll(customFilters);

    List<BlockProblem> blocks = engine.checkBlocks(content);
    if (!blocks.isEmpty()) {
      reportBlocks(blocks, result);
    } else {
      try {
        compiled = engine.parse(templateFile, content);
      } catch (TemplateSyntaxException exc) {
        result.add(
            finding(
                    ValidationSeverity.ERROR,
                    String.format("Template syntax error: %s", exc.getDetail()),
                    exc.getLine())
                .withSuggestion(syntaxSuggestion(exc.getDetail())));
      }
    }

    if (compiled != null) {
      TemplateUsage usage = TemplateUsage.of(compiled);
      for (TemplateUsage.Reference ref : usage.getExtractorReferences()) {
        checkExtractor(ref.getName(), ref.getLine(), declared, result);
      }
      for (TemplateUsage.Reference ref : usage.getFilterUses()) {
        checkFilter(ref.getName(), ref.getLine(), known, result);
      }
    } else {
      Matcher m = EXTRACTOR_REF.matcher(content);
      while (m.find()) {
        checkExtractor(m.group(1), lineOf(content, m.start()), declared, result);
      }
      m = FILTER_REF.matcher(content);
      while (m.find()) {
        checkFilter(m.group(1), lineOf(content, m.start()), known, result);
      }
    }
    return result;
  }

  /**
   * Parsed template from the last {@link #validate} call
   *
   * @return Parsed template, or null if the template did not parse
   */
  public CompiledTemplate getCompiled() {
    return compiled;
  }

  /**
   * Create validator
   *
   * @param templateFile Template file path used in findings
   * @param lineMap Line map of the template file, may be null
   */
  public TemplateSyntaxValidator(String templateFile, LineMap lineMap) {
    this.templateFile = templateFile;
    this.lineMap = lineMap;
    engine = TemplateEngine.getDefault();
  }
}
