package com.cloudsec.transformer.jsonpath;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluate JSONPath expressions against parsed JSON documents
 *
 * <p>Compiled expressions are held in a bounded cache keyed by expression text. Expressions that
 * fail to compile are cached as failures too, so the failure is logged once and every later call
 * returns null.
 */
public class JsonPathExtractor {
  /** Default number of compiled expressions retained */
  public static final int DEFAULT_CACHE_SIZE = 128;

  private final Logger log;
  private final Configuration conf;
  private final Cache<String, Optional<JsonPath>> compiled;

  public static final String EMPTY_EXPRESSION = "JSONPath expression is empty";
  public static final String LEADING_DESCENT = "Expression cannot start with ..";
  public static final String MISSING_ROOT = "JSONPath expression must start with $";
  public static final String UNMATCHED_BRACKET = "Unmatched bracket in JSONPath expression";

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        n++;
      }
    }
    return n;
  }

  /**
   * Structural checks applied ahead of the JSONPath compiler
   *
   * <p>The compiler is lenient with some malformed input, for example an unterminated bracket, so
   * these are checked first.
   *
   * @param expr JSONPath expression
   * @return Problem description, or null if the expression passes
   */
  public static String structuralProblem(String expr) {
    String e = expr == null ? "" : expr.trim();
    if (e.isEmpty()) {
      return EMPTY_EXPRESSION;
    }
    if (e.startsWith("..")) {
      return LEADING_DESCENT;
    }
    if (!e.startsWith("$")) {
      return MISSING_ROOT;
    }
    if (count(e, '[') != count(e, ']')) {
      return UNMATCHED_BRACKET;
    }
    return null;
  }

  /**
   * Compile an expression without caching
   *
   * @param expr JSONPath expression
   * @return Compiled path
   * @throws InvalidPathException if the expression is invalid
   */
  public static JsonPath compile(String expr) {
    String problem = structuralProblem(expr);
    if (problem != null) {
      throw new InvalidPathException(String.format("%s: %s", problem, expr));
    }
    return JsonPath.compile(expr.trim());
  }

  private Optional<JsonPath> lookup(String expr) {
    return compiled.get(
        expr,
        k -> {
          try {
            return Optional.of(compile(k));
          } catch (RuntimeException exc) {
            log.warn("invalid JSONPath expression {}: {}", k, exc.getMessage());
            return Optional.empty();
          }
        });
  }

  /**
   * Extract value from document
   *
   * @param doc Parsed JSON document, a map or list
   * @param expr JSONPath expression
   * @return null on no match or invalid expression, the value on a single match, a list of values
   *     on multiple matches
   */
  public Object extract(Object doc, String expr) {
    if (doc == null || expr == null) {
      return null;
    }
    Optional<JsonPath> path = lookup(expr);
    if (!path.isPresent()) {
      return null;
    }
    Object res;
    try {
      res = path.get().read(doc, conf);
    } catch (RuntimeException exc) {
      log.debug("JSONPath {} evaluation failed: {}", expr, exc.getMessage());
      return null;
    }
    if (!(res instanceof List)) {
      return res;
    }
    List<?> l = (List<?>) res;
    if (l.isEmpty()) {
      return null;
    }
    if (l.size() == 1) {
      return l.get(0);
    }
    return new ArrayList<Object>(l);
  }

  /**
   * Evaluate a set of named extractors against a document
   *
   * @param doc Parsed JSON document
   * @param extractors Map of field name to JSONPath expression
   * @return Map of field name to extracted value, values may be null
   */
  public Map<String, Object> extractAll(Object doc, Map<String, String> extractors) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : extractors.entrySet()) {
      ret.put(e.getKey(), extract(doc, e.getValue()));
    }
    return ret;
  }

  /**
   * Number of expressions currently cached
   *
   * @return long
   */
  public long cachedExpressions() {
    compiled.cleanUp();
    return compiled.estimatedSize();
  }

  /** Create extractor with {@link #DEFAULT_CACHE_SIZE} */
  public JsonPathExtractor() {
    this(DEFAULT_CACHE_SIZE);
  }

  /**
   * Create extractor
   *
   * @param cacheSize Maximum number of compiled expressions retained
   */
  public JsonPathExtractor(int cacheSize) {
    log = LoggerFactory.getLogger(JsonPathExtractor.class);
    conf =
        Configuration.builder()
            .jsonProvider(new JacksonJsonProvider())
            .mappingProvider(new JacksonMappingProvider())
            .options(Option.ALWAYS_RETURN_LIST, Option.SUPPRESS_EXCEPTIONS)
            .build();
    compiled = Caffeine.newBuilder().maximumSize(cacheSize).build();
  }
}
