package com.cloudsec.transformer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JSON message bodies, repairing malformations some cloud providers produce
 *
 * <p>Repairs applied, in order: escaping of raw control characters inside strings, collapsing of
 * a doubled opening brace after {@code "event_data":} with removal of the surplus trailing closing
 * braces, removal of the space in {@code https: //}, unescaping of {@code \'}, and conversion of
 * double quoted attributes inside HTML anchor tags to single quotes.
 */
public class MalformedJsonRepair {
  private static final Logger log = LoggerFactory.getLogger(MalformedJsonRepair.class);

  private static final ObjectMapper mapper = new ObjectMapper();

  private static final Pattern DOUBLE_BRACE = Pattern.compile("(\"event_data\":\\s*)\\{\\{");
  private static final Pattern ANCHOR = Pattern.compile("<a\\s+[^>]+>");
  private static final Pattern ATTRIBUTE = Pattern.compile("(\\w+)=\"([^\"]*)\"");

  private MalformedJsonRepair() {}

  /**
   * Parse text, applying repairs if the text is not valid JSON
   *
   * @param text JSON text
   * @return Parsed value, or null if the text cannot be parsed even after repair
   */
  public static Object parse(String text) {
    if (text == null) {
      return null;
    }
    try {
      return mapper.readValue(text, new TypeReference<Object>() {});
    } catch (IOException original) {
      log.warn("initial JSON parse failed, attempting repair: {}", original.getMessage());
      String fixed = repair(text);
      try {
        Object ret = mapper.readValue(fixed, new TypeReference<Object>() {});
        log.info("parsed JSON after applying repairs");
        return ret;
      } catch (IOException exc) {
        log.error("JSON parsing failed after repair: {}", exc.getMessage());
        return null;
      }
    }
  }

  /**
   * Apply every repair to the text
   *
   * @param text Malformed JSON text
   * @return Repaired text
   */
  public static String repair(String text) {
    String fixed = escapeControlCharacters(text);
    fixed = fixDoubleBraces(fixed);
    fixed = fixed.replace("https: //", "https://").replace("http: //", "http://");
    fixed = fixed.replace("\\'", "'");
    return fixAnchorQuotes(fixed);
  }

  static String escapeControlCharacters(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean inString = false;
    boolean escapeNext = false;
    int fixedCount = 0;
    for (char c : text.toCharArray()) {
      if (c == '"' && !escapeNext) {
        inString = !inString;
        sb.append(c);
        escapeNext = false;
      } else if (c == '\\' && !escapeNext) {
        escapeNext = true;
        sb.append(c);
      } else if (inString && c < 0x20 && !escapeNext) {
        sb.append(controlEscape(c));
        fixedCount++;
      } else {
        sb.append(c);
        escapeNext = false;
      }
    }
    if (fixedCount > 0) {
      log.info("escaped {} control characters in JSON strings", fixedCount);
    }
    return sb.toString();
  }

  private static String controlEscape(char c) {
    switch (c) {
      case '\n':
        return "\\n";
      case '\r':
        return "\\r";
      case '\t':
        return "\\t";
      case '\b':
        return "\\b";
      case '\f':
        return "\\f";
      default:
        return String.format("\\u%04x", (int) c);
    }
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        n++;
      }
    }
    return n;
  }

  static String fixDoubleBraces(String text) {
    Matcher m = DOUBLE_BRACE.matcher(text);
    if (!m.find()) {
      return text;
    }
    String fixed = m.replaceAll("$1{");
    int extra = count(fixed, '}') - count(fixed, '{');
    if (extra > 0) {
      int trailing = 0;
      for (int i = fixed.length() - 1; i >= 0 && fixed.charAt(i) == '}'; i--) {
        trailing++;
      }
      if (extra <= trailing) {
        fixed = fixed.substring(0, fixed.length() - extra);
      } else {
        log.warn("cannot balance braces: {} extra but only {} at end", extra, trailing);
      }
    }
    return fixed;
  }

  static String fixAnchorQuotes(String text) {
    Matcher m = ANCHOR.matcher(text);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String tag = ATTRIBUTE.matcher(m.group()).replaceAll("$1='$2'");
      m.appendReplacement(sb, Matcher.quoteReplacement(tag));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
