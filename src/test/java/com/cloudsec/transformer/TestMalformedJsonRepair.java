package com.cloudsec.transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Map;
import org.junit.Test;

public class TestMalformedJsonRepair {
  public TestMalformedJsonRepair() {}

  private static Map<?, ?> parseMap(String text) {
    return (Map<?, ?>) MalformedJsonRepair.parse(text);
  }

  @Test
  public void validJsonTest() throws Exception {
    assertEquals("b", parseMap("{\"a\": \"b\"}").get("a"));
  }

  @Test
  public void controlCharacterTest() throws Exception {
    Map<?, ?> m = parseMap("{\"desc\": \"line one\nline two\ttab\"}");
    assertEquals("line one\nline two\ttab", m.get("desc"));
  }

  @Test
  public void doubleBraceTest() throws Exception {
    Map<?, ?> m = parseMap("{\"event_data\": {{\"id\": \"a\"}}}");
    assertEquals("a", ((Map<?, ?>) m.get("event_data")).get("id"));
  }

  @Test
  public void urlAndQuoteTest() throws Exception {
    Map<?, ?> m = parseMap("{\"link\": \"https: //example.com\", \"q\": \"it\\'s\"}");
    assertEquals("https://example.com", m.get("link"));
    assertEquals("it's", m.get("q"));
  }

  @Test
  public void anchorTest() throws Exception {
    Map<?, ?> m = parseMap("{\"html\": \"see <a href=\"https://example.com\">here</a>\"}");
    assertEquals("see <a href='https://example.com'>here</a>", m.get("html"));
  }

  @Test
  public void unrepairableTest() throws Exception {
    assertNull(MalformedJsonRepair.parse("not json at all {"));
    assertNull(MalformedJsonRepair.parse(null));
  }
}
