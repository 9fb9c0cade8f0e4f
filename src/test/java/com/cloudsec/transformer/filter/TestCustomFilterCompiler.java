package com.cloudsec.transformer.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class TestCustomFilterCompiler {
  public TestCustomFilterCompiler() {}

  private static Object apply(TemplateFilter f, Object v) {
    return f.apply(v, Collections.emptyList(), Collections.<String, Object>emptyMap());
  }

  @Test
  public void compileTest() throws Exception {
    LinkedHashMap<String, String> src = new LinkedHashMap<>();
    src.put("shout", "def shout(value) {\n  return value.toString().toUpperCase()\n}");
    src.put("shout_twice", "def shout_twice(value) {\n  return shout(value) + shout(value)\n}");
    Map<String, TemplateFilter> f =
        new CustomFilterCompiler().compile(FilterSource.fromTemplateFile("test.yaml", src));
    assertEquals(2, f.size());
    assertEquals("ABC", apply(f.get("shout"), "abc"));
    // A filter may call another filter of the same template
    assertEquals("ABCABC", apply(f.get("shout_twice"), "abc"));
  }

  @Test
  public void registryOverlayTest() throws Exception {
    LinkedHashMap<String, String> src = new LinkedHashMap<>();
    src.put("slugify", "def slugify(value) {\n  return 'custom'\n}");
    FilterRegistry r =
        FilterRegistry.withCustom(
            new CustomFilterCompiler().compile(FilterSource.fromTemplateFile("test.yaml", src)));
    assertEquals("custom", apply(r.getFilter("slugify"), "x"));
    assertNotNull(r.getFilter("json_escape"));
    assertEquals(1, r.customEngineFilters().size());
  }

  @Test
  public void nameMismatchTest() throws Exception {
    LinkedHashMap<String, String> src = new LinkedHashMap<>();
    src.put("foo", "def bar(x) {\n  return x\n}");
    try {
      new CustomFilterCompiler().compile(FilterSource.fromTemplateFile("test.yaml", src));
      fail("expected compilation failure");
    } catch (FilterCompilationException exc) {
      assertEquals("foo", exc.getFilterName());
    }
  }

  @Test(expected = FilterCompilationException.class)
  public void sandboxTest() throws Exception {
    LinkedHashMap<String, String> src = new LinkedHashMap<>();
    src.put("run", "def run(x) {\n  return System.getenv('HOME')\n}");
    new CustomFilterCompiler().compile(FilterSource.fromTemplateFile("test.yaml", src));
  }

  @Test(expected = FilterCompilationException.class)
  public void importTest() throws Exception {
    LinkedHashMap<String, String> src = new LinkedHashMap<>();
    src.put("f", "import java.io.File\ndef f(x) {\n  return new File(x).text\n}");
    new CustomFilterCompiler().compile(FilterSource.fromTemplateFile("test.yaml", src));
  }

  @Test(expected = IllegalArgumentException.class)
  public void sourceOriginTest() throws Exception {
    FilterSource.fromTemplateFile(null, Collections.<String, String>emptyMap());
  }

  @Test
  public void emptySourceTest() throws Exception {
    assertTrue(
        new CustomFilterCompiler()
            .compile(
                FilterSource.fromTemplateFile("test.yaml", Collections.<String, String>emptyMap()))
            .isEmpty());
  }
}
