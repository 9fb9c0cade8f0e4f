package com.cloudsec.transformer.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudsec.transformer.template.CompiledTemplate;
import com.cloudsec.transformer.template.TemplateEngine;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class TestTemplatePhases {
  public TestTemplatePhases() {}

  private static ValidationError only(ValidationResult r, ValidationSeverity s) {
    List<ValidationError> l =
        s == ValidationSeverity.ERROR ? r.getErrors() : r.getWarnings();
    assertEquals(l.toString(), 1, l.size());
    return l.get(0);
  }

  @Test
  public void yamlStructureTest() throws Exception {
    YamlStructureValidator v = new YamlStructureValidator("t.yaml");
    ValidationResult r =
        v.validate("name: t\nextractors:\n  a: \"$.a\"\ntemplate: |\n  {\"a\": 1}\n");
    assertEquals(2, r.getErrorCount());
    assertEquals("Missing required field 'input_schema'", r.getErrors().get(0).getMessage());
    assertEquals("output_schema", r.getErrors().get(1).getFieldPath());
    assertNotNull(v.getParsed());
    assertEquals("{\"a\": 1}\n", v.getTemplateContent());

    r = v.validate("- a\n- b\n");
    assertEquals(
        "Template must be a YAML mapping, got sequence",
        only(r, ValidationSeverity.ERROR).getMessage());
    assertNull(v.getParsed());

    r = v.validate("   \n");
    assertEquals(
        "Template file is empty or contains only whitespace",
        only(r, ValidationSeverity.ERROR).getMessage());
  }

  @Test
  public void yamlFieldTypesTest() throws Exception {
    YamlStructureValidator v = new YamlStructureValidator("t.yaml");
    ValidationResult r =
        v.validate(
            "name: t\ninput_schema: a\noutput_schema: b\nextractors: []\n"
                + "filters:\n  f: \"\"\ntemplate: \"{}\"\n");
    ValidationError e = only(r, ValidationSeverity.ERROR);
    assertEquals("Field 'extractors' must be of type mapping, got sequence", e.getMessage());
    assertEquals(Integer.valueOf(4), e.getLineNumber());
    assertEquals("Filter 'f' has empty code", only(r, ValidationSeverity.WARNING).getMessage());

    r =
        v.validate(
            "name: t\ninput_schema: a\noutput_schema: b\nextractors: {}\ntemplate: \"{}\"\n");
    assertTrue(
        only(r, ValidationSeverity.ERROR).getMessage().startsWith("Extractors section is empty"));

    r =
        v.validate(
            "name: t\ninput_schema: a\noutput_schema: b\nextractors:\n  a: 5\n  b: \" \"\n"
                + "template: \"{}\"\n");
    assertEquals(2, r.getErrorCount());
    assertEquals("5", r.getErrors().get(0).getRawValue());
    assertEquals("extractors.b", r.getErrors().get(1).getFieldPath());
  }

  @Test
  public void yamlParseErrorTest() throws Exception {
    ValidationResult r =
        new YamlStructureValidator("t.yaml")
            .validate("name: t\nextractors:\n  a: \"$.a\ntemplate: [x\n");
    ValidationError e = only(r, ValidationSeverity.ERROR);
    assertTrue(e.getMessage().startsWith("YAML parsing error"));
    assertNotNull(e.getLineNumber());
  }

  @Test
  public void jsonPathCheckTest() throws Exception {
    JsonPathSyntaxValidator v = new JsonPathSyntaxValidator("t.yaml", null);
    assertNull(v.check("a", "$.a.b[0]"));
    assertNull(v.check("a", "$..name"));
    assertEquals("JSONPath expression is empty", v.check("a", "  ").getMessage());
    assertEquals("Expression cannot start with ..", v.check("a", "..name").getMessage());
    assertEquals("JSONPath expression must start with $", v.check("a", "name").getMessage());
    assertEquals(
        "Unmatched bracket in JSONPath expression", v.check("a", "$.a[0").getMessage());
    ValidationError e = v.check("a", "$.a[?(@.b ==]");
    assertNotNull(e);
    assertEquals(ValidationPhase.JSONPATH_SYNTAX, e.getPhase());
    assertEquals("extractors.a", e.getFieldPath());
  }

  @Test
  public void jsonPathValidateTest() throws Exception {
    LinkedHashMap<String, Object> ex = new LinkedHashMap<>();
    ex.put("good", "$.a");
    ex.put("bad", "AlertType");
    ex.put("skipped", 5);
    LineMap lm = LineMap.build("extractors:\n  good: \"$.a\"\n  bad: AlertType\n");
    ValidationError e =
        only(new JsonPathSyntaxValidator("t.yaml", lm).validate(ex), ValidationSeverity.ERROR);
    assertEquals(Integer.valueOf(3), e.getLineNumber());
    assertEquals("AlertType", e.getRawValue());
    assertEquals("Add $ at the beginning of the expression", e.getSuggestion());
  }

  @Test
  public void templateSyntaxUnknownNamesTest() throws Exception {
    TemplateSyntaxValidator v = new TemplateSyntaxValidator("t.yaml", null);
    ValidationResult r =
        v.validate(
            "{\"id\": \"{{ extractors.alert_id | json_escpe }}\",\n"
                + " \"sev\": \"{{ extractors.severty }}\"}\n",
            Arrays.asList("alert_id", "severity"),
            Collections.<String>emptyList());
    ValidationError e = only(r, ValidationSeverity.ERROR);
    assertEquals("Unknown filter: 'json_escpe'", e.getMessage());
    assertEquals("Did you mean 'json_escape'?", e.getSuggestion());
    assertEquals(Integer.valueOf(1), e.getLineNumber());

    ValidationError w = only(r, ValidationSeverity.WARNING);
    assertEquals("Reference to undefined extractor: 'extractors.severty'", w.getMessage());
    assertEquals("Did you mean 'severity'?", w.getSuggestion());
    assertEquals(Integer.valueOf(2), w.getLineNumber());
    assertNotNull(v.getCompiled());
  }

  @Test
  public void templateSyntaxCustomFilterTest() throws Exception {
    ValidationResult r =
        new TemplateSyntaxValidator("t.yaml", null)
            .validate(
                "{{ extractors.a | mine | upper }}",
                Arrays.asList("a"),
                Arrays.asList("mine"));
    assertTrue(r.isValid());
    assertEquals(0, r.getWarningCount());
  }

  @Test
  public void templateSyntaxBlocksTest() throws Exception {
    TemplateSyntaxValidator v = new TemplateSyntaxValidator("t.yaml", null);
    ValidationResult r =
        v.validate(
            "{\n{% if extractors.a %}\n\"a\": 1\n}\n",
            Arrays.asList("a"),
            Collections.<String>emptyList());
    assertFalse(r.isValid());
    assertNull(v.getCompiled());
    boolean unclosed = false;
    for (ValidationError e : r.getErrors()) {
      if (e.getMessage().equals("Unclosed 'if' block - missing 'endif'")) {
        unclosed = true;
        assertEquals(Integer.valueOf(2), e.getLineNumber());
        assertEquals("Add '{% endif %}' to close the block", e.getSuggestion());
      }
    }
    assertTrue(r.getErrors().toString(), unclosed);

    r =
        v.validate(
            "{% for x in extractors.a %}{% endif %}{% endfor %}",
            Arrays.asList("a"),
            Collections.<String>emptyList());
    boolean mismatched = false;
    for (ValidationError e : r.getErrors()) {
      if (e.getMessage().equals("Mismatched block: found 'endif' but expected 'endfor'")) {
        mismatched = true;
      }
    }
    assertTrue(r.getErrors().toString(), mismatched);

    r = v.validate("", Arrays.asList("a"), Collections.<String>emptyList());
    assertEquals("Template content is empty", only(r, ValidationSeverity.ERROR).getMessage());
  }

  @Test
  public void templateUsageTest() throws Exception {
    CompiledTemplate t =
        TemplateEngine.getDefault()
            .parse(
                "t",
                "{{ extractors.n * 2 }}{% for i in extractors.l %}{{ i }}{% endfor %}"
                    + "{% if extractors.b %}x{% endif %}{{ extractors.m.key }}"
                    + "{{ extractors.s }}");
    TemplateUsage u = TemplateUsage.of(t);
    assertEquals(TemplateUsage.ValueKind.NUMBER, u.kindOf("n"));
    assertEquals(TemplateUsage.ValueKind.LIST, u.kindOf("l"));
    assertEquals(TemplateUsage.ValueKind.BOOLEAN, u.kindOf("b"));
    assertEquals(TemplateUsage.ValueKind.MAP, u.kindOf("m"));
    assertNull(u.kindOf("s"));
    assertEquals(5, u.getReferencedExtractors().size());
  }

  @Test
  public void mockValuesTest() throws Exception {
    assertEquals(MockValues.MOCK_TIMESTAMP, MockValues.forName("created_time"));
    assertEquals(75L, MockValues.forName("secure_score"));
    assertEquals(443L, MockValues.forName("dest_port"));
    assertEquals("mock-alert_id-12345678", MockValues.forName("alert_id"));
    assertEquals("Medium", MockValues.forName("severity"));
    assertEquals("192.168.1.100", MockValues.forName("source_ip"));
    assertEquals("mock-foo", MockValues.forName("foo"));
    assertEquals(75L, MockValues.forKind("x", TemplateUsage.ValueKind.NUMBER));
    assertTrue(MockValues.forKind("x", TemplateUsage.ValueKind.LIST) instanceof List);
  }

  @Test
  public void filterCodeTest() throws Exception {
    FilterCodeValidator v = new FilterCodeValidator("t.yaml", null);
    Map<String, Object> f = new LinkedHashMap<>();
    f.put("good", "def good(value) {\n  return value\n}\n");
    f.put("implicit", "def implicit(value) {\n  value.toString()\n}\n");
    assertTrue(v.validate(f).isValid());
    assertEquals(0, v.validate(f).getWarningCount());

    f.clear();
    f.put("foo", "def bar(x) {\n  return x\n}\n");
    ValidationError e = only(v.validate(f), ValidationSeverity.ERROR);
    assertEquals(ValidationPhase.FILTER_CODE, e.getPhase());
    assertEquals("Filter 'foo' defines function(s) [bar] instead of 'foo'", e.getMessage());

    f.clear();
    f.put("broken", "def broken(x) {\n  return x +\n");
    assertFalse(v.validate(f).isValid());

    f.clear();
    f.put("noret", "def noret(x) {\n}\n");
    ValidationError w = only(v.validate(f), ValidationSeverity.WARNING);
    assertEquals("Filter function 'noret' may not return a value", w.getMessage());
  }

  @Test
  public void filterCodeSandboxTest() throws Exception {
    Map<String, Object> f = new LinkedHashMap<>();
    f.put("env", "def env(x) {\n  return System.getenv('HOME')\n}\n");
    assertFalse(new FilterCodeValidator("t.yaml", null).validate(f).isValid());
  }

  @Test
  public void jsonOutputTest() throws Exception {
    JsonOutputValidator v = new JsonOutputValidator("t.yaml", null);
    ValidationResult r =
        v.validate(
            "{\n  \"id\": \"{{ extractors.alert_id }}\",\n}\n",
            null,
            Arrays.asList("alert_id"),
            Collections.<String>emptyList());
    ValidationError e = only(r, ValidationSeverity.ERROR);
    assertEquals(ValidationPhase.JSON_OUTPUT, e.getPhase());
    assertTrue(e.getMessage().startsWith("Rendered template is not valid JSON"));
    assertEquals("Check for trailing commas before closing braces } or ]", e.getSuggestion());
    assertNull(v.getOutput());

    r =
        v.validate(
            "{\"risk\": {{ extractors.risk * 2 }}, \"v\": \"{{ extractors.v | mine }}\"}",
            null,
            Arrays.asList("risk", "v"),
            Arrays.asList("mine"));
    assertTrue(r.isValid());
    assertEquals(150L, ((Number) v.getOutput().get("risk")).longValue());
    assertEquals("mock-v", v.getOutput().get("v"));

    r = v.validate("[1, 2]", null, Arrays.asList("a"), Collections.<String>emptyList());
    assertEquals(
        "Rendered template is not a JSON object", only(r, ValidationSeverity.ERROR).getMessage());

    // Templates that do not compile are reported by the syntax phase
    r = v.validate("{% if %}", null, Arrays.asList("a"), Collections.<String>emptyList());
    assertTrue(r.isValid());
  }
}
