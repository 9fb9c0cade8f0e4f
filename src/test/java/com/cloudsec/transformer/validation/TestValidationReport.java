package com.cloudsec.transformer.validation;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class TestValidationReport {
  private static final String DIR = "./target/test-classes/testdata/validation/";

  public TestValidationReport() {}

  private static AggregatedValidationResult results() {
    TemplateValidator v = new TemplateValidator(true, false);
    AggregatedValidationResult ret = new AggregatedValidationResult();
    ret.add(v.validateTemplate(DIR + "jsonpath_error.yaml"));
    ret.add(v.validateTemplate(DIR + "conditionals.yaml"));
    return ret;
  }

  @Test
  public void textReportTest() throws Exception {
    String text = new ValidationReport(false).toText(results());
    assertThat(text, containsString("TEMPLATE VALIDATION REPORT"));
    assertThat(text, containsString("Total templates: 2\n"));
    assertThat(text, containsString("Valid: 1\n"));
    assertThat(text, containsString("Invalid: 1\n"));
    assertThat(text, containsString("Errors: 1\n"));
    assertThat(text, containsString("jsonpath_error.yaml:\n"));
    assertThat(text, containsString("  [ERROR] jsonpath_error.yaml:6\n"));
    assertThat(text, containsString("    Phase: Jsonpath Syntax\n"));
    assertThat(text, containsString("    Field: extractors.alert_id\n"));
    assertThat(text, containsString("    Value: AlertType\n"));
    assertThat(text, containsString("    Suggestion: Add $ at the beginning of the expression\n"));
    assertThat(text, not(containsString("conditionals.yaml")));
    assertThat(text, not(containsString("\u001B[")));
  }

  @Test
  public void colorReportTest() throws Exception {
    String text = new ValidationReport(true).toText(results());
    assertThat(text, containsString("\u001B[91m[ERROR]\u001B[0m"));
  }

  @Test
  public void jsonReportTest() throws Exception {
    JsonNode n = new ObjectMapper().readTree(new ValidationReport(false).toJson(results()));
    JsonNode summary = n.get("summary");
    assertEquals(2, summary.get("total_templates").asInt());
    assertEquals(1, summary.get("valid_templates").asInt());
    assertEquals(1, summary.get("invalid_templates").asInt());
    assertEquals(1, summary.get("total_errors").asInt());
    assertFalse(summary.get("all_valid").asBoolean());
    JsonNode r = n.get("results").get(DIR + "jsonpath_error.yaml");
    assertFalse(r.get("valid").asBoolean());
    assertEquals(1, r.get("errors").size());
  }

  @Test
  public void truncateTest() throws Exception {
    assertNull(ValidationReport.truncate(null));
    String s = new String(new char[60]).replace('\0', 'a');
    assertEquals(s, ValidationReport.truncate(s));
    String t = ValidationReport.truncate(s + "b");
    assertEquals(60, t.length());
    assertTrue(t.endsWith("..."));
  }
}
