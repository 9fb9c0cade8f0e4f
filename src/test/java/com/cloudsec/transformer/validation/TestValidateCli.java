package com.cloudsec.transformer.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class TestValidateCli {
  private static final String DIR = "./target/test-classes/testdata/validation/";

  public TestValidateCli() {}

  private ByteArrayOutputStream buf;

  private int run(String... args) throws Exception {
    buf = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buf, true, "UTF-8");
    return ValidateCli.run(args, out, false);
  }

  private String output() {
    return new String(buf.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void validTest() throws Exception {
    assertEquals(ValidateCli.EXIT_VALID, run("-d", DIR + "valid"));
    assertTrue(output().contains("Total templates: 3"));
    assertEquals(ValidateCli.EXIT_VALID, run("--template", DIR + "conditionals.yaml"));
  }

  @Test
  public void invalidTest() throws Exception {
    assertEquals(ValidateCli.EXIT_INVALID, run("-t", DIR + "jsonpath_error.yaml"));
    assertTrue(output().contains("[ERROR] jsonpath_error.yaml:6"));
    assertEquals(ValidateCli.EXIT_INVALID, run("--templates-dir", DIR + "missing_dir"));
    assertEquals(ValidateCli.EXIT_INVALID, run("-t", DIR + "does_not_exist.yaml"));
  }

  @Test
  public void jsonOutputTest() throws Exception {
    assertEquals(
        ValidateCli.EXIT_INVALID,
        run("-t", DIR + "unknown_filter.yaml", "-o", "json", "--no-strict"));
    JsonNode n = new ObjectMapper().readTree(output());
    assertEquals(1, n.get("summary").get("total_errors").asInt());
    assertEquals(1, n.get("summary").get("total_warnings").asInt());
  }

  @Test
  public void warningsAsErrorsTest() throws Exception {
    assertEquals(
        ValidateCli.EXIT_INVALID, run("-t", DIR + "unknown_filter.yaml", "--warnings-as-errors"));
  }

  @Test
  public void usageTest() throws Exception {
    assertEquals(ValidateCli.EXIT_USAGE, run());
    assertTrue(output().contains("usage: ValidateCli"));
    assertEquals(ValidateCli.EXIT_USAGE, run("-t", "a.yaml", "-d", "dir"));
    assertEquals(ValidateCli.EXIT_USAGE, run("-t", "a.yaml", "-o", "xml"));
    assertEquals(ValidateCli.EXIT_USAGE, run("-t", "a.yaml", "--strict", "--no-strict"));
    assertEquals(ValidateCli.EXIT_USAGE, run("-t", "a.yaml", "--bogus"));
  }
}
