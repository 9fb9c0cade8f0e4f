package com.cloudsec.transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.codehaus.groovy.control.CompilationFailedException;
import org.junit.Test;

public class TestScriptRunner {
  public TestScriptRunner() {}

  @Test
  public void scriptRunnerTest() throws Exception {
    ScriptRunner runner = new ScriptRunner();
    runner.loadScript(
        "filters",
        "def shout(value) { return value.toString().toUpperCase() }\n"
            + "def twice(value) { return shout(value) + shout(value) }\n");
    assertTrue(runner.hasScript("filters"));
    assertFalse(runner.hasScript("missing"));
    assertTrue(runner.definedMethods("filters").contains("shout"));
    assertTrue(runner.definedMethods("filters").contains("twice"));
    assertEquals("ABAB", runner.invokeMethod("filters", "twice", String.class, "ab"));
  }

  @Test
  public void scriptRunnerMissingTest() throws Exception {
    ScriptRunner runner = new ScriptRunner();
    runner.loadScript("filters", "def shout(value) { return value }\n");
    try {
      runner.invokeMethod("filters", "whisper", String.class, "ab");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException exc) {
      // expected
    }
    try {
      runner.invokeMethod("nothere", "shout", String.class, "ab");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException exc) {
      assertEquals("script nothere not loaded", exc.getMessage());
    }
  }

  @Test
  public void scriptRunnerSandboxTest() throws Exception {
    ScriptRunner runner = new ScriptRunner();
    try {
      runner.loadScript("bad", "def f(value) { System.exit(1) }\n");
      fail("expected CompilationFailedException");
    } catch (CompilationFailedException exc) {
      assertFalse(runner.hasScript("bad"));
    }
    try {
      runner.loadScript("bad", "import java.io.File\ndef f(value) { return value }\n");
      fail("expected CompilationFailedException");
    } catch (CompilationFailedException exc) {
      assertFalse(runner.hasScript("bad"));
    }
  }
}
