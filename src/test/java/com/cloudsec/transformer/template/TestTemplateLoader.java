package com.cloudsec.transformer.template;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.cloudsec.transformer.mapping.MappingRegistry;
import com.cloudsec.transformer.output.OutputFormat;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestTemplateLoader {
  private MappingRegistry registry;
  private TemplateLoader loader;

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  public TestTemplateLoader() {}

  @Before
  public void setup() throws Exception {
    registry = MappingRegistry.load("/testdata/mappings/test_mappings.json");
    loader = new TemplateLoader("/testdata/templates", registry);
  }

  @Test
  public void loadTest() throws Exception {
    TemplateDefinition t = loader.load("test_alert", OutputFormat.OCSF);
    assertNotNull(t);
    assertEquals("test_alert_ocsf", t.getName());
    assertEquals("$.AlertType", t.getExtractors().get("alert_id"));
    assertNotNull(t.getCompiled());
    assertEquals("/testdata/templates/test_alert_ocsf.yaml", t.getSourcePath());

    HashMap<String, Object> ex = new HashMap<>();
    ex.put("alert_id", "TestAlert");
    HashMap<String, Object> ctx = new HashMap<>();
    ctx.put("extractors", ex);
    assertEquals("{\"new_id\": \"TestAlert\"}\n", t.render(ctx));
  }

  @Test
  public void cacheTest() throws Exception {
    TemplateDefinition t = loader.load("test_alert", OutputFormat.OCSF);
    assertSame(t, loader.load("test_alert", OutputFormat.OCSF));
    assertEquals(1, loader.getCache().size());
    assertTrue(loader.getCache().invalidate("test_alert", OutputFormat.OCSF));
    assertFalse(loader.getCache().invalidate("test_alert", OutputFormat.OCSF));
    TemplateDefinition reloaded = loader.load("test_alert", OutputFormat.OCSF);
    assertNotNull(reloaded);
    assertFalse(t == reloaded);
    loader.getCache().invalidateAll();
    assertEquals(0, loader.getCache().size());
  }

  @Test
  public void disabledTest() throws Exception {
    assertTrue(loader.isDisabled("test_alert", OutputFormat.ASFF));
    assertNull(loader.load("test_alert", OutputFormat.ASFF));
    assertNull(loader.resolvePath("test_alert", OutputFormat.ASFF));
    assertNull(loader.validateTemplate("test_alert", OutputFormat.ASFF));
  }

  @Test
  public void missingTest() throws Exception {
    assertFalse(loader.isDisabled("generic", OutputFormat.ASFF));
    assertNull(loader.load("generic", OutputFormat.ASFF));
    assertNull(loader.load("not_registered", OutputFormat.OCSF));
    assertEquals(
        "/testdata/templates/generic_asff.yaml",
        loader.resolvePath("generic", OutputFormat.ASFF));
    assertNotNull(loader.validateTemplate("generic", OutputFormat.ASFF));
  }

  @Test
  public void customFilterTemplateTest() throws Exception {
    TemplateDefinition t = loader.load("test_alert", OutputFormat.CLOUDTRAIL);
    assertNotNull(t);
    assertTrue(t.getFilterRegistry().getCustom().containsKey("shout"));
    assertNotNull(t.getFilterRegistry().getFilter("slugify"));
    assertTrue(
        TemplateEngine.getDefault().filterNames(t.getFilterRegistry()).contains("shout"));
  }

  @Test
  public void supportedTemplatesTest() throws Exception {
    assertEquals(
        Arrays.asList("test_alert", "typed_alert"),
        loader.getSupportedTemplates(OutputFormat.OCSF));
    Map<OutputFormat, List<String>> all = loader.getAllSupportedTemplates();
    assertTrue(all.get(OutputFormat.ASFF).isEmpty());
  }

  @Test
  public void bundledTemplatesTest() throws Exception {
    TemplateLoader bundled =
        new TemplateLoader(
            TemplateLoader.DEFAULT_TEMPLATE_DIR,
            MappingRegistry.load(MappingRegistry.DEFAULT_PATH));
    for (OutputFormat f : OutputFormat.values()) {
      assertNull(bundled.validateTemplate("azure_security_alert", f));
    }
    assertNull(bundled.validateTemplate("generic", OutputFormat.CLOUDTRAIL));
    assertTrue(bundled.validateAllTemplates().isEmpty());
  }

  @Test(expected = TemplateLoadException.class)
  public void brokenTemplateTest() throws Exception {
    File f = folder.newFile("broken.yaml");
    Files.write(
        f.toPath(),
        "name: broken\nextractors:\n  a: \"$.a\"\ntemplate: \"{% if x %}\"\n"
            .getBytes(StandardCharsets.UTF_8));
    loader.loadFile(f.getAbsolutePath());
  }

  @Test(expected = TemplateLoadException.class)
  public void noExtractorsTest() throws Exception {
    File f = folder.newFile("noextract.yaml");
    Files.write(
        f.toPath(), "name: noextract\ntemplate: \"{}\"\n".getBytes(StandardCharsets.UTF_8));
    loader.loadFile(f.getAbsolutePath());
  }

  @Test(expected = TemplateLoadException.class)
  public void badFilterTemplateTest() throws Exception {
    File f = folder.newFile("badfilter.yaml");
    Files.write(
        f.toPath(),
        ("name: badfilter\nextractors:\n  a: \"$.a\"\nfilters:\n  foo: |\n    def bar(x) {\n"
                + "      return x\n    }\ntemplate: \"{}\"\n")
            .getBytes(StandardCharsets.UTF_8));
    loader.loadFile(f.getAbsolutePath());
  }

  @Test
  public void unknownFilterTemplateTest() throws Exception {
    File f = folder.newFile("unknownfilter.yaml");
    Files.write(
        f.toPath(),
        "name: unknownfilter\nextractors:\n  a: \"$.a\"\ntemplate: \"{{ extractors.a | nope }}\"\n"
            .getBytes(StandardCharsets.UTF_8));
    try {
      loader.loadFile(f.getAbsolutePath());
      fail("expected load failure");
    } catch (TemplateLoadException exc) {
      assertTrue(exc.getMessage(), exc.getMessage().contains("unknown filter 'nope'"));
      assertTrue(exc.getCause() instanceof TemplateSyntaxException);
    }
  }

  @Test
  public void fileSystemDirectoryTest() throws Exception {
    File dir = folder.newFolder("templates");
    Files.write(
        new File(dir, "test_alert_ocsf.yaml").toPath(),
        "name: fs\nextractors:\n  a: \"$.a\"\ntemplate: \"{}\"\n".getBytes(StandardCharsets.UTF_8));
    TemplateLoader fs = new TemplateLoader(dir.getAbsolutePath(), registry);
    assertEquals("fs", fs.load("test_alert", OutputFormat.OCSF).getName());
    assertEquals(Arrays.asList("test_alert"), fs.getSupportedTemplates(OutputFormat.OCSF));
  }
}
