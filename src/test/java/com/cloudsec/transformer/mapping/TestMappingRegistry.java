package com.cloudsec.transformer.mapping;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudsec.transformer.output.OutputFormat;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class TestMappingRegistry {
  public TestMappingRegistry() {}

  @Test
  public void loadTest() throws Exception {
    MappingRegistry r = MappingRegistry.load("/testdata/mappings/test_mappings.json");
    assertNotNull(r);
    assertEquals(
        Arrays.asList("test_alert", "typed_alert", "typed_alert_specific", "generic"),
        r.getSupportedEventTypes());

    EventTypeMapping m = r.get("test_alert");
    assertNotNull(m);
    assertEquals("test_alert", m.getName());
    assertEquals("test.security.example.com", m.getEventSource());
    assertEquals(Arrays.asList("AlertType"), m.getDetectionKeys());
    assertTrue(m.isTemplateDisabled(OutputFormat.ASFF));
    assertFalse(m.isTemplateDisabled(OutputFormat.OCSF));
    assertFalse(m.declaresTemplate(OutputFormat.OCSF));
    assertNull(r.get("unknown"));

    assertTrue(r.get("generic").isGeneric());
    assertEquals(MatchMode.STARTSWITH, r.get("typed_alert_specific").getMatchMode());
  }

  @Test
  public void bundledMappingTest() throws Exception {
    MappingRegistry r = MappingRegistry.load(MappingRegistry.DEFAULT_PATH);
    assertTrue(r.getSupportedEventTypes().contains("generic"));
    assertTrue(r.getSupportedEventTypes().contains("azure_security_alert"));
    assertEquals(
        "Microsoft Defender for Cloud", r.get("azure_security_alert").getAsffProductName());
    assertTrue(r.get("azure_security_assessment").isTemplateDisabled(OutputFormat.ASFF));
  }

  @Test
  public void candidateOrderTest() throws Exception {
    MappingRegistry r = MappingRegistry.load("/testdata/mappings/test_mappings.json");
    List<EventTypeMapping> c = r.getClassificationCandidates();
    assertEquals(3, c.size());
    // Detection keys first, then longer event type values
    assertEquals("test_alert", c.get(0).getName());
    assertEquals("typed_alert_specific", c.get(1).getName());
    assertEquals("typed_alert", c.get(2).getName());
  }

  @Test
  public void configMapTest() throws Exception {
    MappingRegistry r = MappingRegistry.load("/testdata/mappings/test_mappings.json");
    assertEquals("TestAlert", r.get("test_alert").toMap().get("event_name_prefix"));
    assertTrue(r.get("test_alert").toMap().containsKey("asff_template"));
    assertNull(r.get("test_alert").toMap().get("asff_template"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void invalidMatchModeTest() throws Exception {
    MappingRegistry.load("/testdata/mappings/invalid_mode.json");
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingRequiredFieldTest() throws Exception {
    MappingRegistry.load("/testdata/mappings/missing_field.json");
  }

  @Test
  public void matchModeTest() throws Exception {
    assertTrue(MatchMode.CONTAINS.matches("malware", "DetectedMALWAREAlert"));
    assertFalse(MatchMode.CONTAINS.matches("malware", null));
    assertTrue(MatchMode.EXACT.matches("Alert", "Alert"));
    assertFalse(MatchMode.EXACT.matches("Alert", "alert"));
    assertTrue(MatchMode.NESTED_EXACT.matches("Alert", "Alert"));
    assertTrue(MatchMode.STARTSWITH.matches("vm_", "VM_Suspicious"));
    assertFalse(MatchMode.STARTSWITH.matches("vm_", "AppServices_VM"));
    assertEquals(MatchMode.CONTAINS, MatchMode.fromConfigName(null));
    assertEquals(MatchMode.NESTED_EXACT, MatchMode.fromConfigName("nested_exact"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownMatchModeNameTest() throws Exception {
    MatchMode.fromConfigName("regex");
  }
}
