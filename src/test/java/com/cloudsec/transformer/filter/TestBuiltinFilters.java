package com.cloudsec.transformer.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudsec.transformer.template.TemplateEngine;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import org.junit.Test;

public class TestBuiltinFilters {
  private final FilterRegistry registry = FilterRegistry.builtin();

  public TestBuiltinFilters() {}

  private Object apply(String name, Object value, Object... args) {
    return registry
        .getFilter(name)
        .apply(value, Arrays.asList(args), Collections.<String, Object>emptyMap());
  }

  @Test
  public void registryTest() throws Exception {
    for (String name :
        new String[] {
          "normalize_timestamp", "to_unix_timestamp_ms", "json_escape", "slugify", "extract_ip",
          "extract_port", "omit_if_invalid", "asff_severity_label"
        }) {
      assertNotNull(name, registry.getFilter(name));
    }
    assertNull(registry.getFilter("no_such_filter"));
    assertTrue(FilterRegistry.builtinNames().contains("map_mitre_tactic"));
    // General purpose filters come from the template engine
    assertNull(registry.getFilter("default"));
    Set<String> engine = TemplateEngine.getDefault().filterNames(null);
    for (String name : new String[] {"default", "tojson", "join", "map_mitre_tactic"}) {
      assertTrue(name, engine.contains(name));
    }
  }

  @Test
  public void timestampTest() throws Exception {
    assertEquals("2025-01-01T12:00:00Z", apply("normalize_timestamp", "2025-01-01T12:00:00.123Z"));
    assertEquals("2025-01-01T12:00:00Z", apply("normalize_timestamp", "2025-01-01 12:00:00"));
    assertEquals(1735732800000L, apply("to_unix_timestamp_ms", "2025-01-01T12:00:00Z"));
    assertEquals(1735732800000L, apply("to_unix_timestamp_ms", 1735732800000L));
    assertEquals("2025-01-01T12:00:01.000Z", apply("add_one_second", "2025-01-01T12:00:00Z"));
  }

  @Test
  public void severityTest() throws Exception {
    assertEquals(3L, apply("map_azure_severity_to_ocsf", "Medium"));
    assertEquals(99L, apply("map_azure_severity_to_ocsf", "Bogus"));
    assertEquals("HIGH", apply("asff_severity_label", "High"));
    assertEquals("INFORMATIONAL", apply("asff_severity_label", null));
    assertEquals("TA0005", apply("map_mitre_tactic", "DefenseEvasion"));
    assertEquals("TA0000", apply("map_mitre_tactic", "Unknown"));
  }

  @Test
  public void scoreTest() throws Exception {
    assertEquals("INFORMATIONAL", apply("score_to_severity", 95L));
    assertEquals("HIGH", apply("score_to_severity", 2L, 10L));
    assertEquals("MEDIUM", apply("score_to_severity", 5L, 0L));
    assertEquals(25L, apply("score_to_severity_normalized", 75L));
    assertEquals("PASSED", apply("score_to_compliance_status", 9L, 10L));
    assertEquals(1L, apply("calculate_compliance_severity", 9L, 10L));
    assertEquals(3L, apply("calculate_compliance_severity", 9L));
  }

  @Test
  public void azureResourceTest() throws Exception {
    String id =
        "/subscriptions/sub-123/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/vm1";
    assertEquals("sub-123", apply("extract_subscription_id", id));
    assertEquals("unknown", apply("extract_subscription_id", "no-subscription"));
    assertEquals("vm1", apply("extract_resource_name", id));
    assertEquals("Microsoft.Compute", apply("extract_azure_resource_type", id));

    HashMap<String, Object> ip = new HashMap<>();
    ip.put("Type", "ip");
    ip.put("Address", "10.1.2.3");
    HashMap<String, Object> aad = new HashMap<>();
    aad.put("Type", "AAD");
    aad.put("AadTenantId", "tenant-1");
    List<Object> entities = Arrays.<Object>asList(aad, ip);
    assertEquals("10.1.2.3", apply("extract_source_ip", entities));
    assertEquals("tenant-1", apply("extract_azure_tenant", entities));
  }

  @Test
  public void addressTest() throws Exception {
    assertEquals("10.0.0.1", apply("extract_ip", "10.0.0.1:443"));
    assertEquals(443L, apply("extract_port", "10.0.0.1:443"));
    assertEquals("2001:db8::1", apply("extract_ip", "[2001:db8::1]:8080"));
    assertEquals(8080L, apply("extract_port", "[2001:db8::1]:8080"));
    assertEquals("2001:db8::1", apply("extract_ip", "2001:db8::1"));
    assertNull(apply("extract_port", "2001:db8::1"));
    assertNull(apply("extract_port", "10.0.0.1"));
  }

  @Test
  public void validityTest() throws Exception {
    assertFalse(BuiltinFilters.isValid(null));
    assertFalse(BuiltinFilters.isValid(" N/A "));
    assertFalse(BuiltinFilters.isValid(Collections.emptyList()));
    assertTrue(BuiltinFilters.isValid("value"));
    assertTrue(BuiltinFilters.isValid(0L));
    assertNull(apply("omit_if_invalid", "unknown"));
    assertEquals("x", apply("default_if_invalid", "none", "x"));
    assertEquals("ok", apply("default_if_invalid", "ok", "x"));
  }

  @Test
  public void stringTest() throws Exception {
    assertEquals("hello-world-2025", apply("slugify", "  Hello, World! 2025 "));
    assertEquals("", apply("slugify", null));
    assertEquals("say \\\"hi\\\"\\n", apply("json_escape", "say \"hi\"\n"));
    assertEquals("", apply("json_escape", null));
    assertEquals("abc...", apply("truncate", "abcdef", 3L));
    assertEquals("abc", apply("truncate", "abc", 3L));
    assertEquals("Unknown", apply("safe_string", null));
  }

  @Test
  public void asffTypesTest() throws Exception {
    assertEquals("[\"TTPs/Defense Evasion\"]", apply("to_asff_types", "VM_Backdoor"));
  }

  @Test
  public void jsonTest() throws Exception {
    assertEquals("{}", apply("to_json", null));
  }
}
