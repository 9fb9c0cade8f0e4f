package com.cloudsec.transformer.validation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthetic extractor values used to render a template during validation
 *
 * <p>A value is chosen from how the template uses the extractor when that is known, otherwise
 * from the extractor's name.
 */
class MockValues {
  static final String MOCK_TIMESTAMP = "2025-01-01T12:00:00.000Z";

  private static final List<Object> MOCK_ENTITIES =
      ImmutableList.<Object>of(
          ImmutableMap.of("Type", "ip", "SourceAddress", ImmutableMap.of("Address", "10.0.0.1")),
          ImmutableMap.of("Type", "account", "Name", "mock-user"),
          ImmutableMap.of(
              "Type",
              "AzureResource",
              "AzureResourceId",
              "/subscriptions/mock-sub/resourceGroups/mock-rg"),
          ImmutableMap.of("Type", "AAD", "AadTenantId", "mock-tenant-12345"));

  private MockValues() {}

  private static boolean containsAny(String s, String... parts) {
    for (String p : parts) {
      if (s.contains(p)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Mock value for a usage kind
   *
   * @param name Extractor name
   * @param kind Usage kind
   * @return Value
   */
  static Object forKind(String name, TemplateUsage.ValueKind kind) {
    switch (kind) {
      case LIST:
        return MOCK_ENTITIES;
      case MAP:
        return ImmutableMap.of("mockKey", "mockValue", "anotherKey", 123L);
      case NUMBER:
        return 75L;
      case BOOLEAN:
        return true;
      default:
        return String.format("mock-%s", name);
    }
  }

  /**
   * Mock value chosen from an extractor's name
   *
   * @param name Extractor name
   * @return Value
   */
  static Object forName(String name) {
    String n = name.toLowerCase();
    if (containsAny(n, "time", "timestamp", "date", "created", "updated", "modified")) {
      return MOCK_TIMESTAMP;
    }
    if (containsAny(n, "score", "count", "weight")) {
      return 75L;
    }
    if (n.contains("port")) {
      return 443L;
    }
    if (containsAny(n, "process_id", "pid")) {
      return 12345L;
    }
    if (n.contains("level") && !n.contains("confidence")) {
      return 5L;
    }
    if (containsAny(n, "id", "uid", "uuid", "guid")) {
      return String.format("mock-%s-12345678", name);
    }
    if (n.contains("severity")) {
      return "Medium";
    }
    if (n.contains("status")) {
      return "Active";
    }
    if (n.contains("confidence")) {
      return "Medium";
    }
    if (containsAny(n, "entities", "resources", "identifiers", "tags")) {
      return MOCK_ENTITIES;
    }
    if (containsAny(n, "intent", "tactic", "technique")) {
      return "DefenseEvasion, LateralMovement";
    }
    if (n.contains("resource")) {
      return "/subscriptions/mock-subscription/resourceGroups/mock-rg/providers/"
          + "Microsoft.Compute/virtualMachines/mock-vm";
    }
    if (containsAny(n, "url", "uri", "link")) {
      return "https://portal.azure.com/mock-alert-url";
    }
    if (containsAny(n, "name", "title", "displayname")) {
      return "Mock " + name.replace('_', ' ');
    }
    if (containsAny(n, "description", "desc", "message", "details")) {
      return "Mock description for " + name;
    }
    if (containsAny(n, "is_", "has_", "enabled", "active", "incident")) {
      return true;
    }
    if (containsAny(n, "properties", "metadata", "attributes")) {
      return ImmutableMap.of("mockKey", "mockValue", "anotherKey", 123L);
    }
    if (containsAny(n, "remediation", "steps")) {
      return Arrays.asList("Step 1: Review the alert", "Step 2: Take appropriate action");
    }
    if (containsAny(n, "ip", "address")) {
      return "192.168.1.100";
    }
    if (n.contains("version")) {
      return "1.0.0";
    }
    if (containsAny(n, "region", "location", "zone")) {
      return "us-east-1";
    }
    if (n.contains("type")) {
      return "MockType";
    }
    return String.format("mock-%s", name);
  }

  /**
   * Mock values for every declared extractor
   *
   * @param extractors Declared extractor names
   * @param usage Template usage, may be null
   * @return Extractor values
   */
  static Map<String, Object> extractors(Iterable<String> extractors, TemplateUsage usage) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    for (String name : extractors) {
      TemplateUsage.ValueKind kind = usage == null ? null : usage.kindOf(name);
      ret.put(name, kind != null ? forKind(name, kind) : forName(name));
    }
    return ret;
  }

  /**
   * Raw provider event used for the event aliases of the context
   *
   * @return Event
   */
  static Map<String, Object> providerEvent() {
    HashMap<String, Object> e = new HashMap<>();
    e.put("SystemAlertId", "mock-alert-id");
    e.put("AlertDisplayName", "Mock Alert");
    e.put("AlertType", "VM_MockAlert");
    e.put("Description", "This is a mock alert for validation");
    e.put("Severity", "Medium");
    e.put("Status", "New");
    e.put("TimeGenerated", MOCK_TIMESTAMP);
    e.put("StartTimeUtc", "2025-01-01T11:55:00.000Z");
    e.put("EndTimeUtc", "2025-01-01T12:05:00.000Z");
    e.put("AzureResourceId", "/subscriptions/mock-sub/resourceGroups/mock-rg");
    e.put("CompromisedEntity", "mock-vm");
    e.put("Intent", "DefenseEvasion");
    e.put("Entities", ImmutableList.of());
    e.put("ExtendedProperties", ImmutableMap.of());
    e.put("RemediationSteps", ImmutableList.of("Review the alert"));
    e.put("AlertUri", "https://portal.azure.com/mock");
    e.put("ConfidenceScore", 75L);
    e.put("VendorName", "Microsoft");
    e.put("ProductName", "Microsoft Defender for Cloud");
    return e;
  }
}
