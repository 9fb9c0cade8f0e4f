package com.cloudsec.transformer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudsec.transformer.output.CloudTrailAuditEvent;
import com.cloudsec.transformer.output.OcsfEvent;
import com.cloudsec.transformer.output.OutputFormat;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class TestEventTransformer {
  private static final String ACCOUNT = "123456789012";

  public TestEventTransformer() {}

  private static TransformerCfg testCfg(boolean enforce) {
    TransformerCfg cfg = new TransformerCfg();
    cfg.setMappingPath("/testdata/mappings/test_mappings.json");
    cfg.setTemplateDirectory("/testdata/templates");
    cfg.setRegion("us-west-2");
    cfg.setEnforceOcsfValidation(enforce);
    return cfg;
  }

  private static Map<String, Object> parse(String json) throws Exception {
    return new ObjectMapper().readValue(json, new TypeReference<Map<String, Object>>() {});
  }

  private static Map<String, Object> testAlert() throws Exception {
    return parse(
        "{\"event_data\": {\"AlertType\": \"TestAlert\", \"Severity\": \"Medium\","
            + " \"SystemAlertId\": \"abc-123\"}}");
  }

  private static Map<String, Object> typedAlert(String kind) throws Exception {
    return parse(
        String.format(
            "{\"event_data\": {\"id\": \"t-1\", \"properties\": {\"kind\": \"%s\","
                + " \"time\": \"2025-01-01T00:00:00Z\"}}}",
            kind));
  }

  @Test
  public void transformOcsfTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    TransformOutcome o = t.transform(testAlert(), ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.SUCCESS, o.getStatus());
    assertEquals("test_alert", o.getEventType());
    assertTrue(o.getOutput() instanceof OcsfEvent);
    assertEquals("{\"new_id\":\"TestAlert\"}", o.getOutput().toJSON());
    // Output is not a real OCSF event, but enforcement is off
    assertNotNull(o.getOcsfValidation());
    assertFalse(o.getOcsfValidation().isValid());
  }

  @Test
  public void transformCloudTrailTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    CloudTrailAuditEvent a =
        (CloudTrailAuditEvent) t.map(testAlert(), ACCOUNT, OutputFormat.CLOUDTRAIL);
    CloudTrailAuditEvent b =
        (CloudTrailAuditEvent) t.map(testAlert(), ACCOUNT, OutputFormat.CLOUDTRAIL);
    assertNotNull(a);
    assertNotEquals(a.getId(), b.getId());
    assertEquals(a.getEventData(), b.getEventData());

    Map<String, Object> data = parse(a.getEventData());
    assertEquals("TestAlertTestAlert", data.get("eventName"));
    assertEquals("test.security.example.com", data.get("eventSource"));
    assertEquals(ACCOUNT, data.get("recipientAccountId"));
    assertEquals("us-west-2", data.get("awsRegion"));
    assertEquals("abc-123", data.get("UID"));
    assertEquals("MEDIUM", data.get("severity"));
    assertEquals("MEDIUMMEDIUM", data.get("echo"));
  }

  @Test
  public void disabledAndMissingTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    TransformOutcome o = t.transform(testAlert(), ACCOUNT, OutputFormat.ASFF);
    assertEquals(TransformOutcome.Status.DISABLED, o.getStatus());
    assertNull(o.getOutput());

    Map<String, Object> unknown = parse("{\"event_data\": {\"id\": \"x\"}}");
    assertEquals("generic", t.classify(unknown));
    o = t.transform(unknown, ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.MISSING, o.getStatus());
    assertNull(t.map(unknown, ACCOUNT, OutputFormat.OCSF));
  }

  @Test
  public void invalidJsonOutputTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    TransformOutcome o = t.transform(typedAlert("Malware"), ACCOUNT, OutputFormat.CLOUDTRAIL);
    assertEquals(TransformOutcome.Status.FAILED, o.getStatus());
    assertEquals("typed_alert", o.getEventType());
    assertTrue(o.getReason().startsWith("rendered template is not a JSON object"));
  }

  @Test
  public void ocsfEnforcementTest() throws Exception {
    EventTransformer lenient = new EventTransformer(testCfg(false));
    TransformOutcome o =
        lenient.transform(typedAlert("MalwareBadCategory"), ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.SUCCESS, o.getStatus());
    assertFalse(o.getOcsfValidation().isValid());

    EventTransformer strict = new EventTransformer(testCfg(true));
    o = strict.transform(typedAlert("MalwareBadCategory"), ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.FAILED, o.getStatus());
    assertTrue(o.getReason().startsWith("OCSF validation failed"));
    assertTrue(o.getOcsfValidation().hasErrorContaining("'category uid' value: 1"));

    o = strict.transform(typedAlert("Malware"), ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.SUCCESS, o.getStatus());
    OcsfEvent e = (OcsfEvent) o.getOutput();
    assertEquals(1735689600000L, ((Number) e.getFields().get("time")).longValue());
  }

  @Test
  public void specificEventTypeTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    assertEquals("typed_alert_specific", t.classify(typedAlert("MalwareDetectedOnHost")));
    // No templates exist for the more specific type
    TransformOutcome o =
        t.transform(typedAlert("MalwareDetectedOnHost"), ACCOUNT, OutputFormat.OCSF);
    assertEquals(TransformOutcome.Status.MISSING, o.getStatus());
  }

  @Test
  public void buildContextTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    HashMap<String, Object> extracted = new HashMap<>();
    extracted.put("a", "b");
    Map<String, Object> ctx = t.buildContext(testAlert(), extracted, ACCOUNT, "test_alert");
    for (String k :
        Arrays.asList(
            "extractors",
            "config",
            "account_id",
            "aws_account_id",
            "region",
            "aws_region",
            "event_type",
            "timestamp",
            "azure_event",
            "gcp_event",
            "event")) {
      assertTrue(k, ctx.containsKey(k));
    }
    // generate_uuid() is an engine function, not a context value
    assertFalse(ctx.containsKey("generate_uuid"));
    assertEquals(extracted, ctx.get("extractors"));
    assertEquals("us-west-2", ctx.get("region"));
    assertEquals("TestAlert", ((Map<?, ?>) ctx.get("config")).get("event_name_prefix"));
  }

  @Test
  public void validateCloudEventTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    assertTrue(t.validateCloudEvent(testAlert()));
    assertTrue(t.validateCloudEvent(parse("{\"event_data\": {\"name\": \"n\"}}")));
    assertFalse(t.validateCloudEvent(parse("{\"event_data\": {\"other\": 1}}")));
    assertFalse(t.validateCloudEvent(parse("{\"data\": {\"id\": 1}}")));
    assertFalse(t.validateCloudEvent(parse("{\"event_data\": \"text\"}")));
    assertFalse(t.validateCloudEvent(null));
  }

  @Test
  public void transformBatchTest() throws Exception {
    EventTransformer t = new EventTransformer(testCfg(false));
    List<Map<String, Object>> events = new ArrayList<>();
    events.add(testAlert());
    events.add(typedAlert("Malware"));
    events.add(parse("{\"event_data\": {\"id\": \"x\"}}"));
    List<TransformOutcome> out = t.transformBatch(events, ACCOUNT, OutputFormat.OCSF);
    assertEquals(3, out.size());
    assertEquals(TransformOutcome.Status.SUCCESS, out.get(0).getStatus());
    assertEquals(TransformOutcome.Status.SUCCESS, out.get(1).getStatus());
    assertEquals("typed_alert", out.get(1).getEventType());
    assertEquals(TransformOutcome.Status.MISSING, out.get(2).getStatus());
  }

  @Test
  public void defaultCfgTest() throws Exception {
    TransformerCfg cfg = new TransformerCfg();
    assertEquals("/mapping/event_type_mappings.json", cfg.getMappingPath());
    assertEquals("/templates", cfg.getTemplateDirectory());
    assertFalse(cfg.getEnforceOcsfValidation());
    assertEquals(TransformerCfg.DEFAULT_REGION, cfg.getRegion());
  }
}
