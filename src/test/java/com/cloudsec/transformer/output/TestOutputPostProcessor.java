package com.cloudsec.transformer.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

public class TestOutputPostProcessor {
  public TestOutputPostProcessor() {}

  private static Map<String, Object> rendered() {
    HashMap<String, Object> ret = new HashMap<>();
    ret.put("UID", "provider-id-1");
    ret.put("eventName", "TestAlert");
    return ret;
  }

  @Test
  public void cloudTrailTest() throws Exception {
    OutputPostProcessor p = new OutputPostProcessor();
    CloudTrailAuditEvent a = (CloudTrailAuditEvent) p.finish(OutputFormat.CLOUDTRAIL, rendered());
    CloudTrailAuditEvent b = (CloudTrailAuditEvent) p.finish(OutputFormat.CLOUDTRAIL, rendered());
    assertNotEquals(a.getId(), b.getId());
    assertNotEquals("provider-id-1", a.getId());
    assertEquals(a.getEventData(), b.getEventData());

    Map<?, ?> data = new ObjectMapper().readValue(a.getEventData(), Map.class);
    assertEquals("provider-id-1", data.get("UID"));

    Map<String, Object> m = a.toMap();
    assertEquals(a.getId(), m.get("id"));
    assertTrue(m.get("eventData") instanceof String);
    assertNull(m.get("eventDataChecksum"));
    assertEquals(OutputFormat.CLOUDTRAIL, a.getFormat());
  }

  @Test
  public void cloudTrailEventDataMemberTest() throws Exception {
    HashMap<String, Object> r = new HashMap<>();
    HashMap<String, Object> inner = new HashMap<>();
    inner.put("k", "v");
    r.put("eventData", inner);
    r.put("ignored", true);
    CloudTrailAuditEvent a =
        (CloudTrailAuditEvent) new OutputPostProcessor().finish(OutputFormat.CLOUDTRAIL, r);
    assertEquals("{\"k\":\"v\"}", a.getEventData());
  }

  @Test
  public void passThroughTest() throws Exception {
    OutputPostProcessor p = new OutputPostProcessor();
    TransformedEvent o = p.finish(OutputFormat.OCSF, rendered());
    assertTrue(o instanceof OcsfEvent);
    assertEquals(rendered(), o.toMap());
    TransformedEvent a = p.finish(OutputFormat.ASFF, rendered());
    assertTrue(a instanceof AsffFinding);
    assertEquals(rendered(), a.toMap());
    Map<?, ?> json = new ObjectMapper().readValue(a.toJSON(), Map.class);
    assertEquals("TestAlert", json.get("eventName"));
  }

  @Test
  public void formatNameTest() throws Exception {
    assertEquals(OutputFormat.OCSF, OutputFormat.fromName("ocsf"));
    assertEquals(OutputFormat.ASFF, OutputFormat.fromName("ASFF"));
    assertEquals("cloudtrail_template", OutputFormat.CLOUDTRAIL.templateKey());
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownFormatTest() throws Exception {
    OutputFormat.fromName("splunk");
  }
}
