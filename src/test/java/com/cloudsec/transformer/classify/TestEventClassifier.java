package com.cloudsec.transformer.classify;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudsec.transformer.mapping.MappingRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

public class TestEventClassifier {
  private EventClassifier classifier;
  private ObjectMapper mapper;

  public TestEventClassifier() {}

  private Map<String, Object> event(String json) throws Exception {
    return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
  }

  @Before
  public void setup() throws Exception {
    mapper = new ObjectMapper();
    classifier =
        new EventClassifier(MappingRegistry.load("/testdata/mappings/test_mappings.json"));
  }

  @Test
  public void detectionKeysTest() throws Exception {
    Map<String, Object> e =
        event(
            "{\"event_data\": {\"AlertType\": \"TestAlert\", \"Severity\": \"Medium\","
                + " \"SystemAlertId\": \"abc-123\"}}");
    assertEquals("test_alert", classifier.classify(e));
    // Deterministic across repeated calls
    for (int i = 0; i < 10; i++) {
      assertEquals("test_alert", classifier.classify(e));
    }
  }

  @Test
  public void missingDetectionKeyTest() throws Exception {
    assertEquals(
        "generic", classifier.classify(event("{\"event_data\": {\"SystemAlertId\": \"x\"}}")));
  }

  @Test
  public void eventTypeMatchTest() throws Exception {
    assertEquals(
        "typed_alert",
        classifier.classify(event("{\"event_data\": {\"properties\": {\"kind\": \"malware\"}}}")));
    assertEquals(
        "typed_alert_specific",
        classifier.classify(
            event("{\"event_data\": {\"properties\": {\"kind\": \"MalwareDetectedOnHost\"}}}")));
    assertEquals(
        "generic",
        classifier.classify(event("{\"event_data\": {\"properties\": {\"kind\": \"Phish\"}}}")));
  }

  @Test
  public void detectionKeysWithEventTypeTest() throws Exception {
    EventClassifier combo =
        new EventClassifier(MappingRegistry.load("/testdata/mappings/combo_mappings.json"));
    assertEquals(
        "combo",
        combo.classify(
            event("{\"event_data\": {\"AlertType\": \"X\", \"kind\": \"Malware\"}}")));
    // Both criteria configured, so an empty detection key value does not count
    assertEquals(
        "generic",
        combo.classify(
            event("{\"event_data\": {\"AlertType\": \"\", \"kind\": \"Malware\"}}")));
    assertEquals(
        "generic",
        combo.classify(
            event("{\"event_data\": {\"AlertType\": null, \"kind\": \"Malware\"}}")));
    assertEquals(
        "generic",
        combo.classify(
            event("{\"event_data\": {\"AlertType\": \"X\", \"kind\": \"Phish\"}}")));
  }

  @Test
  public void envelopeShapesTest() throws Exception {
    assertEquals(
        "test_alert", classifier.classify(event("{\"data\": {\"AlertType\": \"TestAlert\"}}")));
    assertEquals(
        "test_alert",
        classifier.classify(event("{\"data\": {\"event_data\": {\"AlertType\": \"TestAlert\"}}}")));
  }

  @Test
  public void unrecognizedTest() throws Exception {
    assertEquals("generic", classifier.classify(event("{\"AlertType\": \"TestAlert\"}")));
    assertEquals("generic", classifier.classify(event("{\"event_data\": \"string\"}")));
    assertEquals("generic", classifier.classify(event("{}")));
    assertEquals("generic", classifier.classify((Map<String, Object>) null));
  }

  @Test
  public void envelopeUnwrapTest() throws Exception {
    ProviderEnvelope env = ProviderEnvelope.unwrap(event("{\"event_data\": {\"id\": 1}}"));
    assertEquals(ProviderEnvelope.Kind.EVENT_DATA, env.getKind());
    assertTrue(env.isRecognized());
    assertEquals(1, env.getPayload().get("id"));

    env = ProviderEnvelope.unwrap(event("{\"data\": {\"event_data\": {\"id\": 2}}}"));
    assertEquals(ProviderEnvelope.Kind.DATA_EVENT_DATA, env.getKind());
    assertEquals(2, env.getPayload().get("id"));

    env = ProviderEnvelope.unwrap(event("{\"data\": {\"id\": 3}}"));
    assertEquals(ProviderEnvelope.Kind.DATA, env.getKind());

    env = ProviderEnvelope.unwrap(event("{\"other\": {\"id\": 3}}"));
    assertEquals(ProviderEnvelope.Kind.UNRECOGNIZED, env.getKind());
    assertFalse(env.isRecognized());
    assertTrue(env.getPayload().isEmpty());
  }

  @Test
  public void nestedValueResolverTest() throws Exception {
    Map<String, Object> e =
        event("{\"a\": {\"b\": [{\"c\": \"x\"}, {\"c\": \"y\"}], \"e\": \"\", \"n\": 5}}");
    assertEquals("y", NestedValueResolver.resolve(e, "a.b[1].c"));
    assertNull(NestedValueResolver.resolve(e, "a.b[5].c"));
    assertNull(NestedValueResolver.resolve(e, "a.missing"));
    assertTrue(NestedValueResolver.isPresent(e, "a.b"));
    assertFalse(NestedValueResolver.isPresent(e, "a.e"));
    assertTrue(NestedValueResolver.isPresent(e, "a"));
    assertFalse(NestedValueResolver.hasValue(e, "a.e"));
    assertFalse(NestedValueResolver.hasValue(e, "missing"));
    assertTrue(NestedValueResolver.hasValue(e, "a.n"));
    assertEquals("5", NestedValueResolver.resolveString(e, "a.n"));
  }
}
