package com.cloudsec.transformer;

import com.cloudsec.transformer.classify.EventClassifier;
import com.cloudsec.transformer.classify.ProviderEnvelope;
import com.cloudsec.transformer.jsonpath.JsonPathExtractor;
import com.cloudsec.transformer.mapping.EventTypeMapping;
import com.cloudsec.transformer.mapping.MappingRegistry;
import com.cloudsec.transformer.ocsf.OcsfValidationResult;
import com.cloudsec.transformer.ocsf.OcsfValidator;
import com.cloudsec.transformer.output.OutputFormat;
import com.cloudsec.transformer.output.OutputPostProcessor;
import com.cloudsec.transformer.output.TransformedEvent;
import com.cloudsec.transformer.template.TemplateDefinition;
import com.cloudsec.transformer.template.TemplateLoadException;
import com.cloudsec.transformer.template.TemplateLoader;
import com.cloudsec.transformer.template.TemplateRenderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms raw cloud security events into CloudTrail, OCSF or ASFF output
 *
 * <p>An event is classified against the mapping registry, the template for the event type and
 * output format is loaded, extractor expressions are evaluated against the provider payload and
 * the template is rendered and finished for the format. No exception escapes {@link
 * #transform}; every failure becomes a {@link TransformOutcome}.
 *
 * <p>One instance owns its template and expression caches and may be shared between threads.
 */
public class EventTransformer {
  private final Logger log = LoggerFactory.getLogger(EventTransformer.class);

  private final TransformerCfg cfg;
  private final MappingRegistry registry;
  private final EventClassifier classifier;
  private final TemplateLoader loader;
  private final JsonPathExtractor extractor;
  private final OutputPostProcessor postProcessor;
  private final OcsfValidator ocsfValidator;
  private final ObjectMapper mapper;

  /**
   * Classify a raw event
   *
   * @param event Raw event
   * @return Event type
   */
  public String classify(Map<String, Object> event) {
    return classifier.classify(event);
  }

  /**
   * Test if an event has the minimum structure required for mapping
   *
   * <p>The event must carry an event_data object containing one of id, SystemAlertId or name.
   *
   * @param event Raw event
   * @return boolean
   */
  public boolean validateCloudEvent(Map<String, Object> event) {
    Object data = event == null ? null : event.get("event_data");
    if (!(data instanceof Map)) {
      log.warn("cloud event missing event_data field");
      return false;
    }
    Map<?, ?> m = (Map<?, ?>) data;
    if (!m.containsKey("id") && !m.containsKey("SystemAlertId") && !m.containsKey("name")) {
      log.warn("cloud event missing basic identifier fields");
      return false;
    }
    return true;
  }

  /**
   * Build the render context for an event
   *
   * @param event Raw event
   * @param extracted Extracted values
   * @param accountId Recipient account id
   * @param eventType Event type
   * @return Context map
   */
  public Map<String, Object> buildContext(
      Map<String, Object> event,
      Map<String, Object> extracted,
      String accountId,
      String eventType) {
    HashMap<String, Object> ctx = new HashMap<>();
    EventTypeMapping m = registry.get(eventType);
    ctx.put("extractors", extracted);
    ctx.put("config", m == null ? Collections.<String, Object>emptyMap() : m.toMap());
    ctx.put("account_id", accountId);
    ctx.put("aws_account_id", accountId);
    ctx.put("region", cfg.getRegion());
    ctx.put("aws_region", cfg.getRegion());
    ctx.put("event_type", eventType);
    ctx.put("timestamp", ISODateTimeFormat.dateTime().print(new DateTime(DateTimeZone.UTC)));
    ctx.put("azure_event", event);
    ctx.put("gcp_event", event);
    ctx.put("event", event);
    return ctx;
  }

  private Map<String, Object> extractionDocument(Map<String, Object> event) {
    ProviderEnvelope env = ProviderEnvelope.unwrap(event);
    return env.isRecognized() ? env.getPayload() : event;
  }

  /**
   * Classify and transform an event
   *
   * @param event Raw event
   * @param accountId Recipient account id
   * @param format Output format
   * @return TransformOutcome
   */
  public TransformOutcome transform(
      Map<String, Object> event, String accountId, OutputFormat format) {
    return transform(event, accountId, classify(event), format);
  }

  /**
   * Transform an event already classified as the given event type
   *
   * @param event Raw event
   * @param accountId Recipient account id
   * @param eventType Event type
   * @param format Output format
   * @return TransformOutcome
   */
  public TransformOutcome transform(
      Map<String, Object> event, String accountId, String eventType, OutputFormat format) {
    if (loader.isDisabled(eventType, format)) {
      log.debug("{} output disabled for event type {}", format, eventType);
      return TransformOutcome.disabled(eventType, format);
    }

    TemplateDefinition t;
    try {
      t = loader.loadTemplate(eventType, format);
    } catch (TemplateLoadException exc) {
      log.warn("template load failed for {} ({}): {}", eventType, format, exc.getMessage());
      return TransformOutcome.failed(eventType, format, exc.getMessage());
    }
    if (t == null) {
      return TransformOutcome.missing(eventType, format);
    }

    Map<String, Object> extracted =
        extractor.extractAll(extractionDocument(event), t.getExtractors());
    String rendered;
    try {
      rendered = t.render(buildContext(event, extracted, accountId, eventType));
    } catch (TemplateRenderException exc) {
      log.warn("template render failed for {} ({}): {}", eventType, format, exc.getMessage());
      return TransformOutcome.failed(eventType, format, exc.getMessage());
    }

    Map<String, Object> parsed;
    try {
      parsed = mapper.readValue(rendered, new TypeReference<Map<String, Object>>() {});
    } catch (IOException exc) {
      log.warn(
          "rendered {} template for {} is not a JSON object: {}",
          format,
          eventType,
          exc.getMessage());
      return TransformOutcome.failed(
          eventType, format, "rendered template is not a JSON object: " + exc.getMessage());
    }
    if (parsed == null) {
      return TransformOutcome.failed(eventType, format, "rendered template is empty");
    }

    OcsfValidationResult ocsf = null;
    if (format == OutputFormat.OCSF) {
      ocsf = ocsfValidator.validate(parsed);
      for (String w : ocsf.getWarnings()) {
        log.debug("OCSF warning for {}: {}", eventType, w);
      }
      if (!ocsf.isValid()) {
        if (cfg.getEnforceOcsfValidation()) {
          return TransformOutcome.failed(
                  eventType,
                  format,
                  "OCSF validation failed: " + String.join("; ", ocsf.getErrors()))
              .withOcsfValidation(ocsf);
        }
        log.warn("OCSF validation errors for {}: {}", eventType, ocsf.getErrors());
      }
    }

    TransformedEvent out;
    try {
      out = postProcessor.finish(format, parsed);
    } catch (JsonProcessingException exc) {
      return TransformOutcome.failed(eventType, format, exc.getMessage());
    }
    return TransformOutcome.success(eventType, format, out).withOcsfValidation(ocsf);
  }

  /**
   * Transform an event, returning only the output
   *
   * @param event Raw event
   * @param accountId Recipient account id
   * @param eventType Event type
   * @param format Output format
   * @return Output, or null if disabled, missing or failed
   */
  public TransformedEvent map(
      Map<String, Object> event, String accountId, String eventType, OutputFormat format) {
    return transform(event, accountId, eventType, format).getOutput();
  }

  /**
   * Classify and transform an event, returning only the output
   *
   * @param event Raw event
   * @param accountId Recipient account id
   * @param format Output format
   * @return Output, or null if disabled, missing or failed
   */
  public TransformedEvent map(Map<String, Object> event, String accountId, OutputFormat format) {
    return transform(event, accountId, format).getOutput();
  }

  /**
   * Transform a batch of events
   *
   * @param events Raw events
   * @param accountId Recipient account id
   * @param format Output format
   * @return Outcomes in event order
   */
  public List<TransformOutcome> transformBatch(
      List<Map<String, Object>> events, String accountId, OutputFormat format) {
    ArrayList<TransformOutcome> ret = new ArrayList<>();
    int ok = 0;
    for (Map<String, Object> e : events) {
      TransformOutcome o = transform(e, accountId, format);
      if (o.isSuccess()) {
        ok++;
      }
      ret.add(o);
    }
    log.info("transformed {} of {} events to {}", ok, events.size(), format);
    return ret;
  }

  public MappingRegistry getRegistry() {
    return registry;
  }

  public TemplateLoader getTemplateLoader() {
    return loader;
  }

  public JsonPathExtractor getExtractor() {
    return extractor;
  }

  public OcsfValidator getOcsfValidator() {
    return ocsfValidator;
  }

  public TransformerCfg getCfg() {
    return cfg;
  }

  /**
   * Create transformer with an already loaded registry
   *
   * @param cfg Configuration
   * @param registry Mapping registry
   * @throws IOException if the OCSF class dictionary cannot be read
   */
  public EventTransformer(TransformerCfg cfg, MappingRegistry registry) throws IOException {
    this.cfg = cfg;
    this.registry = registry;
    classifier = new EventClassifier(registry);
    loader = new TemplateLoader(cfg.getTemplateDirectory(), registry);
    extractor = new JsonPathExtractor(cfg.getExtractorCacheSize());
    postProcessor = new OutputPostProcessor();
    ocsfValidator = new OcsfValidator();
    mapper = new ObjectMapper();
  }

  /**
   * Create transformer, loading the mapping registry named by the configuration
   *
   * @param cfg Configuration
   * @throws IOException if the mapping registry or OCSF class dictionary cannot be read
   */
  public EventTransformer(TransformerCfg cfg) throws IOException {
    this(cfg, MappingRegistry.load(cfg.getMappingPath()));
  }
}
