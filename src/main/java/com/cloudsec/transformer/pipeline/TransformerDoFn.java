package com.cloudsec.transformer.pipeline;

import com.cloudsec.transformer.EventBatchSplitter;
import com.cloudsec.transformer.EventTransformer;
import com.cloudsec.transformer.MalformedJsonRepair;
import com.cloudsec.transformer.TransformOutcome;
import com.cloudsec.transformer.TransformerCfg;
import com.cloudsec.transformer.output.OutputFormat;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.TupleTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DoFn} transforming raw cloud event messages into the configured output format
 *
 * <p>Each input element is a message body which may hold one event or a batch of events.
 * Successfully transformed events are emitted as JSON on {@link #TRANSFORMED}. Messages that
 * cannot be parsed, and events whose transformation failed, are emitted on {@link #FAILED}.
 * Events whose format is disabled or has no template produce no output.
 */
public class TransformerDoFn extends DoFn<String, String> {
  private static final long serialVersionUID = 1L;

  /** Transformed events */
  public static final TupleTag<String> TRANSFORMED = new TupleTag<String>() {};

  /** Unparseable messages and failed events */
  public static final TupleTag<String> FAILED = new TupleTag<String>() {};

  private final TransformerCfg cfg;
  private final String accountId;
  private final String formatName;

  private Logger log;
  private transient EventTransformer transformer;
  private transient OutputFormat format;

  @Setup
  public void setup() throws IOException {
    log = LoggerFactory.getLogger(TransformerDoFn.class);
    format = OutputFormat.fromName(formatName);
    transformer = new EventTransformer(cfg);
    log.info(
        "initialized transformer, {} event types, output format {}",
        transformer.getRegistry().getSupportedEventTypes().size(),
        format);
  }

  @ProcessElement
  public void processElement(ProcessContext c) {
    Object body = MalformedJsonRepair.parse(c.element());
    if (body == null) {
      log.error("dropping unparseable message to dead letter output");
      c.output(FAILED, c.element());
      return;
    }
    List<Map<String, Object>> events = EventBatchSplitter.split(body);
    if (events.isEmpty()) {
      log.warn("message contained no events");
      return;
    }
    for (TransformOutcome o : transformer.transformBatch(events, accountId, format)) {
      switch (o.getStatus()) {
        case SUCCESS:
          String json = o.getOutput().toJSON();
          if (json != null) {
            c.output(json);
          } else {
            c.output(FAILED, c.element());
          }
          break;
        case FAILED:
          log.warn("transformation of {} event failed: {}", o.getEventType(), o.getReason());
          c.output(FAILED, c.element());
          break;
        default:
          break;
      }
    }
  }

  /**
   * Create new TransformerDoFn
   *
   * @param cfg Transformer configuration
   * @param accountId Recipient account id
   * @param format Output format
   */
  public TransformerDoFn(TransformerCfg cfg, String accountId, OutputFormat format) {
    this.cfg = cfg;
    this.accountId = accountId;
    this.formatName = format.getName();
  }
}
