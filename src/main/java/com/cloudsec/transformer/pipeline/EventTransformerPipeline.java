package com.cloudsec.transformer.pipeline;

import com.cloudsec.transformer.TransformerCfg;
import com.cloudsec.transformer.TransformerOptions;
import com.cloudsec.transformer.output.OutputFormat;
import java.io.IOException;
import java.io.Serializable;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.options.Validation;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.TupleTagList;

/**
 * Batch pipeline reading newline delimited cloud event messages and writing transformed events
 *
 * <p>Each input line is one message body. Transformed events are written one JSON document per
 * line. If a failure output is configured, unparseable messages and failed events are written
 * there.
 */
public class EventTransformerPipeline implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Runtime options for {@link EventTransformerPipeline} */
  public interface EventTransformerPipelineOptions extends TransformerOptions {
    @Description("Read messages from file; resource path, gcs path, or file system path")
    @Validation.Required
    String getInputFile();

    void setInputFile(String value);

    @Description("Write transformed events to file prefix")
    @Validation.Required
    String getOutputFile();

    void setOutputFile(String value);

    @Description("Write failed messages to file prefix")
    String getFailedOutputFile();

    void setFailedOutputFile(String value);
  }

  /** Transform raw message bodies into transformed events and failures */
  public static class TransformEvents extends PTransform<PCollection<String>, PCollectionTuple> {
    private static final long serialVersionUID = 1L;

    private final TransformerCfg cfg;
    private final String accountId;
    private final OutputFormat format;

    /**
     * Create transform from pipeline options
     *
     * @param options Pipeline options
     */
    public TransformEvents(TransformerOptions options) {
      cfg = TransformerCfg.fromTransformerOptions(options);
      accountId = options.getAccountId();
      format = OutputFormat.fromName(options.getOutputFormat());
    }

    @Override
    public PCollectionTuple expand(PCollection<String> input) {
      return input.apply(
          "transform events",
          ParDo.of(new TransformerDoFn(cfg, accountId, format))
              .withOutputTags(
                  TransformerDoFn.TRANSFORMED, TupleTagList.of(TransformerDoFn.FAILED)));
    }
  }

  /**
   * Build the pipeline
   *
   * @param p Pipeline
   * @param options Pipeline options
   */
  public static void buildPipeline(Pipeline p, EventTransformerPipelineOptions options) {
    PCollectionTuple results =
        p.apply("input", TextIO.read().from(options.getInputFile()))
            .apply("transform", new TransformEvents(options));

    results
        .get(TransformerDoFn.TRANSFORMED)
        .apply("output", TextIO.write().to(options.getOutputFile()));
    if (options.getFailedOutputFile() != null) {
      results
          .get(TransformerDoFn.FAILED)
          .apply("failed output", TextIO.write().to(options.getFailedOutputFile()));
    }
  }

  private static void runPipeline(EventTransformerPipelineOptions options) {
    Pipeline p = Pipeline.create(options);
    buildPipeline(p, options);
    p.run();
  }

  /**
   * Entry point for Beam pipeline.
   *
   * @param args Runtime arguments.
   * @throws IOException IOException
   */
  public static void main(String[] args) throws IOException {
    PipelineOptionsFactory.register(EventTransformerPipelineOptions.class);
    EventTransformerPipelineOptions options =
        PipelineOptionsFactory.fromArgs(args)
            .withValidation()
            .as(EventTransformerPipelineOptions.class);
    runPipeline(options);
  }
}
