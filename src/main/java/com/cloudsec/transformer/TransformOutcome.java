package com.cloudsec.transformer;

import com.cloudsec.transformer.ocsf.OcsfValidationResult;
import com.cloudsec.transformer.output.OutputFormat;
import com.cloudsec.transformer.output.TransformedEvent;

/** Result of transforming one event into one output format */
public class TransformOutcome {
  /** Outcome status */
  public enum Status {
    /** Output produced */
    SUCCESS,
    /** Mapping explicitly disables the format for the event type */
    DISABLED,
    /** No template exists for the event type and format */
    MISSING,
    /** Template could not be loaded or rendered, or output was invalid */
    FAILED
  }

  private final Status status;
  private final String eventType;
  private final OutputFormat format;
  private final TransformedEvent output;
  private final String reason;
  private OcsfValidationResult ocsfValidation;

  private TransformOutcome(
      Status status,
      String eventType,
      OutputFormat format,
      TransformedEvent output,
      String reason) {
    this.status = status;
    this.eventType = eventType;
    this.format = format;
    this.output = output;
    this.reason = reason;
  }

  static TransformOutcome success(String eventType, OutputFormat format, TransformedEvent output) {
    return new TransformOutcome(Status.SUCCESS, eventType, format, output, null);
  }

  static TransformOutcome disabled(String eventType, OutputFormat format) {
    return new TransformOutcome(Status.DISABLED, eventType, format, null, null);
  }

  static TransformOutcome missing(String eventType, OutputFormat format) {
    return new TransformOutcome(
        Status.MISSING,
        eventType,
        format,
        null,
        String.format("no %s template found for event type %s", format, eventType));
  }

  static TransformOutcome failed(String eventType, OutputFormat format, String reason) {
    return new TransformOutcome(Status.FAILED, eventType, format, null, reason);
  }

  public Status getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public String getEventType() {
    return eventType;
  }

  public OutputFormat getFormat() {
    return format;
  }

  /**
   * Transformed output
   *
   * @return Output, null unless status is {@link Status#SUCCESS}
   */
  public TransformedEvent getOutput() {
    return output;
  }

  /**
   * Reason for a non-successful outcome
   *
   * @return Reason, or null
   */
  public String getReason() {
    return reason;
  }

  /**
   * OCSF validation result, if validation ran
   *
   * @return Result or null
   */
  public OcsfValidationResult getOcsfValidation() {
    return ocsfValidation;
  }

  TransformOutcome withOcsfValidation(OcsfValidationResult r) {
    ocsfValidation = r;
    return this;
  }

  @Override
  public String toString() {
    return String.format(
        "%s %s (%s)%s", status, eventType, format, reason == null ? "" : ": " + reason);
  }
}
