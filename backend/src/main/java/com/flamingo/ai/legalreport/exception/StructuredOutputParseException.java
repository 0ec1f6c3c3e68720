package com.flamingo.ai.legalreport.exception;

/** Thrown when an extraction model returns output that is not the requested JSON shape. */
public class StructuredOutputParseException extends PipelineException {

  private final String rawOutput;

  public StructuredOutputParseException(String message, String rawOutput, Throwable cause) {
    super(null, null, null, message, "Model returned malformed structured output", cause);
    this.rawOutput = rawOutput;
  }

  public StructuredOutputParseException(String message, String rawOutput) {
    this(message, rawOutput, null);
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
