package com.flamingo.ai.legalreport.exception;

/** Thrown when an OCR, LLM, embedding or vector store call fails after all retries. */
public class ExternalServiceException extends PipelineException {

  private final String capability;

  public ExternalServiceException(String capability, String message, Throwable cause) {
    super(null, null, null, message, "External service unavailable: " + capability, cause);
    this.capability = capability;
  }

  public String getCapability() {
    return capability;
  }
}
