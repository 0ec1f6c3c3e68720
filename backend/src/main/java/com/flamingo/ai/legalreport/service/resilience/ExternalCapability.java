package com.flamingo.ai.legalreport.service.resilience;

/** External capabilities, each with its own retry and time limiter instance. */
public enum ExternalCapability {
  OCR("ocr"),
  LLM("llm"),
  EMBEDDING("embedding"),
  VECTOR_STORE("vector-store");

  private final String instanceName;

  ExternalCapability(String instanceName) {
    this.instanceName = instanceName;
  }

  public String instanceName() {
    return instanceName;
  }
}
