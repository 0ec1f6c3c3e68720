package com.flamingo.ai.legalreport.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** How the pipeline sources document text and whether it builds the vector index. */
public enum PipelineMode {
  OCR_DIRECT("OCR_DIRECTO"),
  NO_VECTORIZATION("SIN_VECTORIZACION"),
  VECTORIZED("VECTORIZADO");

  private final String label;

  PipelineMode(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean vectorizes() {
    return this == VECTORIZED;
  }

  /**
   * Resolves the effective mode. An explicit mode wins; otherwise the extract-from-OCR flag picks
   * between the two non-vectorizing modes.
   */
  public static PipelineMode resolve(PipelineMode explicitMode, boolean extractFromOcr) {
    if (explicitMode != null) {
      return explicitMode;
    }
    return extractFromOcr ? OCR_DIRECT : NO_VECTORIZATION;
  }
}
