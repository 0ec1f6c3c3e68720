package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.enums.PipelineMode;

/**
 * Outcome of indexing document chunks.
 *
 * @param duplicateChunks chunks the index already held from an earlier or concurrent run
 * @param skipped true for the placeholder recorded when the mode does not vectorize
 */
public record VectorizationResult(
    String collection,
    int documentsProcessed,
    int totalChunks,
    int duplicateChunks,
    PipelineMode mode,
    String message,
    boolean skipped)
    implements StageResult {

  static final String SKIP_MESSAGE =
      "Vectorización omitida - usando extracción directa desde OCR";

  public static String collectionFor(String company) {
    return "legal_" + company;
  }

  public static VectorizationResult skipped(String company, PipelineMode mode) {
    return new VectorizationResult(collectionFor(company), 0, 0, 0, mode, SKIP_MESSAGE, true);
  }
}
