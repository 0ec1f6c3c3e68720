package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.List;
import java.util.Optional;

/** Typed output of one pipeline stage. */
public sealed interface StageResult
    permits OcrResult,
        DateExtractionResult,
        ClassificationResult,
        VectorizationResult,
        VersioningResult,
        ComparisonResult,
        LegalizationResult,
        ReportResult {

  /** Local problems the stage recorded without failing. */
  default List<PipelineWarning> warnings() {
    return List.of();
  }

  /** The new document arena, for stages that derive new document copies. */
  default Optional<DocumentArena> updatedArena() {
    return Optional.empty();
  }
}
