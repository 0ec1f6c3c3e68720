package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.List;
import java.util.Optional;

/** Documents with classification and structured fields. */
public record ClassificationResult(DocumentArena arena, List<PipelineWarning> warnings)
    implements StageResult {

  public ClassificationResult {
    warnings = List.copyOf(warnings);
  }

  @Override
  public Optional<DocumentArena> updatedArena() {
    return Optional.of(arena);
  }
}
