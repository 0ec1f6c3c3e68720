package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import java.util.Optional;

/** Documents with their extracted and primary dates. */
public record DateExtractionResult(DocumentArena arena) implements StageResult {

  @Override
  public Optional<DocumentArena> updatedArena() {
    return Optional.of(arena);
  }
}
