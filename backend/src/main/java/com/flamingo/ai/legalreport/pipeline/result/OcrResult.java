package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import java.util.Optional;

/** Documents with their raw text; {@code cachedDocuments} were served from the OCR cache. */
public record OcrResult(DocumentArena arena, int cachedDocuments) implements StageResult {

  @Override
  public Optional<DocumentArena> updatedArena() {
    return Optional.of(arena);
  }
}
