package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.exception.StructuredOutputParseException;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.ClassificationResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.service.extraction.ClassificationOutcome;
import com.flamingo.ai.legalreport.service.extraction.DocumentClassifier;
import com.flamingo.ai.legalreport.service.extraction.ExtractionSchema;
import com.flamingo.ai.legalreport.service.extraction.StructuredExtractionService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies every document and extracts the structured fields of the classified ones. Field
 * extraction that keeps returning malformed output leaves the document without fields and records
 * an {@code EXTRACTION_ERROR} warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationStage implements PipelineStage {

  private static final ExtractionSchema SCHEMA = ExtractionSchema.legalFacts();

  private final DocumentClassifier documentClassifier;
  private final StructuredExtractionService extractionService;

  @Override
  public StageName name() {
    return StageName.CLASSIFICATION;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.OCR, StageName.DATE_EXTRACTION);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    List<PipelineWarning> warnings = new ArrayList<>();
    List<LegalDocument> classified = new ArrayList<>();

    for (LegalDocument document : state.arena().documents()) {
      try {
        classified.add(classify(document, warnings));
      } catch (PipelineException e) {
        throw e.withContext(state.company(), name(), document.filename());
      }
    }
    return new ClassificationResult(
        state.arena().map(d -> classified.get(d.index())), warnings);
  }

  private LegalDocument classify(LegalDocument document, List<PipelineWarning> warnings) {
    ClassificationOutcome outcome = documentClassifier.classify(document);
    LegalDocument.LegalDocumentBuilder builder =
        document.toBuilder()
            .classification(outcome.classification())
            .modification(outcome.modification());
    if (outcome.classification() == null) {
      log.info("{} matches no supported group, excluded from versioning", document.filename());
      return builder.build();
    }
    log.debug(
        "{} classified as {} by {}",
        document.filename(),
        outcome.classification().label(),
        outcome.source());

    try {
      Map<String, Object> fields = extractionService.extractStructured(document.rawText(), SCHEMA);
      return builder.structuredFields(fields).build();
    } catch (StructuredOutputParseException e) {
      log.warn("Structured extraction failed for {}: {}", document.filename(), e.getMessage());
      warnings.add(PipelineWarning.extractionError(document.filename(), e.getMessage()));
      return builder.structuredFields(Map.of()).build();
    }
  }
}
