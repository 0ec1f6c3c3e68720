package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.OcrResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.service.ocr.OcrCache;
import com.flamingo.ai.legalreport.service.ocr.OcrService;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.storage.CompanyDocumentSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads every company PDF into the document arena. Any unreadable document fails the run. */
@Component
@RequiredArgsConstructor
@Slf4j
public class OcrStage implements PipelineStage {

  private final CompanyDocumentSource documentSource;
  private final OcrService ocrService;
  private final OcrCache ocrCache;
  private final ExternalCallExecutor externalCallExecutor;

  @Override
  public StageName name() {
    return StageName.OCR;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of();
  }

  @Override
  public StageResult execute(ProcessingState state) {
    List<Path> files = documentSource.listDocuments(state.company());
    List<LegalDocument> documents = new ArrayList<>(files.size());
    int cached = 0;

    for (Path file : files) {
      String filename = file.getFileName().toString();
      if (!Files.isReadable(file)) {
        throw new InputDocumentException(state.company(), filename, "File is not readable");
      }
      String text;
      try {
        Optional<String> hit = ocrCache.lookup(file);
        if (hit.isPresent()) {
          text = hit.get();
          cached++;
        } else {
          text =
              externalCallExecutor.call(
                  ExternalCapability.OCR, filename, () -> ocrService.extractText(file));
          ocrCache.store(file, text);
        }
      } catch (PipelineException e) {
        throw e.withContext(state.company(), StageName.OCR, filename);
      }
      if (text.isBlank()) {
        log.warn("No text extracted from {}", filename);
      }
      documents.add(
          LegalDocument.builder()
              .index(documents.size())
              .filename(filename)
              .sourcePath(file)
              .rawText(text)
              .build());
    }
    log.info("OCR finished: {} documents ({} from cache)", documents.size(), cached);
    return new OcrResult(DocumentArena.of(documents), cached);
  }
}
