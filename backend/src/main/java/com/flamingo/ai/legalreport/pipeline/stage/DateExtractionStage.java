package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.DateExtractionResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.service.extraction.DateExtractionService;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Finds the dates of every document and picks each one's primary date. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DateExtractionStage implements PipelineStage {

  private final DateExtractionService dateExtractionService;

  @Override
  public StageName name() {
    return StageName.DATE_EXTRACTION;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.OCR);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    DocumentArena arena =
        state
            .arena()
            .map(
                document -> {
                  try {
                    List<LocalDate> dates = dateExtractionService.extractDates(document.rawText());
                    LocalDate primary = dateExtractionService.choosePrimaryDate(document, dates);
                    log.debug(
                        "{}: {} dates, primary {}", document.filename(), dates.size(), primary);
                    return document.toBuilder().extractedDates(dates).primaryDate(primary).build();
                  } catch (PipelineException e) {
                    throw e.withContext(state.company(), name(), document.filename());
                  }
                });
    return new DateExtractionResult(arena);
  }
}
