package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.PowerGrant;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.LegalizationResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import com.flamingo.ai.legalreport.service.legalization.PowersExtractionService;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Looks for catalogued powers in every version of every group. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegalizationStage implements PipelineStage {

  private final PowersExtractionService powersExtractionService;

  @Override
  public StageName name() {
    return StageName.LEGALIZATION;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.VERSIONING);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    VersioningResult versioning = state.require(StageName.VERSIONING, VersioningResult.class);
    List<PowerGrant> powers = new ArrayList<>();
    int analyzed = 0;
    for (VersionedDocument version : versioning.all()) {
      LegalDocument document = state.arena().get(version.documentIndex());
      try {
        powers.addAll(powersExtractionService.extractPowers(document, version));
      } catch (PipelineException e) {
        throw e.withContext(state.company(), name(), document.filename());
      }
      analyzed++;
    }
    log.info("Found {} powers in {} documents", powers.size(), analyzed);
    return new LegalizationResult(analyzed, powers);
  }
}
