package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import com.flamingo.ai.legalreport.service.comparison.ComparisonEngine;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ComparisonStage implements PipelineStage {

  private final ComparisonEngine comparisonEngine;

  @Override
  public StageName name() {
    return StageName.COMPARISON;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.VERSIONING);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    VersioningResult versioning = state.require(StageName.VERSIONING, VersioningResult.class);
    return comparisonEngine.compareAll(state.arena(), versioning);
  }
}
