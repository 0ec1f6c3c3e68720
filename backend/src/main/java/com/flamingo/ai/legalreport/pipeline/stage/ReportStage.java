package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.LegalizationResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import com.flamingo.ai.legalreport.service.report.ReportAggregator;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReportStage implements PipelineStage {

  private final ReportAggregator reportAggregator;

  @Override
  public StageName name() {
    return StageName.REPORT;
  }

  /** Comparison is a predecessor so the report is only built once every pair has been checked. */
  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.VERSIONING, StageName.COMPARISON, StageName.LEGALIZATION);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    return reportAggregator.aggregate(
        state.arena(),
        state.require(StageName.VERSIONING, VersioningResult.class),
        state.require(StageName.LEGALIZATION, LegalizationResult.class));
  }
}
