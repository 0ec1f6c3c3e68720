package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.PipelineMode;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import java.util.List;
import java.util.Map;

/** Builds a {@link ProcessingState} as if the given upstream stages had already run. */
public final class ProcessingStates {

  private ProcessingStates() {}

  public static ProcessingState after(
      String company, PipelineMode mode, Map<StageName, StageResult> upstream) {
    ProcessingState state = new ProcessingState(company, mode, List.of(StageName.values()));
    for (StageName stage : StageName.values()) {
      StageResult result = upstream.get(stage);
      if (result != null) {
        state.record(stage, result);
      }
    }
    return state;
  }
}
