package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import java.util.Optional;
import java.util.Set;

/** One transformation of a company's {@link ProcessingState}. */
public interface PipelineStage {

  StageName name();

  /** Stages that must have completed or been skipped before this one runs. */
  Set<StageName> predecessors();

  /**
   * Returns a placeholder result when the stage does not apply to this run. The controller records
   * the placeholder instead of calling {@link #execute}.
   */
  default Optional<StageResult> skipResult(ProcessingState state) {
    return Optional.empty();
  }

  /**
   * Runs the stage. Must not mutate {@code state}; the controller records the returned result.
   *
   * @throws com.flamingo.ai.legalreport.exception.PipelineException on a stage-fatal failure
   */
  StageResult execute(ProcessingState state);
}
