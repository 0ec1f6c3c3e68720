package com.flamingo.ai.legalreport.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.legalreport.domain.enums.RunStatus;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.enums.StageStatus;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.List;

/** Contents of {@code {company}_run_summary.json}, written at the end of every run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
    String company,
    RunStatus status,
    String mode,
    String startedAt,
    String finishedAt,
    List<StageEntry> stages,
    StageFailure failure,
    List<PipelineWarning> warnings) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record StageEntry(StageName stage, StageStatus status, Long durationMs) {}
}
