package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.service.versioning.VersioningEngine;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class VersioningStage implements PipelineStage {

  private final VersioningEngine versioningEngine;

  @Override
  public StageName name() {
    return StageName.VERSIONING;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.CLASSIFICATION);
  }

  @Override
  public StageResult execute(ProcessingState state) {
    return versioningEngine.version(state.arena());
  }
}
