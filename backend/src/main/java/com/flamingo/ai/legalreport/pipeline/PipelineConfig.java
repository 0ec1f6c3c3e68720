package com.flamingo.ai.legalreport.pipeline;

import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Assembles the stage graph from every {@link PipelineStage} bean. */
@Configuration
public class PipelineConfig {

  @Bean
  public StageGraph stageGraph(List<PipelineStage> stages) {
    return new StageGraph(stages);
  }
}
