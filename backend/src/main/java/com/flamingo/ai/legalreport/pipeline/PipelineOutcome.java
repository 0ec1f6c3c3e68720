package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.model.LegalReport;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.List;

/** Result of a company run. */
public sealed interface PipelineOutcome {

  String company();

  boolean isSuccess();

  record Completed(String company, LegalReport report, List<PipelineWarning> warnings)
      implements PipelineOutcome {

    public Completed {
      warnings = List.copyOf(warnings);
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  record Failed(String company, StageFailure failure) implements PipelineOutcome {

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
