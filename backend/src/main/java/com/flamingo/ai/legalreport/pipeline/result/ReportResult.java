package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.LegalReport;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.List;

/** The consolidated report and the fields that could not be resolved. */
public record ReportResult(LegalReport report, List<PipelineWarning> warnings)
    implements StageResult {

  public ReportResult {
    warnings = List.copyOf(warnings);
  }
}
