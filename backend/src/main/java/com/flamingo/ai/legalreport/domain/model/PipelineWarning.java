package com.flamingo.ai.legalreport.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.enums.WarningType;

/** A local, non-fatal problem. Recorded on the run and never aborts a stage. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineWarning(
    WarningType type, StageName stage, String document, String field, String message) {

  public static PipelineWarning extractionError(String document, String message) {
    return new PipelineWarning(
        WarningType.EXTRACTION_ERROR, StageName.CLASSIFICATION, document, null, message);
  }

  public static PipelineWarning comparisonError(String pair, String message) {
    return new PipelineWarning(
        WarningType.COMPARISON_ERROR, StageName.COMPARISON, pair, null, message);
  }

  public static PipelineWarning reportError(String field, String message) {
    return new PipelineWarning(WarningType.REPORT_ERROR, StageName.REPORT, null, field, message);
  }
}
