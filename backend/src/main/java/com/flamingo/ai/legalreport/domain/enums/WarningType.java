package com.flamingo.ai.legalreport.domain.enums;

/** Local, non-fatal problems recorded during a run. */
public enum WarningType {
  EXTRACTION_ERROR,
  COMPARISON_ERROR,
  REPORT_ERROR
}
