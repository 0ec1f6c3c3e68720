package com.flamingo.ai.legalreport.domain.enums;

/** Status of a single stage within one company run. */
public enum StageStatus {
  NOT_STARTED,
  RUNNING,
  COMPLETED,
  SKIPPED,
  FAILED
}
