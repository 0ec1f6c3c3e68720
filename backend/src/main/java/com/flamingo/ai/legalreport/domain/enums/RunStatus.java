package com.flamingo.ai.legalreport.domain.enums;

/** Lifecycle of one company run. */
public enum RunStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
