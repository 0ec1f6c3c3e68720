package com.flamingo.ai.legalreport.domain.enums;

/** Shape of an extracted value, which drives normalized comparison. */
public enum ValueKind {
  TEXT,
  MONEY,
  LIST
}
