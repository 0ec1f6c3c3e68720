package com.flamingo.ai.legalreport.domain.enums;

/** How a report field picks its value when several documents provide one. */
public enum FieldResolution {
  /** Highest version with a non-blank value, then group priority. */
  LATEST,
  /** Lowest version with a non-blank value, then group priority. */
  EARLIEST,
  /** Only the version-1 escritura publica. */
  BASE_ONLY,
  /** Union over every document of every version. */
  CUMULATIVE
}
