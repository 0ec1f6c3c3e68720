package com.flamingo.ai.legalreport.domain.model;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import java.time.LocalDate;

/** A document's place in its classification group's version lineage. */
public record VersionedDocument(
    int documentIndex,
    DocumentClassification group,
    int versionNumber,
    LocalDate primaryDate,
    boolean base) {

  public VersionedDocument {
    if (versionNumber < 1) {
      throw new IllegalArgumentException("versionNumber must be >= 1, was " + versionNumber);
    }
    if (base != (versionNumber == 1)) {
      throw new IllegalArgumentException("Only version 1 is the base document");
    }
  }
}
