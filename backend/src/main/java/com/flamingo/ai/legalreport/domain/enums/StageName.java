package com.flamingo.ai.legalreport.domain.enums;

/** Pipeline stages in canonical order. The ordinal breaks ties in the stage graph. */
public enum StageName {
  OCR("ocr"),
  DATE_EXTRACTION("date"),
  CLASSIFICATION("classification"),
  VECTORIZATION("vectorization"),
  VERSIONING("versioning"),
  COMPARISON("comparison"),
  LEGALIZATION("legalization"),
  REPORT("report");

  private final String fileKey;

  StageName(String fileKey) {
    this.fileKey = fileKey;
  }

  public String fileKey() {
    return fileKey;
  }

  public String snapshotFileName(String company) {
    return company + "_" + fileKey + "_results.json";
  }
}
