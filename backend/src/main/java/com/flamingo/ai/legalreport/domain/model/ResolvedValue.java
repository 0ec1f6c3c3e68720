package com.flamingo.ai.legalreport.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;

/** A report value with the document and version it was taken from. */
@JsonPropertyOrder({"valor", "documento", "clasificacion", "version"})
public record ResolvedValue(
    @JsonProperty("valor") Object value,
    @JsonProperty("documento") String sourceDocument,
    @JsonProperty("clasificacion") DocumentClassification classification,
    @JsonProperty("version") Integer version) {

  private static final ResolvedValue MISSING = new ResolvedValue(null, null, null, null);

  public static ResolvedValue missing() {
    return MISSING;
  }

  @JsonIgnore
  public boolean isMissing() {
    return value == null;
  }
}
