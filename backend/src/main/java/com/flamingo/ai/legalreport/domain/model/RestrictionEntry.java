package com.flamingo.ai.legalreport.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;

/** One restriction on the administration, attributed to the document that states it. */
@JsonPropertyOrder({"descripcion", "documento", "version", "clasificacion"})
public record RestrictionEntry(
    @JsonProperty("descripcion") String description,
    @JsonProperty("documento") String document,
    @JsonProperty("version") int version,
    @JsonProperty("clasificacion") DocumentClassification classification) {}
