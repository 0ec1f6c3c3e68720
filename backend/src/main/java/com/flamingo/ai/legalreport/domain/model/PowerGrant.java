package com.flamingo.ai.legalreport.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import lombok.Builder;

/** A catalogued power found in one document, with the fragment that grants it. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "codigo", "nombre", "grupo", "documento", "version", "clasificacion", "actor", "limites",
  "evidencia", "confianza"
})
public record PowerGrant(
    @JsonProperty("codigo") String code,
    @JsonProperty("nombre") String name,
    @JsonProperty("grupo") String group,
    @JsonProperty("documento") String document,
    @JsonProperty("version") int version,
    @JsonProperty("clasificacion") DocumentClassification classification,
    @JsonProperty("actor") String actor,
    @JsonProperty("limites") String limits,
    @JsonProperty("evidencia") String evidence,
    @JsonProperty("confianza") Double confidence) {}
