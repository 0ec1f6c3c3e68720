package com.flamingo.ai.legalreport.service.legalization;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One catalogued power.
 *
 * @param anchors phrases that must all appear in a fragment for it to be a candidate; a phrase may
 *     list alternatives separated by {@code |}
 */
public record PowerDefinition(
    @JsonProperty("grupo") String group,
    @JsonProperty("codigo") String code,
    @JsonProperty("nombre") String name,
    @JsonProperty("descripcion") String description,
    @JsonProperty("palabras_claves") List<String> keywords,
    @JsonProperty("anclas_obligatorias") List<String> anchors) {

  public PowerDefinition {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    anchors = anchors == null ? List.of() : List.copyOf(anchors);
  }
}
