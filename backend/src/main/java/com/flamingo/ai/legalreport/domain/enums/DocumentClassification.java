package com.flamingo.ai.legalreport.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Legal document groups. Declaration order is the provenance priority used when the same field is
 * resolved from more than one group.
 */
public enum DocumentClassification {
  ESCRITURA_PUBLICA("escritura_publica"),
  INSCRIPCION_CBR("inscripcion_cbr"),
  PUBLICACION_DIARIO_OFICIAL("publicacion_diario_oficial");

  private final String label;

  DocumentClassification(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Lower value wins when two groups provide the same field. */
  public int priority() {
    return ordinal();
  }

  public static Optional<DocumentClassification> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String trimmed = label.trim().toLowerCase();
    return Arrays.stream(values()).filter(c -> c.label.equals(trimmed)).findFirst();
  }
}
