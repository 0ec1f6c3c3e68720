package com.flamingo.ai.legalreport.service.extraction;

import com.flamingo.ai.legalreport.domain.enums.LegalField;
import com.flamingo.ai.legalreport.domain.enums.ValueKind;
import java.util.List;
import java.util.stream.Collectors;

/** The set of fields a structured extraction call must return. */
public record ExtractionSchema(String name, List<FieldSpec> fields) {

  public record FieldSpec(String key, ValueKind kind, String description) {}

  public ExtractionSchema {
    fields = List.copyOf(fields);
  }

  /** Every report field that is read from document text. */
  public static ExtractionSchema legalFacts() {
    return new ExtractionSchema(
        "antecedentes_legales",
        LegalField.extractable().stream()
            .map(f -> new FieldSpec(f.key(), f.kind(), f.extractionHint()))
            .toList());
  }

  public List<String> keys() {
    return fields.stream().map(FieldSpec::key).toList();
  }

  /** Prompt-ready description, one field per line. */
  public String describe() {
    return fields.stream()
        .map(f -> "- " + f.key() + " (" + typeLabel(f.kind()) + "): " + f.description())
        .collect(Collectors.joining("\n"));
  }

  private static String typeLabel(ValueKind kind) {
    return switch (kind) {
      case TEXT -> "texto";
      case MONEY -> "monto con moneda";
      case LIST -> "lista de textos";
    };
  }
}
