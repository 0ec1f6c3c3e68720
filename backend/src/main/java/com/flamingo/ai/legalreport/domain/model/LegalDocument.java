package com.flamingo.ai.legalreport.domain.model;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * One legal document of a company. Immutable: stages derive new copies through {@link
 * #toBuilder()} and store them back into a new {@link DocumentArena}.
 *
 * @param index stable position in the arena; every other record refers to documents by it
 * @param classification null until classified, and null for documents no rule recognised
 * @param structuredFields extracted field values keyed by report field name; values may be null
 */
@Builder(toBuilder = true)
public record LegalDocument(
    int index,
    String filename,
    Path sourcePath,
    String rawText,
    List<LocalDate> extractedDates,
    LocalDate primaryDate,
    DocumentClassification classification,
    boolean modification,
    Map<String, Object> structuredFields) {

  public LegalDocument {
    extractedDates = extractedDates == null ? List.of() : List.copyOf(extractedDates);
    structuredFields =
        structuredFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(structuredFields));
    rawText = rawText == null ? "" : rawText;
  }

  public boolean isClassified() {
    return classification != null;
  }

  public boolean hasStructuredFields() {
    return !structuredFields.isEmpty();
  }

  public Object field(String key) {
    return structuredFields.get(key);
  }
}
