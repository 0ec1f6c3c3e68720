package com.flamingo.ai.legalreport.service.extraction;

import java.util.Map;

/** Extracts structured legal facts from document text. */
public interface StructuredExtractionService {

  /**
   * Extracts the fields of {@code schema} from {@code text}.
   *
   * @return field values keyed by field name, schema fields first; absent facts map to null
   * @throws com.flamingo.ai.legalreport.exception.StructuredOutputParseException if the backend
   *     keeps returning output that is not the requested shape
   */
  Map<String, Object> extractStructured(String text, ExtractionSchema schema);
}
