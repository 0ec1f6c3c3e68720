package com.flamingo.ai.legalreport.service.extraction;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;

/**
 * Result of classifying one document.
 *
 * @param classification null when no rule recognised the document
 * @param modification whether the document amends an existing company
 * @param source which classifier produced the label: {@code llm}, {@code keywords} or {@code none}
 */
public record ClassificationOutcome(
    DocumentClassification classification, boolean modification, String source) {

  public static ClassificationOutcome unclassified(boolean modification) {
    return new ClassificationOutcome(null, modification, "none");
  }
}
