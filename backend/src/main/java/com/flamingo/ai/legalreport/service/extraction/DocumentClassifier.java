package com.flamingo.ai.legalreport.service.extraction;

import com.flamingo.ai.legalreport.domain.model.LegalDocument;

/** Assigns a document to one of the supported classification groups. */
public interface DocumentClassifier {

  ClassificationOutcome classify(LegalDocument document);
}
