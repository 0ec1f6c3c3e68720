package com.flamingo.ai.legalreport.service.ocr;

import java.nio.file.Path;

/** Turns a source document into plain text. */
public interface OcrService {

  /**
   * Extracts the text of a document.
   *
   * @param document path to the PDF
   * @return the extracted text, possibly empty for image-only pages the backend cannot read
   * @throws com.flamingo.ai.legalreport.exception.InputDocumentException if the file is unreadable
   */
  String extractText(Path document);
}
