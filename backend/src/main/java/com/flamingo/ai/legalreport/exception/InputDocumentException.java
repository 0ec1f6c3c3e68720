package com.flamingo.ai.legalreport.exception;

import com.flamingo.ai.legalreport.domain.enums.StageName;

/** Thrown when input documents are missing, unreadable or not usable. Never retried. */
public class InputDocumentException extends PipelineException {

  public InputDocumentException(String company, String document, String message) {
    super(company, null, document, message, "Input document could not be read");
  }

  public InputDocumentException(
      String company, StageName stage, String document, String message, Throwable cause) {
    super(company, stage, document, message, "Input document could not be read", cause);
  }
}
