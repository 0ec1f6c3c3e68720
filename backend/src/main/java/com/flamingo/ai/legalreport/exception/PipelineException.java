package com.flamingo.ai.legalreport.exception;

import com.flamingo.ai.legalreport.domain.enums.StageName;

/**
 * Base class for pipeline failures. Carries the company, stage and document in which the failure
 * happened. Context the thrower did not know is filled in on the way up through {@link
 * #withContext}.
 */
public class PipelineException extends RuntimeException {

  private String company;
  private StageName stage;
  private String document;
  private final String userMessage;

  public PipelineException(
      String company, StageName stage, String document, String message, String userMessage) {
    super(message);
    this.company = company;
    this.stage = stage;
    this.document = document;
    this.userMessage = userMessage;
  }

  public PipelineException(
      String company,
      StageName stage,
      String document,
      String message,
      String userMessage,
      Throwable cause) {
    super(message, cause);
    this.company = company;
    this.stage = stage;
    this.document = document;
    this.userMessage = userMessage;
  }

  public String getCompany() {
    return company;
  }

  public StageName getStage() {
    return stage;
  }

  public String getDocument() {
    return document;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** Fills in whichever of company, stage and document are still unknown. */
  public PipelineException withContext(String company, StageName stage, String document) {
    if (this.company == null) {
      this.company = company;
    }
    if (this.stage == null) {
      this.stage = stage;
    }
    if (this.document == null) {
      this.document = document;
    }
    return this;
  }
}
