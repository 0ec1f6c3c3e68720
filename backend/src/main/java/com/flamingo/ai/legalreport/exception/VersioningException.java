package com.flamingo.ai.legalreport.exception;

import com.flamingo.ai.legalreport.domain.enums.StageName;

/** Thrown when documents cannot be placed in a version lineage. */
public class VersioningException extends PipelineException {

  public VersioningException(String document, String message) {
    super(null, StageName.VERSIONING, document, message, "Documents could not be versioned");
  }
}
