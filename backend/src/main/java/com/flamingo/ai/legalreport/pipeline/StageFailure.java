package com.flamingo.ai.legalreport.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.legalreport.domain.enums.StageName;

/** Why and where a run stopped. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageFailure(StageName stage, String document, String errorType, String reason) {}
