package com.flamingo.ai.legalreport.domain.model;

import com.flamingo.ai.legalreport.domain.enums.ChangeCategory;

/** A single field that differs between two consecutive versions. */
public record FieldChange(
    String field, Object oldValue, Object newValue, ChangeCategory category, String statement) {}
