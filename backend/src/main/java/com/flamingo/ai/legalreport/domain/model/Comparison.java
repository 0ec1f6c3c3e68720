package com.flamingo.ai.legalreport.domain.model;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import java.util.List;

/** Field-level diff between version {@code fromVersion} and the next version of one group. */
public record Comparison(
    DocumentClassification group,
    int fromVersion,
    int toVersion,
    int sourceDocA,
    int sourceDocB,
    List<FieldChange> changes,
    List<String> narrative,
    String summary) {

  public Comparison {
    if (toVersion != fromVersion + 1) {
      throw new IllegalArgumentException(
          "Comparisons are only between consecutive versions: " + fromVersion + " -> " + toVersion);
    }
    changes = List.copyOf(changes);
    narrative = List.copyOf(narrative);
  }

  public boolean hasChanges() {
    return !changes.isEmpty();
  }
}
