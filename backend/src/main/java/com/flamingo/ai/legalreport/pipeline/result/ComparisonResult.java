package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.Comparison;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Consecutive-version comparisons per group, plus pairs that could not be compared. */
public record ComparisonResult(
    Map<DocumentClassification, List<Comparison>> comparisons, List<PipelineWarning> warnings)
    implements StageResult {

  public ComparisonResult {
    EnumMap<DocumentClassification, List<Comparison>> copy =
        new EnumMap<>(DocumentClassification.class);
    for (DocumentClassification group : DocumentClassification.values()) {
      copy.put(group, List.copyOf(comparisons.getOrDefault(group, List.of())));
    }
    comparisons = Collections.unmodifiableMap(copy);
    warnings = List.copyOf(warnings);
  }

  public List<Comparison> group(DocumentClassification classification) {
    return comparisons.get(classification);
  }
}
