package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Version lineage per classification group. Every group is present, possibly empty. */
public record VersioningResult(Map<DocumentClassification, List<VersionedDocument>> groups)
    implements StageResult {

  public VersioningResult {
    EnumMap<DocumentClassification, List<VersionedDocument>> copy =
        new EnumMap<>(DocumentClassification.class);
    for (DocumentClassification group : DocumentClassification.values()) {
      copy.put(group, List.copyOf(groups.getOrDefault(group, List.of())));
    }
    groups = Collections.unmodifiableMap(copy);
  }

  public List<VersionedDocument> group(DocumentClassification classification) {
    return groups.get(classification);
  }

  /** All versioned documents, groups in priority order and versions ascending. */
  public List<VersionedDocument> all() {
    return groups.values().stream().flatMap(List::stream).toList();
  }
}
