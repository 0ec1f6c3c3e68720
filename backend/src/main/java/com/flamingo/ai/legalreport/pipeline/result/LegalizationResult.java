package com.flamingo.ai.legalreport.pipeline.result;

import com.flamingo.ai.legalreport.domain.model.PowerGrant;
import java.util.List;

/** Powers found across all versioned documents. */
public record LegalizationResult(int documentsAnalyzed, List<PowerGrant> powers)
    implements StageResult {

  public LegalizationResult {
    powers = List.copyOf(powers);
  }
}
