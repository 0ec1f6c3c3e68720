package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.PipelineMode;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable accumulator for one company run: the document arena, the typed result of every finished
 * stage, the warnings and the run state. Owned by a single run and discarded afterwards.
 */
public final class ProcessingState {

  private final String company;
  private final PipelineMode mode;
  private final PipelineRunState runState;
  private final Map<StageName, StageResult> results = new EnumMap<>(StageName.class);
  private final List<PipelineWarning> warnings = new ArrayList<>();
  private DocumentArena arena = DocumentArena.empty();

  public ProcessingState(String company, PipelineMode mode, Collection<StageName> stages) {
    this.company = company;
    this.mode = mode;
    this.runState = new PipelineRunState(stages);
  }

  public String company() {
    return company;
  }

  public PipelineMode mode() {
    return mode;
  }

  public PipelineRunState runState() {
    return runState;
  }

  public DocumentArena arena() {
    return arena;
  }

  public List<PipelineWarning> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  public Optional<StageResult> result(StageName stage) {
    return Optional.ofNullable(results.get(stage));
  }

  /**
   * Returns the result of a finished upstream stage.
   *
   * @throws IllegalStateException if the stage has not produced a result of that type
   */
  public <R extends StageResult> R require(StageName stage, Class<R> type) {
    StageResult result = results.get(stage);
    if (!type.isInstance(result)) {
      throw new IllegalStateException(
          "Stage " + stage + " has no " + type.getSimpleName() + " for company " + company);
    }
    return type.cast(result);
  }

  /** Stores a stage result, adopting its arena and warnings. */
  void record(StageName stage, StageResult result) {
    results.put(stage, result);
    result.updatedArena().ifPresent(updated -> arena = updated);
    warnings.addAll(result.warnings());
  }
}
