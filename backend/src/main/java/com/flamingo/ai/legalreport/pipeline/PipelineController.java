package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.pipeline.result.ReportResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.service.storage.StageSnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs the stage graph for one company.
 *
 * <p>Stages run one at a time in the graph's execution order. After each stage, completed or
 * skipped, its snapshot is written before the next stage starts. The first failure moves the run
 * to FAILED and no further stage runs. A run summary is written whatever the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

  static final String MDC_COMPANY = "company";

  private final StageGraph stageGraph;
  private final StageSnapshotStore snapshotStore;
  private final StageSnapshotMapper snapshotMapper;
  private final LegalPipelineConfig config;
  private final MeterRegistry meterRegistry;

  public PipelineOutcome run(String company) {
    ProcessingState state =
        new ProcessingState(
            company, config.getPipeline().resolveMode(), stageGraph.stageNames());
    Map<StageName, Long> durations = new EnumMap<>(StageName.class);
    Instant startedAt = Instant.now();
    StageFailure failure = null;

    MDC.put(MDC_COMPANY, company);
    try {
      log.info("Starting pipeline for company={} in mode {}", company, state.mode().label());
      state.runState().start();
      for (PipelineStage stage : stageGraph.executionOrder()) {
        failure = runStage(stage, state, durations);
        if (failure != null) {
          meterRegistry
              .counter("pipeline.run.failure", "stage", failure.stage().name())
              .increment();
          return new PipelineOutcome.Failed(company, failure);
        }
      }
      state.runState().complete();
      meterRegistry.counter("pipeline.run.success").increment();
      log.info(
          "Pipeline completed for company={} with {} warnings", company, state.warnings().size());
      ReportResult report = state.require(StageName.REPORT, ReportResult.class);
      return new PipelineOutcome.Completed(company, report.report(), state.warnings());
    } finally {
      writeRunSummary(state, durations, startedAt, failure);
      MDC.remove(MDC_COMPANY);
    }
  }

  /** Runs one stage; returns the failure, or null when the stage completed or was skipped. */
  private StageFailure runStage(
      PipelineStage stage, ProcessingState state, Map<StageName, Long> durations) {
    StageName name = stage.name();
    for (StageName predecessor : stage.predecessors()) {
      if (!state.runState().isSatisfied(predecessor)) {
        throw new IllegalStateException(
            "Stage " + name + " scheduled before predecessor " + predecessor + " finished");
      }
    }

    state.runState().beginStage(name);
    long start = System.nanoTime();
    try {
      Optional<StageResult> placeholder = stage.skipResult(state);
      StageResult result = placeholder.isPresent() ? placeholder.get() : stage.execute(state);
      state.record(name, result);
      snapshotStore.writeStage(
          state.company(), name, snapshotMapper.toSnapshot(result, state.arena()));
      result.warnings().forEach(w -> log.warn("{} warning: {}", w.type(), w.message()));

      if (placeholder.isPresent()) {
        state.runState().skipStage(name);
        log.info("Stage {} skipped", name);
      } else {
        state.runState().completeStage(name);
        log.info("Stage {} completed", name);
      }
      return null;
    } catch (PipelineException e) {
      e.withContext(state.company(), name, null);
      return fail(state, name, e.getDocument(), e.getClass().getSimpleName(), e.getMessage(), e);
    } catch (RuntimeException e) {
      return fail(state, name, null, e.getClass().getSimpleName(), e.getMessage(), e);
    } finally {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      durations.put(name, elapsed.toMillis());
      meterRegistry.timer("pipeline.stage.duration", "stage", name.name()).record(elapsed);
    }
  }

  private StageFailure fail(
      ProcessingState state,
      StageName stage,
      String document,
      String errorType,
      String reason,
      RuntimeException cause) {
    log.error(
        "Pipeline failed for company={} at stage={} (document={}): {}",
        state.company(),
        stage,
        document != null ? document : "-",
        reason,
        cause);
    state.runState().fail(stage, reason);
    return new StageFailure(stage, document, errorType, reason);
  }

  private void writeRunSummary(
      ProcessingState state,
      Map<StageName, Long> durations,
      Instant startedAt,
      StageFailure failure) {
    List<RunSummary.StageEntry> stages = new ArrayList<>();
    for (PipelineStage stage : stageGraph.executionOrder()) {
      stages.add(
          new RunSummary.StageEntry(
              stage.name(),
              state.runState().stageStatus(stage.name()),
              durations.get(stage.name())));
    }
    RunSummary summary =
        new RunSummary(
            state.company(),
            state.runState().status(),
            state.mode().label(),
            startedAt.toString(),
            Instant.now().toString(),
            stages,
            failure,
            state.warnings());
    try {
      snapshotStore.writeRunSummary(state.company(), summary);
    } catch (RuntimeException e) {
      log.error("Failed to write run summary for company={}: {}", state.company(), e.getMessage());
    }
  }
}
