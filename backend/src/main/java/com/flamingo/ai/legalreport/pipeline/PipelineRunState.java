package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.RunStatus;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.enums.StageStatus;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Run lifecycle: {@code PENDING -> RUNNING(stage) -> ... -> COMPLETED | FAILED(stage, reason)}.
 * Every illegal transition throws {@link IllegalStateException}.
 */
public final class PipelineRunState {

  private final Map<StageName, StageStatus> stageStatuses = new EnumMap<>(StageName.class);
  private RunStatus status = RunStatus.PENDING;
  private StageName currentStage;
  private StageName failedStage;
  private String failureReason;

  public PipelineRunState(Collection<StageName> stages) {
    for (StageName stage : stages) {
      stageStatuses.put(stage, StageStatus.NOT_STARTED);
    }
  }

  public synchronized void start() {
    require(status == RunStatus.PENDING, "start");
    status = RunStatus.RUNNING;
  }

  public synchronized void beginStage(StageName stage) {
    require(status == RunStatus.RUNNING && currentStage == null, "begin " + stage);
    require(stageStatuses.get(stage) == StageStatus.NOT_STARTED, "begin " + stage);
    currentStage = stage;
    stageStatuses.put(stage, StageStatus.RUNNING);
  }

  public synchronized void completeStage(StageName stage) {
    finishStage(stage, StageStatus.COMPLETED);
  }

  public synchronized void skipStage(StageName stage) {
    finishStage(stage, StageStatus.SKIPPED);
  }

  public synchronized void fail(StageName stage, String reason) {
    require(status == RunStatus.RUNNING, "fail at " + stage);
    require(currentStage == null || currentStage == stage, "fail at " + stage);
    if (stage != null) {
      stageStatuses.put(stage, StageStatus.FAILED);
    }
    currentStage = null;
    failedStage = stage;
    failureReason = reason;
    status = RunStatus.FAILED;
  }

  public synchronized void complete() {
    require(status == RunStatus.RUNNING && currentStage == null, "complete");
    status = RunStatus.COMPLETED;
  }

  public synchronized RunStatus status() {
    return status;
  }

  public synchronized StageName currentStage() {
    return currentStage;
  }

  public synchronized StageName failedStage() {
    return failedStage;
  }

  public synchronized String failureReason() {
    return failureReason;
  }

  public synchronized StageStatus stageStatus(StageName stage) {
    return stageStatuses.get(stage);
  }

  /** Whether {@code stage} finished in a way that lets its successors run. */
  public synchronized boolean isSatisfied(StageName stage) {
    StageStatus stageStatus = stageStatuses.get(stage);
    return stageStatus == StageStatus.COMPLETED || stageStatus == StageStatus.SKIPPED;
  }

  public synchronized Map<StageName, StageStatus> stageStatuses() {
    return Collections.unmodifiableMap(new EnumMap<>(stageStatuses));
  }

  private void finishStage(StageName stage, StageStatus outcome) {
    require(status == RunStatus.RUNNING && currentStage == stage, "finish " + stage);
    stageStatuses.put(stage, outcome);
    currentStage = null;
  }

  private void require(boolean condition, String transition) {
    if (!condition) {
      String current = currentStage != null ? "(" + currentStage + ")" : "";
      throw new IllegalStateException(
          "Illegal transition '" + transition + "' from " + status + current);
    }
  }
}
