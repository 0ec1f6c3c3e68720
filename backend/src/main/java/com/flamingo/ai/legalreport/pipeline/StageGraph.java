package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed acyclic graph of pipeline stages built from each stage's declared predecessors.
 *
 * <p>Construction fails on a duplicate stage, a predecessor that is not part of the graph, or a
 * cycle. The execution order is a topological order in which ties are broken by the canonical
 * {@link StageName} order, so it is the same on every run.
 */
public final class StageGraph {

  private final Map<StageName, PipelineStage> stages = new EnumMap<>(StageName.class);
  private final List<PipelineStage> executionOrder;

  public StageGraph(List<? extends PipelineStage> declaredStages) {
    for (PipelineStage stage : declaredStages) {
      if (stages.put(stage.name(), stage) != null) {
        throw new IllegalArgumentException("Duplicate stage: " + stage.name());
      }
    }
    for (PipelineStage stage : declaredStages) {
      for (StageName predecessor : stage.predecessors()) {
        if (!stages.containsKey(predecessor)) {
          throw new IllegalArgumentException(
              "Stage " + stage.name() + " depends on unknown stage " + predecessor);
        }
      }
    }
    this.executionOrder = Collections.unmodifiableList(topologicalOrder());
  }

  public List<PipelineStage> executionOrder() {
    return executionOrder;
  }

  public Set<StageName> stageNames() {
    return Collections.unmodifiableSet(stages.keySet());
  }

  public PipelineStage stage(StageName name) {
    return stages.get(name);
  }

  private List<PipelineStage> topologicalOrder() {
    Map<StageName, Integer> pending = new EnumMap<>(StageName.class);
    Map<StageName, List<StageName>> successors = new EnumMap<>(StageName.class);
    for (PipelineStage stage : stages.values()) {
      pending.put(stage.name(), stage.predecessors().size());
      for (StageName predecessor : stage.predecessors()) {
        successors.computeIfAbsent(predecessor, k -> new ArrayList<>()).add(stage.name());
      }
    }

    PriorityQueue<StageName> ready = new PriorityQueue<>();
    pending.forEach(
        (name, count) -> {
          if (count == 0) {
            ready.add(name);
          }
        });

    List<PipelineStage> order = new ArrayList<>(stages.size());
    while (!ready.isEmpty()) {
      StageName next = ready.poll();
      order.add(stages.get(next));
      for (StageName successor : successors.getOrDefault(next, List.of())) {
        int remaining = pending.merge(successor, -1, Integer::sum);
        if (remaining == 0) {
          ready.add(successor);
        }
      }
    }

    if (order.size() != stages.size()) {
      List<StageName> blocked =
          pending.entrySet().stream()
              .filter(e -> e.getValue() > 0)
              .map(Map.Entry::getKey)
              .toList();
      throw new IllegalArgumentException("Stage graph has a cycle through " + blocked);
    }
    return order;
  }
}
