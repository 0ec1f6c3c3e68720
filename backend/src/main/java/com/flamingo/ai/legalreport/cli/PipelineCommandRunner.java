package com.flamingo.ai.legalreport.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.pipeline.PipelineController;
import com.flamingo.ai.legalreport.pipeline.PipelineOutcome;
import com.flamingo.ai.legalreport.pipeline.StageFailure;
import com.flamingo.ai.legalreport.service.storage.StageSnapshotStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry point.
 *
 * <pre>
 *   run &lt;company&gt; [&lt;company&gt;...]   process each company folder, concurrently
 *   status &lt;company&gt;                  list the stage snapshots persisted for a company
 * </pre>
 *
 * <p>Option arguments such as {@code --legal.pipeline.mode=VECTORIZED} are Spring properties and
 * never operands. The exit code is 0 only when every requested run completed.
 */
@Component
@Slf4j
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_RUN_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private final PipelineController pipelineController;
  private final StageSnapshotStore snapshotStore;
  private final Executor companyRunExecutor;
  private final LegalPipelineConfig config;

  private int exitCode = EXIT_OK;

  public PipelineCommandRunner(
      PipelineController pipelineController,
      StageSnapshotStore snapshotStore,
      @Qualifier("companyRunExecutor") Executor companyRunExecutor,
      LegalPipelineConfig config) {
    this.pipelineController = pipelineController;
    this.snapshotStore = snapshotStore;
    this.companyRunExecutor = companyRunExecutor;
    this.config = config;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> arguments = args.getNonOptionArgs();
    if (arguments.isEmpty()) {
      printUsage();
      return;
    }
    List<String> operands = arguments.subList(1, arguments.size());
    switch (arguments.get(0)) {
      case "run" -> exitCode = operands.isEmpty() ? usageError() : runCompanies(operands);
      case "status" -> exitCode = operands.size() != 1 ? usageError() : status(operands.get(0));
      default -> exitCode = usageError();
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int runCompanies(List<String> companies) {
    Duration timeout = config.getExecution().getRunTimeout();
    List<CompletableFuture<PipelineOutcome>> runs = new ArrayList<>();
    for (String company : companies) {
      runs.add(
          CompletableFuture.supplyAsync(() -> pipelineController.run(company), companyRunExecutor)
              .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    int failed = 0;
    for (int i = 0; i < runs.size(); i++) {
      PipelineOutcome outcome;
      try {
        outcome = runs.get(i).join();
      } catch (CompletionException e) {
        String reason =
            e.getCause() instanceof TimeoutException
                ? "run exceeded " + timeout
                : e.getCause().getMessage();
        log.error("Run for company={} aborted: {}", companies.get(i), reason, e.getCause());
        System.out.printf("%s: ABORTED: %s%n", companies.get(i), reason);
        failed++;
        continue;
      }
      if (outcome instanceof PipelineOutcome.Completed completed) {
        System.out.printf(
            "%s: COMPLETED (%d warnings)%n", completed.company(), completed.warnings().size());
      } else if (outcome instanceof PipelineOutcome.Failed failure) {
        StageFailure cause = failure.failure();
        System.out.printf(
            "%s: FAILED at %s (%s): %s%n",
            failure.company(),
            cause.stage().fileKey(),
            cause.document() != null ? cause.document() : "-",
            cause.reason());
        failed++;
      } else {
        log.error("Run for company={} returned no outcome", companies.get(i));
        System.out.printf("%s: FAILED: no outcome%n", companies.get(i));
        failed++;
      }
    }
    log.info("Finished {} runs, {} failed", companies.size(), failed);
    return failed == 0 ? EXIT_OK : EXIT_RUN_FAILED;
  }

  int status(String company) {
    Map<StageName, Path> snapshots = snapshotStore.listStageSnapshots(company);
    System.out.printf("Company %s%n", company);
    for (StageName stage : StageName.values()) {
      Path file = snapshots.get(stage);
      System.out.printf(
          "  %-16s %s%n", stage.fileKey(), file != null ? file.toString() : "(no output)");
    }
    Optional<JsonNode> summary = snapshotStore.readRunSummary(company);
    if (summary.isPresent()) {
      JsonNode node = summary.get();
      System.out.printf(
          "  last run: %s (finished %s)%n",
          node.path("status").asText("UNKNOWN"),
          node.path("finishedAt").asText("-"));
    } else {
      System.out.println("  last run: none recorded");
    }
    return EXIT_OK;
  }

  private int usageError() {
    printUsage();
    return EXIT_USAGE;
  }

  private static void printUsage() {
    System.out.println("Usage: run <company> [<company>...] | status <company>");
  }
}
