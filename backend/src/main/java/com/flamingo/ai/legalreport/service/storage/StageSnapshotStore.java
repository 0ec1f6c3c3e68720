package com.flamingo.ai.legalreport.service.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Durable per-stage JSON snapshots under {@code {resultsDir}}. Each write goes to a temporary file
 * in the same directory and is then moved into place, so a reader never sees a partial file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StageSnapshotStore {

  private static final String RUN_SUMMARY_SUFFIX = "_run_summary.json";

  private final LegalPipelineConfig config;
  private final ObjectMapper objectMapper;

  public Path writeStage(String company, StageName stage, Object snapshot) {
    return writeAtomically(resultsDirectory().resolve(stage.snapshotFileName(company)), snapshot);
  }

  public Path writeRunSummary(String company, Object summary) {
    return writeAtomically(resultsDirectory().resolve(company + RUN_SUMMARY_SUFFIX), summary);
  }

  /** Snapshot files currently on disk for {@code company}, in stage order. */
  public Map<StageName, Path> listStageSnapshots(String company) {
    Map<StageName, Path> snapshots = new EnumMap<>(StageName.class);
    for (StageName stage : StageName.values()) {
      Path file = resultsDirectory().resolve(stage.snapshotFileName(company));
      if (Files.isRegularFile(file)) {
        snapshots.put(stage, file);
      }
    }
    return snapshots;
  }

  public Optional<JsonNode> readStage(String company, StageName stage) {
    return read(resultsDirectory().resolve(stage.snapshotFileName(company)));
  }

  public Optional<JsonNode> readRunSummary(String company) {
    return read(resultsDirectory().resolve(company + RUN_SUMMARY_SUFFIX));
  }

  private Optional<JsonNode> read(Path file) {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(file.toFile()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read snapshot " + file, e);
    }
  }

  private Path writeAtomically(Path target, Object content) {
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(content);
      temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      Files.write(temp, bytes);
      try {
        Files.move(
            temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Wrote snapshot {}", target);
      return target;
    } catch (IOException e) {
      UncheckedIOException failure =
          new UncheckedIOException("Failed to write snapshot " + target, e);
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
      }
      throw failure;
    }
  }

  private Path resultsDirectory() {
    return Path.of(config.getStorage().getResultsDir());
  }
}
