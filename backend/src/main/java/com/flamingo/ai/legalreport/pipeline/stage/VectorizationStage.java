package com.flamingo.ai.legalreport.pipeline.stage;

import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.TextChunk;
import com.flamingo.ai.legalreport.exception.ExternalServiceException;
import com.flamingo.ai.legalreport.exception.PipelineException;
import com.flamingo.ai.legalreport.pipeline.PipelineStage;
import com.flamingo.ai.legalreport.pipeline.ProcessingState;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.pipeline.result.VectorizationResult;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.text.TextChunker;
import com.flamingo.ai.legalreport.service.vector.VectorStoreService;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Chunks, embeds and indexes every classified document in {@code VECTORIZED} mode. In the other
 * modes the stage is skipped and a placeholder result is recorded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorizationStage implements PipelineStage {

  private final ObjectProvider<VectorStoreService> vectorStoreProvider;
  private final TextChunker textChunker;
  private final LegalPipelineConfig config;

  @Override
  public StageName name() {
    return StageName.VECTORIZATION;
  }

  @Override
  public Set<StageName> predecessors() {
    return Set.of(StageName.CLASSIFICATION);
  }

  @Override
  public Optional<StageResult> skipResult(ProcessingState state) {
    if (state.mode().vectorizes()) {
      return Optional.empty();
    }
    return Optional.of(VectorizationResult.skipped(state.company(), state.mode()));
  }

  @Override
  public StageResult execute(ProcessingState state) {
    VectorStoreService vectorStore = vectorStoreProvider.getIfAvailable();
    if (vectorStore == null) {
      throw new ExternalServiceException(
          ExternalCapability.VECTOR_STORE.instanceName(),
          "Vectorized mode requested but no vector store is configured",
          null);
    }
    LegalPipelineConfig.Vectorization settings = config.getVectorization();

    int documentsProcessed = 0;
    int totalChunks = 0;
    int written = 0;
    for (LegalDocument document : state.arena().documents()) {
      if (!document.isClassified()) {
        continue;
      }
      List<String> pieces =
          textChunker.split(
              document.rawText(), settings.getChunkSize(), settings.getChunkOverlap());
      List<TextChunk> chunks = new ArrayList<>(pieces.size());
      for (int i = 0; i < pieces.size(); i++) {
        chunks.add(
            new TextChunk(
                chunkId(state.company(), document.filename(), i, pieces.get(i)),
                state.company(),
                document.filename(),
                i,
                pieces.get(i)));
      }
      try {
        written += vectorStore.upsertEmbeddings(chunks);
      } catch (PipelineException e) {
        throw e.withContext(state.company(), name(), document.filename());
      }
      documentsProcessed++;
      totalChunks += chunks.size();
    }

    int duplicates = totalChunks - written;
    log.info(
        "Indexed {} chunks from {} documents ({} already present)",
        totalChunks,
        documentsProcessed,
        duplicates);
    return new VectorizationResult(
        VectorizationResult.collectionFor(state.company()),
        documentsProcessed,
        totalChunks,
        duplicates,
        state.mode(),
        "Vectorización completada",
        false);
  }

  static String chunkId(String company, String filename, int index, String text) {
    return Hashing.sha256()
        .newHasher()
        .putString(company, StandardCharsets.UTF_8)
        .putChar('\u0000')
        .putString(filename, StandardCharsets.UTF_8)
        .putInt(index)
        .putString(text, StandardCharsets.UTF_8)
        .hash()
        .toString();
  }
}
