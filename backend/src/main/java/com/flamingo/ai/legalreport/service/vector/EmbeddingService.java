package com.flamingo.ai.legalreport.service.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/** Service for generating passage embeddings using OpenAI's embedding model. */
@Service
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; Spanish legal text runs about 4 chars per token
  private static final int MAX_CHARS_PER_EMBEDDING = 20000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(@Lazy EmbeddingModel embeddingModel, MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds document passages in one batch.
   *
   * @param texts the passages
   * @return one vector per passage, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  public List<float[]> embedPassages(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text.length() > MAX_CHARS_PER_EMBEDDING) {
        log.warn(
            "Passage {} too long for embedding, truncating from {} chars to {} chars",
            i,
            text.length(),
            MAX_CHARS_PER_EMBEDDING);
        text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
      }
      segments.add(TextSegment.from(text));
    }

    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != texts.size()) {
      throw new IllegalStateException(
          "Embedding model returned " + embeddings.size() + " vectors for " + texts.size());
    }
    meterRegistry.counter("embedding.requests.success").increment();
    return embeddings.stream().map(Embedding::vector).toList();
  }
}
