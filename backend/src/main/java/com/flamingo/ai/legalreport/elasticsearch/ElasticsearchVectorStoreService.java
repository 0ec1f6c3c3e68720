package com.flamingo.ai.legalreport.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.model.TextChunk;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.vector.EmbeddingService;
import com.flamingo.ai.legalreport.service.vector.VectorStoreService;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStoreService} on an Elasticsearch dense-vector index shared by all companies.
 *
 * <p>Chunks are written with bulk {@code create} operations keyed by their stable id, so a chunk
 * that another run already wrote is rejected with 409 and counted as a duplicate instead of being
 * overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "legal.pipeline.mode", havingValue = "VECTORIZED")
public class ElasticsearchVectorStoreService implements VectorStoreService {

  private static final int CONFLICT = 409;

  private final ElasticsearchClient elasticsearchClient;
  private final EmbeddingService embeddingService;
  private final ExternalCallExecutor externalCallExecutor;
  private final LegalPipelineConfig config;
  private final MeterRegistry meterRegistry;

  private volatile boolean indexReady;

  @Override
  public int upsertEmbeddings(List<TextChunk> chunks) {
    if (chunks.isEmpty()) {
      return 0;
    }
    externalCallExecutor.call(ExternalCapability.VECTOR_STORE, indexName(), this::ensureIndex);

    List<float[]> vectors =
        externalCallExecutor.call(
            ExternalCapability.EMBEDDING,
            chunks.get(0).document(),
            () -> embeddingService.embedPassages(chunks.stream().map(TextChunk::text).toList()));

    int written =
        externalCallExecutor.call(
            ExternalCapability.VECTOR_STORE,
            chunks.get(0).document(),
            () -> bulkCreate(chunks, vectors));
    meterRegistry.counter("vectorstore.chunks.written").increment(written);
    meterRegistry.counter("vectorstore.chunks.duplicate").increment(chunks.size() - written);
    return written;
  }

  private int bulkCreate(List<TextChunk> chunks, List<float[]> vectors) {
    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      Map<String, Object> document = toDocument(chunk, vectors.get(i));
      bulkBuilder.operations(
          op -> op.create(c -> c.index(indexName()).id(chunk.id()).document(document)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException e) {
      throw new UncheckedIOException("Bulk write to " + indexName() + " failed", e);
    }

    int written = 0;
    int failed = 0;
    for (BulkResponseItem item : response.items()) {
      if (item.error() == null) {
        written++;
      } else if (item.status() != CONFLICT) {
        failed++;
        log.warn("Chunk {} rejected by {}: {}", item.id(), indexName(), item.error().reason());
      }
    }
    if (failed > 0) {
      throw new IllegalStateException(failed + " chunks could not be written to " + indexName());
    }
    log.debug(
        "Wrote {} chunks to {} ({} already present)",
        written,
        indexName(),
        chunks.size() - written);
    return written;
  }

  private Map<String, Object> toDocument(TextChunk chunk, float[] vector) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("company", chunk.company());
    document.put("document", chunk.document());
    document.put("chunkIndex", chunk.chunkIndex());
    document.put("text", chunk.text());
    document.put("embedding", vector);
    return document;
  }

  private boolean ensureIndex() {
    if (indexReady) {
      return true;
    }
    synchronized (this) {
      if (indexReady) {
        return true;
      }
      try {
        boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName())).value();
        if (!exists) {
          createIndex();
          log.info("Created Elasticsearch index: {}", indexName());
        }
        indexReady = true;
        return true;
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to initialize index " + indexName(), e);
      }
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("company", Property.of(p -> p.keyword(k -> k)));
    properties.put("document", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(config.getVectorization().getEmbeddingDimensions())
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  private String indexName() {
    return config.getVectorization().getIndexName();
  }
}
