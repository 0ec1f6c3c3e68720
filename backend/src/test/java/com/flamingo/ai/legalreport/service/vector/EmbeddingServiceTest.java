package com.flamingo.ai.legalreport.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed passages in one batch and keep input order")
  void shouldEmbedBatchInOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(new Embedding(new float[] {0.1f}), new Embedding(new float[] {0.2f}))));

    List<float[]> vectors = embeddingService.embedPassages(List.of("primera", "segunda"));

    assertThat(vectors).hasSize(2);
    assertThat(vectors.get(0)).containsExactly(0.1f);
    assertThat(vectors.get(1)).containsExactly(0.2f);
    verify(meterRegistry.counter("embedding.requests.success")).increment();
  }

  @Test
  @DisplayName("Should truncate very long passages")
  @SuppressWarnings("unchecked")
  void shouldTruncateLongPassage() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(new Embedding(new float[] {0.5f}))));

    embeddingService.embedPassages(List.of("a".repeat(25000)));

    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(segments.capture());
    assertThat(segments.getValue().get(0).text()).hasSize(20000);
  }

  @Test
  @DisplayName("Should fail when the model returns a different number of vectors")
  void shouldFailOnVectorCountMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(new Embedding(new float[] {0.5f}))));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("uno", "dos")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 vectors for 2");
    verify(counter, never()).increment();
  }
}
