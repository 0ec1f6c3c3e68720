package com.flamingo.ai.legalreport.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.agent.DocumentClassificationAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmDocumentClassifier Tests")
class LlmDocumentClassifierTest {

  private static final LegalDocument GAZETTE =
      LegalDocument.builder()
          .index(0)
          .filename("extracto.pdf")
          .rawText("DIARIO OFICIAL. Extracto. Aumento de capital de Alfa SpA.")
          .build();

  @Mock private DocumentClassificationAgent classificationAgent;
  @Mock private ExternalCallExecutor externalCallExecutor;

  private LegalPipelineConfig config;
  private LlmDocumentClassifier classifier;

  @BeforeEach
  void setUp() {
    lenient()
        .when(externalCallExecutor.call(any(), anyString(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(2).get());
    config = new LegalPipelineConfig();
    classifier =
        new LlmDocumentClassifier(
            classificationAgent,
            new KeywordClassificationRules(),
            new LlmJsonParser(new ObjectMapper()),
            externalCallExecutor,
            config);
  }

  @Test
  @DisplayName("Should use the model label when it is a supported group")
  void shouldUseModelLabel() {
    when(classificationAgent.classify(anyString(), anyString()))
        .thenReturn("{\"clasificacion\": \"inscripcion_cbr\", \"es_modificacion\": false}");

    ClassificationOutcome outcome = classifier.classify(GAZETTE);

    assertThat(outcome.classification()).isEqualTo(DocumentClassification.INSCRIPCION_CBR);
    assertThat(outcome.source()).isEqualTo("llm");
    assertThat(outcome.modification()).isTrue();
  }

  @Test
  @DisplayName("Should fall back to keywords for an unsupported label")
  void shouldFallBackForUnknownLabel() {
    when(classificationAgent.classify(anyString(), anyString()))
        .thenReturn("{\"clasificacion\": \"otros\"}");

    ClassificationOutcome outcome = classifier.classify(GAZETTE);

    assertThat(outcome.classification())
        .isEqualTo(DocumentClassification.PUBLICACION_DIARIO_OFICIAL);
    assertThat(outcome.source()).isEqualTo("keywords");
  }

  @Test
  @DisplayName("Should fall back to keywords when the answer is not JSON")
  void shouldFallBackForMalformedAnswer() {
    when(classificationAgent.classify(anyString(), anyString())).thenReturn("Es un extracto.");

    ClassificationOutcome outcome = classifier.classify(GAZETTE);

    assertThat(outcome.classification())
        .isEqualTo(DocumentClassification.PUBLICACION_DIARIO_OFICIAL);
  }

  @Test
  @DisplayName("Should not call the model when LLM classification is disabled")
  void shouldSkipModelWhenDisabled() {
    config.getExtraction().setLlmClassification(false);
    LegalDocument unrelated =
        LegalDocument.builder().index(1).filename("boleta.pdf").rawText("Boleta").build();

    ClassificationOutcome outcome = classifier.classify(unrelated);

    assertThat(outcome.classification()).isNull();
    assertThat(outcome.source()).isEqualTo("none");
    verifyNoInteractions(classificationAgent);
  }
}
