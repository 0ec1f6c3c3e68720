package com.flamingo.ai.legalreport.service.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.agent.DocumentClassificationAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.exception.StructuredOutputParseException;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies with the LLM agent and falls back to {@link KeywordClassificationRules} when the
 * answer is not one of the supported groups, when the model output stays malformed, or when LLM
 * classification is disabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmDocumentClassifier implements DocumentClassifier {

  private static final int MAX_CLASSIFICATION_CHARS = 6000;

  private final DocumentClassificationAgent classificationAgent;
  private final KeywordClassificationRules keywordRules;
  private final LlmJsonParser jsonParser;
  private final ExternalCallExecutor externalCallExecutor;
  private final LegalPipelineConfig config;

  @Override
  public ClassificationOutcome classify(LegalDocument document) {
    String text = document.rawText();
    boolean keywordModification = keywordRules.isModification(text);

    if (config.getExtraction().isLlmClassification() && !text.isBlank()) {
      Optional<ClassificationOutcome> llmOutcome = classifyWithLlm(document, keywordModification);
      if (llmOutcome.isPresent()) {
        return llmOutcome.get();
      }
    }

    return keywordRules
        .classify(text, document.filename())
        .map(c -> new ClassificationOutcome(c, keywordModification, "keywords"))
        .orElseGet(() -> ClassificationOutcome.unclassified(keywordModification));
  }

  private Optional<ClassificationOutcome> classifyWithLlm(
      LegalDocument document, boolean keywordModification) {
    String excerpt =
        document.rawText().length() > MAX_CLASSIFICATION_CHARS
            ? document.rawText().substring(0, MAX_CLASSIFICATION_CHARS)
            : document.rawText();
    ObjectNode answer;
    try {
      answer =
          externalCallExecutor.call(
              ExternalCapability.LLM,
              document.filename(),
              () ->
                  jsonParser.parseObject(
                      classificationAgent.classify(document.filename(), excerpt)));
    } catch (StructuredOutputParseException e) {
      log.warn(
          "Classification output for {} stayed malformed, using keyword rules: {}",
          document.filename(),
          e.getMessage());
      return Optional.empty();
    }

    String label = answer.path("clasificacion").asText(null);
    Optional<DocumentClassification> classification = DocumentClassification.fromLabel(label);
    if (classification.isEmpty()) {
      log.debug(
          "LLM label '{}' for {} is not a supported group, using keyword rules",
          label,
          document.filename());
      return Optional.empty();
    }
    boolean modification = answer.path("es_modificacion").asBoolean(false) || keywordModification;
    return Optional.of(new ClassificationOutcome(classification.get(), modification, "llm"));
  }
}
