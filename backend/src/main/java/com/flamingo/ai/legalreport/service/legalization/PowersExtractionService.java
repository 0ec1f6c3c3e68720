package com.flamingo.ai.legalreport.service.legalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.agent.PowerVerificationAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.PowerGrant;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.service.extraction.LlmJsonParser;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.text.TextChunker;
import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds catalogued powers in a document.
 *
 * <p>The text is split into overlapping fragments. A fragment is a candidate for a power when it
 * contains every mandatory anchor; candidates are ranked by keyword hits. With verification on, the
 * LLM must confirm that a candidate grants the power. Malformed verification output that survives
 * its retries fails the stage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PowersExtractionService {

  private static final int MAX_EVIDENCE_CHARS = 400;

  private final PowerCatalog catalog;
  private final TextChunker textChunker;
  private final PowerVerificationAgent verificationAgent;
  private final LlmJsonParser jsonParser;
  private final ExternalCallExecutor externalCallExecutor;
  private final LegalPipelineConfig config;

  public List<PowerGrant> extractPowers(LegalDocument document, VersionedDocument version) {
    LegalPipelineConfig.Legalization settings = config.getLegalization();
    List<String> fragments =
        textChunker.split(
            document.rawText(), settings.getFragmentSize(), settings.getFragmentOverlap());
    if (fragments.isEmpty()) {
      return List.of();
    }
    List<String> normalizedFragments = fragments.stream().map(TextNormalizer::normalize).toList();

    List<PowerGrant> grants = new ArrayList<>();
    for (PowerDefinition power : catalog.definitions()) {
      List<Integer> candidates = candidates(power, normalizedFragments);
      for (int fragmentIndex : candidates) {
        PowerGrant.PowerGrantBuilder grant =
            PowerGrant.builder()
                .code(power.code())
                .name(power.name())
                .group(power.group())
                .document(document.filename())
                .version(version.versionNumber())
                .classification(version.group());
        String fragment = fragments.get(fragmentIndex);
        if (!settings.isLlmVerification()) {
          grants.add(grant.evidence(excerpt(fragment)).build());
          break;
        }
        ObjectNode verdict = verify(power, fragment, document.filename());
        double confidence = verdict.path("confianza").asDouble(0.0);
        if (verdict.path("otorgado").asBoolean(false)
            && confidence >= settings.getMinConfidence()) {
          grants.add(
              grant
                  .actor(textOrNull(verdict.get("actor")))
                  .limits(textOrNull(verdict.get("limites")))
                  .evidence(evidence(verdict, fragment))
                  .confidence(confidence)
                  .build());
          break;
        }
      }
    }
    log.debug("Found {} powers in {}", grants.size(), document.filename());
    return grants;
  }

  /** Indexes of fragments holding every anchor, best keyword score first. */
  List<Integer> candidates(PowerDefinition power, List<String> normalizedFragments) {
    List<Integer> matching = new ArrayList<>();
    for (int i = 0; i < normalizedFragments.size(); i++) {
      if (containsAllAnchors(normalizedFragments.get(i), power.anchors())) {
        matching.add(i);
      }
    }
    matching.sort(
        Comparator.comparingInt((Integer i) -> -keywordHits(normalizedFragments.get(i), power))
            .thenComparingInt(i -> i));
    int limit = Math.max(1, config.getLegalization().getMaxCandidatesPerPower());
    return matching.size() > limit ? matching.subList(0, limit) : matching;
  }

  static boolean containsAllAnchors(String normalizedFragment, List<String> anchors) {
    for (String anchor : anchors) {
      boolean anyVariant =
          Arrays.stream(anchor.split("\\|"))
              .map(TextNormalizer::normalize)
              .filter(v -> !v.isEmpty())
              .anyMatch(normalizedFragment::contains);
      if (!anyVariant) {
        return false;
      }
    }
    return true;
  }

  private static int keywordHits(String normalizedFragment, PowerDefinition power) {
    int hits = 0;
    for (String keyword : power.keywords()) {
      if (normalizedFragment.contains(TextNormalizer.normalize(keyword))) {
        hits++;
      }
    }
    return hits;
  }

  private ObjectNode verify(PowerDefinition power, String fragment, String filename) {
    return externalCallExecutor.call(
        ExternalCapability.LLM,
        filename + " " + power.code(),
        () ->
            jsonParser.parseObject(
                verificationAgent.verify(
                    power.code(), power.name(), power.description(), fragment)));
  }

  private static String evidence(ObjectNode verdict, String fragment) {
    String quoted = textOrNull(verdict.get("evidencia"));
    return quoted != null ? excerpt(quoted) : excerpt(fragment);
  }

  private static String excerpt(String text) {
    String stripped = text.strip();
    return stripped.length() > MAX_EVIDENCE_CHARS
        ? stripped.substring(0, MAX_EVIDENCE_CHARS)
        : stripped;
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull() || node.asText().isBlank()) {
      return null;
    }
    return node.asText().strip();
  }
}
