package com.flamingo.ai.legalreport.service.extraction;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Keyword scoring over accent-free, lower-cased text. The group with the most distinct keyword hits
 * wins; ties go to the higher-priority group. Filename hints count as one extra hit.
 */
@Component
public class KeywordClassificationRules {

  private static final Map<DocumentClassification, List<String>> TEXT_KEYWORDS =
      new EnumMap<>(
          Map.of(
              DocumentClassification.ESCRITURA_PUBLICA,
              List.of(
                  "escritura publica",
                  "repertorio",
                  "notario publico",
                  "comparecen",
                  "ante mi",
                  "constitucion de sociedad",
                  "estatutos",
                  "modificacion de sociedad"),
              DocumentClassification.INSCRIPCION_CBR,
              List.of(
                  "registro de comercio",
                  "conservador de bienes raices",
                  "conservador de comercio",
                  "fojas",
                  "certificado de vigencia",
                  "inscripcion",
                  "anotacion marginal",
                  "subinscripcion"),
              DocumentClassification.PUBLICACION_DIARIO_OFICIAL,
              List.of(
                  "diario oficial",
                  "extracto",
                  "cve",
                  "edicion",
                  "publicacion")));

  private static final Map<DocumentClassification, List<String>> FILENAME_HINTS =
      new EnumMap<>(
          Map.of(
              DocumentClassification.ESCRITURA_PUBLICA,
              List.of("escritura", "constitucion", "modificacion"),
              DocumentClassification.INSCRIPCION_CBR,
              List.of("cbr", "inscripcion", "vigencia"),
              DocumentClassification.PUBLICACION_DIARIO_OFICIAL,
              List.of("diario", "publicacion", "do_")));

  private static final List<String> MODIFICATION_KEYWORDS =
      List.of(
          "modificacion",
          "aumento de capital",
          "disminucion de capital",
          "reforma de estatutos",
          "transformacion",
          "fusion",
          "division de la sociedad",
          "cesion de derechos",
          "retiro de socio",
          "ingreso de socio");

  public Optional<DocumentClassification> classify(String text, String filename) {
    String normalizedText = TextNormalizer.normalize(text);
    String normalizedName = TextNormalizer.normalize(filename);

    DocumentClassification best = null;
    int bestScore = 0;
    for (DocumentClassification classification : DocumentClassification.values()) {
      int score = hits(normalizedText, TEXT_KEYWORDS.get(classification));
      if (hits(normalizedName, FILENAME_HINTS.get(classification)) > 0) {
        score++;
      }
      if (score > bestScore) {
        best = classification;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  public boolean isModification(String text) {
    String normalized = TextNormalizer.normalize(text);
    return MODIFICATION_KEYWORDS.stream().anyMatch(normalized::contains);
  }

  private static int hits(String text, List<String> keywords) {
    int count = 0;
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        count++;
      }
    }
    return count;
  }
}
