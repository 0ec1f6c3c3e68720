package com.flamingo.ai.legalreport.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeywordClassificationRules Tests")
class KeywordClassificationRulesTest {

  private final KeywordClassificationRules rules = new KeywordClassificationRules();

  @Test
  @DisplayName("Should classify a notarial deed as escritura publica")
  void shouldClassifyEscritura() {
    String text =
        "REPERTORIO N° 1.234-2020. ESCRITURA PÚBLICA. En Santiago, ante mí, Notario Público,"
            + " comparecen don Juan Pérez y doña María Soto.";

    assertThat(rules.classify(text, "doc1.pdf"))
        .contains(DocumentClassification.ESCRITURA_PUBLICA);
  }

  @Test
  @DisplayName("Should classify a registry certificate as inscripcion")
  void shouldClassifyInscripcion() {
    String text =
        "Conservador de Bienes Raíces de Santiago. Registro de Comercio, fojas 1234 número 567.";

    assertThat(rules.classify(text, "doc2.pdf")).contains(DocumentClassification.INSCRIPCION_CBR);
  }

  @Test
  @DisplayName("Should classify a gazette extract as publicacion")
  void shouldClassifyPublicacion() {
    String text = "DIARIO OFICIAL DE LA REPUBLICA DE CHILE. Edición 42.000. Extracto. CVE 123456";

    assertThat(rules.classify(text, "doc3.pdf"))
        .contains(DocumentClassification.PUBLICACION_DIARIO_OFICIAL);
  }

  @Test
  @DisplayName("Should let the filename break an otherwise empty score")
  void shouldUseFilenameHint() {
    assertThat(rules.classify("Texto sin palabras clave", "publicacion_2020.pdf"))
        .contains(DocumentClassification.PUBLICACION_DIARIO_OFICIAL);
  }

  @Test
  @DisplayName("Should prefer the higher priority group on a tie")
  void shouldBreakTiesByPriority() {
    assertThat(rules.classify("se adjunta la escritura publica y la inscripcion", "x.pdf"))
        .contains(DocumentClassification.ESCRITURA_PUBLICA);
  }

  @Test
  @DisplayName("Should leave unrelated documents unclassified")
  void shouldReturnEmptyWithoutHits() {
    assertThat(rules.classify("Boleta de honorarios electrónica", "boleta.pdf")).isEmpty();
  }

  @Test
  @DisplayName("Should detect modification documents")
  void shouldDetectModification() {
    assertThat(rules.isModification("Acuerdan el AUMENTO DE CAPITAL de la sociedad")).isTrue();
    assertThat(rules.isModification("Constitución de sociedad por acciones")).isFalse();
  }
}
