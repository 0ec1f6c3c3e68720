package com.flamingo.ai.legalreport.service.versioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.exception.VersioningException;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VersioningEngine Tests")
class VersioningEngineTest {

  private static final DocumentClassification DIARIO_OFICIAL =
      DocumentClassification.PUBLICACION_DIARIO_OFICIAL;

  private final VersioningEngine versioningEngine = new VersioningEngine();

  @Nested
  @DisplayName("Lineage ordering")
  class LineageOrdering {

    @Test
    @DisplayName("Should number three escrituras by primary date")
    void shouldNumberEscriturasByPrimaryDate() {
      DocumentArena arena =
          arena(
              doc("modificacion_2019.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2019-05-10"),
              doc("constitucion.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2015-01-20"),
              doc("modificacion_2021.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2021-08-02"));

      VersioningResult result = versioningEngine.version(arena);

      List<VersionedDocument> lineage = result.group(DocumentClassification.ESCRITURA_PUBLICA);
      assertThat(lineage).extracting(VersionedDocument::documentIndex).containsExactly(1, 0, 2);
      assertThat(lineage).extracting(VersionedDocument::versionNumber).containsExactly(1, 2, 3);
      assertThat(lineage).extracting(VersionedDocument::base).containsExactly(true, false, false);
    }

    @Test
    @DisplayName("Should break date ties by filename")
    void shouldBreakDateTiesByFilename() {
      DocumentArena arena =
          arena(
              doc("b_extracto.pdf", DIARIO_OFICIAL, "2020-03-01"),
              doc("a_extracto.pdf", DIARIO_OFICIAL, "2020-03-01"));

      VersioningResult result = versioningEngine.version(arena);

      assertThat(result.group(DIARIO_OFICIAL))
          .extracting(VersionedDocument::documentIndex)
          .containsExactly(1, 0);
    }

    @Test
    @DisplayName("Should produce the same lineage regardless of input order")
    void shouldBeIndependentOfInputOrder() {
      DocumentArena forward =
          arena(
              doc("x.pdf", DocumentClassification.INSCRIPCION_CBR, "2018-01-01"),
              doc("y.pdf", DocumentClassification.INSCRIPCION_CBR, "2019-01-01"));
      DocumentArena reversed =
          arena(
              doc("y.pdf", DocumentClassification.INSCRIPCION_CBR, "2019-01-01"),
              doc("x.pdf", DocumentClassification.INSCRIPCION_CBR, "2018-01-01"));

      List<String> forwardOrder = filenames(forward, versioningEngine.version(forward));
      List<String> reversedOrder = filenames(reversed, versioningEngine.version(reversed));

      assertThat(forwardOrder).containsExactly("x.pdf", "y.pdf").isEqualTo(reversedOrder);
    }
  }

  @Nested
  @DisplayName("Groups")
  class Groups {

    @Test
    @DisplayName("Should always return all three groups")
    void shouldReturnAllGroups() {
      DocumentArena arena =
          arena(doc("escritura.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2015-01-20"));

      VersioningResult result = versioningEngine.version(arena);

      assertThat(result.groups()).containsOnlyKeys(DocumentClassification.values());
      assertThat(result.group(DocumentClassification.ESCRITURA_PUBLICA)).hasSize(1);
      assertThat(result.group(DocumentClassification.INSCRIPCION_CBR)).isEmpty();
      assertThat(result.group(DocumentClassification.PUBLICACION_DIARIO_OFICIAL)).isEmpty();
    }

    @Test
    @DisplayName("Should leave unclassified documents out of every lineage")
    void shouldSkipUnclassifiedDocuments() {
      DocumentArena arena =
          arena(
              doc("escritura.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2015-01-20"),
              doc("certificado.pdf", null, null));

      VersioningResult result = versioningEngine.version(arena);

      assertThat(result.all()).extracting(VersionedDocument::documentIndex).containsExactly(0);
    }

    @Test
    @DisplayName("Should return empty lineages for an empty arena")
    void shouldHandleEmptyArena() {
      VersioningResult result = versioningEngine.version(DocumentArena.empty());

      assertThat(result.all()).isEmpty();
    }
  }

  @Test
  @DisplayName("Should fail when a classified document has no primary date")
  void shouldFailWithoutPrimaryDate() {
    DocumentArena arena =
        arena(
            doc("escritura.pdf", DocumentClassification.ESCRITURA_PUBLICA, "2015-01-20"),
            doc("sin_fecha.pdf", DocumentClassification.ESCRITURA_PUBLICA, null));

    assertThatThrownBy(() -> versioningEngine.version(arena))
        .isInstanceOf(VersioningException.class)
        .hasMessageContaining("sin_fecha.pdf");
  }

  private static List<String> filenames(DocumentArena arena, VersioningResult result) {
    return result.all().stream().map(v -> arena.get(v.documentIndex()).filename()).toList();
  }

  private static LegalDocument.LegalDocumentBuilder doc(
      String filename, DocumentClassification classification, String date) {
    return LegalDocument.builder()
        .filename(filename)
        .classification(classification)
        .primaryDate(date == null ? null : LocalDate.parse(date));
  }

  private static DocumentArena arena(LegalDocument.LegalDocumentBuilder... builders) {
    List<LegalDocument> documents = new ArrayList<>();
    for (LegalDocument.LegalDocumentBuilder builder : builders) {
      documents.add(builder.index(documents.size()).build());
    }
    return DocumentArena.of(documents);
  }
}
