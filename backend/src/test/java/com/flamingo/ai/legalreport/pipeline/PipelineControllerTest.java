package com.flamingo.ai.legalreport.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.enums.PipelineMode;
import com.flamingo.ai.legalreport.domain.enums.ReportSection;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.LegalReport;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import com.flamingo.ai.legalreport.exception.ExternalServiceException;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import com.flamingo.ai.legalreport.pipeline.result.ClassificationResult;
import com.flamingo.ai.legalreport.pipeline.result.OcrResult;
import com.flamingo.ai.legalreport.pipeline.result.ReportResult;
import com.flamingo.ai.legalreport.pipeline.result.VectorizationResult;
import com.flamingo.ai.legalreport.pipeline.stage.OcrStage;
import com.flamingo.ai.legalreport.service.ocr.OcrCache;
import com.flamingo.ai.legalreport.service.ocr.OcrService;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.storage.CompanyDocumentSource;
import com.flamingo.ai.legalreport.service.storage.StageSnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

@DisplayName("PipelineController Tests")
class PipelineControllerTest {

  private static final String COMPANY = "acme";

  @TempDir Path resultsDir;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private LegalPipelineConfig config;
  private StageSnapshotStore snapshotStore;

  private DocumentArena arena;

  @BeforeEach
  void setUp() {
    config = new LegalPipelineConfig();
    config.getStorage().setResultsDir(resultsDir.toString());
    snapshotStore = new StageSnapshotStore(config, objectMapper);
    arena =
        DocumentArena.of(
            List.of(
                LegalDocument.builder()
                    .index(0)
                    .filename("constitucion.pdf")
                    .rawText("Escritura pública de constitución")
                    .primaryDate(LocalDate.of(2015, 1, 20))
                    .build()));
  }

  @Nested
  @DisplayName("Successful run")
  class SuccessfulRun {

    @Test
    @DisplayName("Should run stages in order and return the report with collected warnings")
    void shouldCompleteRun() {
      PipelineWarning warning = PipelineWarning.extractionError("constitucion.pdf", "bad json");
      List<StageName> executed = new ArrayList<>();
      StubStage ocr =
          new StubStage(StageName.OCR)
              .doing(
                  state -> {
                    executed.add(StageName.OCR);
                    return new OcrResult(arena, 0);
                  });
      StubStage classification =
          new StubStage(StageName.CLASSIFICATION, StageName.OCR)
              .doing(
                  state -> {
                    executed.add(StageName.CLASSIFICATION);
                    assertThat(state.arena()).isSameAs(arena);
                    return new ClassificationResult(classified(arena), List.of(warning));
                  });
      StubStage report =
          new StubStage(StageName.REPORT, StageName.CLASSIFICATION)
              .doing(
                  state -> {
                    executed.add(StageName.REPORT);
                    return new ReportResult(emptyReport(), List.of());
                  });

      PipelineOutcome outcome = controller(report, classification, ocr).run(COMPANY);

      assertThat(outcome).isInstanceOf(PipelineOutcome.Completed.class);
      assertThat(outcome.isSuccess()).isTrue();
      assertThat(((PipelineOutcome.Completed) outcome).warnings()).containsExactly(warning);
      assertThat(executed)
          .containsExactly(StageName.OCR, StageName.CLASSIFICATION, StageName.REPORT);
      assertThat(snapshotStore.listStageSnapshots(COMPANY))
          .containsOnlyKeys(StageName.OCR, StageName.CLASSIFICATION, StageName.REPORT);
      assertThat(meterRegistry.counter("pipeline.run.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record the placeholder of a skipped stage without executing it")
    void shouldSkipVectorization() {
      StubStage ocr = new StubStage(StageName.OCR).returning(new OcrResult(arena, 0));
      StubStage vectorization =
          new StubStage(StageName.VECTORIZATION, StageName.OCR)
              .skippingWith(VectorizationResult.skipped(COMPANY, PipelineMode.OCR_DIRECT));
      StubStage report =
          new StubStage(StageName.REPORT, StageName.VECTORIZATION)
              .returning(new ReportResult(emptyReport(), List.of()));

      PipelineOutcome outcome = controller(ocr, vectorization, report).run(COMPANY);

      assertThat(outcome.isSuccess()).isTrue();
      assertThat(vectorization.invocationCount()).isZero();
      JsonNode snapshot = snapshotStore.readStage(COMPANY, StageName.VECTORIZATION).orElseThrow();
      assertThat(snapshot.path("documentos_procesados").asInt()).isZero();
      assertThat(snapshot.path("total_chunks").asInt()).isZero();
      assertThat(snapshot.path("modo").asText()).isEqualTo("OCR_DIRECTO");
      assertThat(snapshot.path("mensaje").asText())
          .isEqualTo("Vectorización omitida - usando extracción directa desde OCR");
      JsonNode summary = snapshotStore.readRunSummary(COMPANY).orElseThrow();
      assertThat(summary.path("stages").get(1).path("status").asText()).isEqualTo("SKIPPED");
    }

    @Test
    @DisplayName("Should persist a stage snapshot before the next stage starts")
    void shouldPersistSnapshotBeforeNextStage() {
      StubStage ocr = new StubStage(StageName.OCR).returning(new OcrResult(arena, 0));
      StubStage report =
          new StubStage(StageName.REPORT, StageName.OCR)
              .doing(
                  state -> {
                    assertThat(snapshotStore.readStage(COMPANY, StageName.OCR)).isPresent();
                    return new ReportResult(emptyReport(), List.of());
                  });

      PipelineOutcome outcome = controller(ocr, report).run(COMPANY);

      assertThat(outcome.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should expose the company in the MDC only while running")
    void shouldScopeMdcToRun() {
      List<String> seen = new ArrayList<>();
      StubStage ocr =
          new StubStage(StageName.OCR)
              .doing(
                  state -> {
                    seen.add(MDC.get("company"));
                    return new OcrResult(arena, 0);
                  });
      StubStage report =
          new StubStage(StageName.REPORT, StageName.OCR)
              .returning(new ReportResult(emptyReport(), List.of()));

      controller(ocr, report).run(COMPANY);

      assertThat(seen).containsExactly(COMPANY);
      assertThat(MDC.get("company")).isNull();
    }
  }

  @Nested
  @DisplayName("Failed run")
  class FailedRun {

    @Test
    @DisplayName("Should stop at the failing stage and keep earlier snapshots")
    void shouldStopAtFailingStage() {
      StubStage ocr = new StubStage(StageName.OCR).returning(new OcrResult(arena, 0));
      StubStage classification =
          new StubStage(StageName.CLASSIFICATION, StageName.OCR)
              .doing(
                  state -> {
                    throw new InputDocumentException(COMPANY, "roto.pdf", "File is not readable");
                  });
      StubStage report =
          new StubStage(StageName.REPORT, StageName.CLASSIFICATION)
              .returning(new ReportResult(emptyReport(), List.of()));

      PipelineOutcome outcome = controller(ocr, classification, report).run(COMPANY);

      assertThat(outcome).isInstanceOf(PipelineOutcome.Failed.class);
      StageFailure failure = ((PipelineOutcome.Failed) outcome).failure();
      assertThat(failure.stage()).isEqualTo(StageName.CLASSIFICATION);
      assertThat(failure.document()).isEqualTo("roto.pdf");
      assertThat(failure.errorType()).isEqualTo("InputDocumentException");
      assertThat(failure.reason()).isEqualTo("File is not readable");
      assertThat(report.invocationCount()).isZero();
      assertThat(snapshotStore.listStageSnapshots(COMPANY)).containsOnlyKeys(StageName.OCR);
      assertThat(
              meterRegistry.counter("pipeline.run.failure", "stage", "CLASSIFICATION").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail at OCR naming the document when the OCR service stays unavailable")
    void shouldFailAtOcrWhenServiceUnavailable(@TempDir Path companyDir) throws IOException {
      Path first = Files.write(companyDir.resolve("a.pdf"), new byte[] {1});
      Path second = Files.write(companyDir.resolve("b.pdf"), new byte[] {2});
      CompanyDocumentSource documentSource = mock(CompanyDocumentSource.class);
      when(documentSource.listDocuments(COMPANY)).thenReturn(List.of(first, second));
      ExternalCallExecutor externalCallExecutor = mock(ExternalCallExecutor.class);
      doReturn("Escritura pública")
          .when(externalCallExecutor)
          .call(eq(ExternalCapability.OCR), eq("a.pdf"), any());
      doThrow(new ExternalServiceException("ocr", "ocr call failed for b.pdf", null))
          .when(externalCallExecutor)
          .call(eq(ExternalCapability.OCR), eq("b.pdf"), any());
      config.getStorage().setOcrCacheEnabled(false);
      OcrStage ocr =
          new OcrStage(
              documentSource,
              mock(OcrService.class),
              new OcrCache(config, objectMapper),
              externalCallExecutor);
      StubStage classification =
          new StubStage(StageName.CLASSIFICATION, StageName.OCR)
              .returning(new ClassificationResult(arena, List.of()));

      PipelineOutcome outcome = controller(ocr, classification).run(COMPANY);

      assertThat(outcome).isInstanceOf(PipelineOutcome.Failed.class);
      StageFailure failure = ((PipelineOutcome.Failed) outcome).failure();
      assertThat(failure.stage()).isEqualTo(StageName.OCR);
      assertThat(failure.document()).isEqualTo("b.pdf");
      assertThat(failure.errorType()).isEqualTo("ExternalServiceException");
      assertThat(classification.invocationCount()).isZero();
      assertThat(snapshotStore.listStageSnapshots(COMPANY)).isEmpty();
    }

    @Test
    @DisplayName("Should write a FAILED run summary")
    void shouldWriteFailedRunSummary() throws Exception {
      StubStage ocr =
          new StubStage(StageName.OCR)
              .doing(
                  state -> {
                    throw new IllegalStateException("unexpected");
                  });
      StubStage report =
          new StubStage(StageName.REPORT, StageName.OCR)
              .returning(new ReportResult(emptyReport(), List.of()));

      controller(ocr, report).run(COMPANY);

      Path summaryFile = resultsDir.resolve(COMPANY + "_run_summary.json");
      assertThat(Files.exists(summaryFile)).isTrue();
      JsonNode summary = objectMapper.readTree(summaryFile.toFile());
      assertThat(summary.path("status").asText()).isEqualTo("FAILED");
      assertThat(summary.path("failure").path("stage").asText()).isEqualTo("OCR");
      assertThat(summary.path("failure").path("errorType").asText())
          .isEqualTo("IllegalStateException");
      assertThat(summary.path("stages").get(0).path("status").asText()).isEqualTo("FAILED");
      assertThat(summary.path("stages").get(1).path("status").asText()).isEqualTo("NOT_STARTED");
    }
  }

  private PipelineController controller(PipelineStage... stages) {
    return new PipelineController(
        new StageGraph(List.of(stages)),
        snapshotStore,
        new StageSnapshotMapper(),
        config,
        meterRegistry);
  }

  private static DocumentArena classified(DocumentArena arena) {
    return arena.map(
        d -> d.toBuilder().classification(DocumentClassification.ESCRITURA_PUBLICA).build());
  }

  private static LegalReport emptyReport() {
    return new LegalReport(new EnumMap<>(ReportSection.class));
  }
}
