package com.flamingo.ai.legalreport.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.PipelineMode;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.exception.ExternalServiceException;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import com.flamingo.ai.legalreport.pipeline.ProcessingStates;
import com.flamingo.ai.legalreport.pipeline.result.OcrResult;
import com.flamingo.ai.legalreport.service.ocr.OcrCache;
import com.flamingo.ai.legalreport.service.ocr.OcrService;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import com.flamingo.ai.legalreport.service.storage.CompanyDocumentSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OcrStage Tests")
class OcrStageTest {

  @TempDir Path companyDir;

  @Mock private CompanyDocumentSource documentSource;
  @Mock private OcrService ocrService;
  @Mock private OcrCache ocrCache;
  @Mock private ExternalCallExecutor externalCallExecutor;

  private OcrStage stage;
  private Path first;
  private Path second;

  @BeforeEach
  void setUp() throws IOException {
    lenient()
        .when(externalCallExecutor.call(any(), anyString(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(2).get());
    first = Files.write(companyDir.resolve("a_constitucion.pdf"), new byte[] {1});
    second = Files.write(companyDir.resolve("b_extracto.pdf"), new byte[] {2});
    when(documentSource.listDocuments("alfa")).thenReturn(List.of(first, second));
    stage = new OcrStage(documentSource, ocrService, ocrCache, externalCallExecutor);
  }

  @Test
  @DisplayName("Should build the arena in file order, serving cached text when present")
  void shouldReadDocumentsInOrder() {
    when(ocrCache.lookup(first)).thenReturn(Optional.of("texto en cache"));
    when(ocrCache.lookup(second)).thenReturn(Optional.empty());
    when(ocrService.extractText(second)).thenReturn("texto nuevo");

    OcrResult result =
        (OcrResult)
            stage.execute(ProcessingStates.after("alfa", PipelineMode.OCR_DIRECT, Map.of()));

    assertThat(result.cachedDocuments()).isEqualTo(1);
    assertThat(result.arena().documents())
        .extracting(LegalDocument::index, LegalDocument::filename, LegalDocument::rawText)
        .containsExactly(
            tuple(0, "a_constitucion.pdf", "texto en cache"),
            tuple(1, "b_extracto.pdf", "texto nuevo"));
    verify(ocrService, never()).extractText(first);
    verify(ocrCache).store(second, "texto nuevo");
    verify(ocrCache, never()).store(eq(first), anyString());
  }

  @Test
  @DisplayName("Should fail the stage with the document name when OCR rejects a file")
  void shouldFailOnUnreadableDocument() {
    when(ocrCache.lookup(any())).thenReturn(Optional.empty());
    when(ocrService.extractText(first)).thenReturn("ok");
    when(ocrService.extractText(second))
        .thenThrow(new InputDocumentException(null, null, "Encrypted PDF"));

    assertThatThrownBy(
            () -> stage.execute(ProcessingStates.after("alfa", PipelineMode.OCR_DIRECT, Map.of())))
        .isInstanceOfSatisfying(
            InputDocumentException.class,
            e -> {
              assertThat(e.getCompany()).isEqualTo("alfa");
              assertThat(e.getStage()).isEqualTo(StageName.OCR);
              assertThat(e.getDocument()).isEqualTo("b_extracto.pdf");
            });
  }

  @Test
  @DisplayName("Should fail the stage with the document name when the OCR service stays down")
  void shouldFailWhenOcrServiceUnavailable() {
    when(ocrCache.lookup(any())).thenReturn(Optional.empty());
    when(ocrService.extractText(first)).thenReturn("ok");
    doThrow(new ExternalServiceException("ocr", "ocr call failed for b_extracto.pdf", null))
        .when(externalCallExecutor)
        .call(eq(ExternalCapability.OCR), eq("b_extracto.pdf"), any());

    assertThatThrownBy(
            () -> stage.execute(ProcessingStates.after("alfa", PipelineMode.OCR_DIRECT, Map.of())))
        .isInstanceOfSatisfying(
            ExternalServiceException.class,
            e -> {
              assertThat(e.getCompany()).isEqualTo("alfa");
              assertThat(e.getStage()).isEqualTo(StageName.OCR);
              assertThat(e.getDocument()).isEqualTo("b_extracto.pdf");
              assertThat(e.getCapability()).isEqualTo("ocr");
            });
    verify(ocrService, never()).extractText(second);
    verify(ocrCache, never()).store(eq(second), anyString());
  }

  @Test
  @DisplayName("Should complete the stage when the OCR cache cannot be written")
  void shouldCompleteWithUnwritableCache() throws IOException {
    LegalPipelineConfig config = new LegalPipelineConfig();
    Path blocker = Files.writeString(companyDir.resolve("ocr_cache"), "not a directory");
    config.getStorage().setCacheDir(blocker.toString());
    OcrStage withRealCache =
        new OcrStage(
            documentSource,
            ocrService,
            new OcrCache(config, new ObjectMapper()),
            externalCallExecutor);
    when(ocrService.extractText(first)).thenReturn("texto uno");
    when(ocrService.extractText(second)).thenReturn("texto dos");

    OcrResult result =
        (OcrResult)
            withRealCache.execute(
                ProcessingStates.after("alfa", PipelineMode.OCR_DIRECT, Map.of()));

    assertThat(result.cachedDocuments()).isZero();
    assertThat(result.arena().documents())
        .extracting(LegalDocument::rawText)
        .containsExactly("texto uno", "texto dos");
  }
}
