package com.flamingo.ai.legalreport.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.agent.PrimaryDateAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DateExtractionService Tests")
class DateExtractionServiceTest {

  private static final LegalDocument DEED =
      LegalDocument.builder()
          .index(0)
          .filename("modificacion.pdf")
          .rawText("Santiago, 10-05-2021. Modifica la sociedad constituida el 20-01-2015.")
          .build();
  private static final List<LocalDate> CANDIDATES =
      List.of(LocalDate.of(2021, 5, 10), LocalDate.of(2015, 1, 20));

  @Mock private PrimaryDateAgent primaryDateAgent;
  @Mock private ExternalCallExecutor externalCallExecutor;

  private LegalPipelineConfig config;
  private DateExtractionService dateExtractionService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(externalCallExecutor.call(any(), anyString(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(2).get());
    config = new LegalPipelineConfig();
    dateExtractionService =
        new DateExtractionService(
            new SpanishDateParser(),
            primaryDateAgent,
            new LlmJsonParser(new ObjectMapper()),
            externalCallExecutor,
            config);
  }

  @Test
  @DisplayName("Should extract every date in order of appearance")
  void shouldExtractDates() {
    assertThat(dateExtractionService.extractDates(DEED.rawText())).isEqualTo(CANDIDATES);
  }

  @Test
  @DisplayName("Should accept the model choice when it is a candidate")
  void shouldAcceptCandidateChoice() {
    when(primaryDateAgent.choosePrimaryDate(eq("2021-05-10, 2015-01-20"), anyString()))
        .thenReturn("{\"fecha_principal\": \"2021-05-10\"}");

    assertThat(dateExtractionService.choosePrimaryDate(DEED, CANDIDATES))
        .isEqualTo(LocalDate.of(2021, 5, 10));
  }

  @Test
  @DisplayName("Should fall back to the earliest date when the model invents one")
  void shouldRejectInventedDate() {
    when(primaryDateAgent.choosePrimaryDate(anyString(), anyString()))
        .thenReturn("{\"fecha_principal\": \"2022-01-01\"}");

    assertThat(dateExtractionService.choosePrimaryDate(DEED, CANDIDATES))
        .isEqualTo(LocalDate.of(2015, 1, 20));
  }

  @Test
  @DisplayName("Should fall back to the earliest date on an unreadable answer")
  void shouldFallBackOnUnreadableAnswer() {
    when(primaryDateAgent.choosePrimaryDate(anyString(), anyString()))
        .thenReturn("{\"fecha_principal\": \"10 de mayo\"}");

    assertThat(dateExtractionService.choosePrimaryDate(DEED, CANDIDATES))
        .isEqualTo(LocalDate.of(2015, 1, 20));
  }

  @Test
  @DisplayName("Should not ask the model about a single date")
  void shouldSkipModelForSingleDate() {
    assertThat(dateExtractionService.choosePrimaryDate(DEED, List.of(LocalDate.of(2020, 1, 1))))
        .isEqualTo(LocalDate.of(2020, 1, 1));
    assertThat(dateExtractionService.choosePrimaryDate(DEED, List.of())).isNull();
    verifyNoInteractions(primaryDateAgent);
  }
}
