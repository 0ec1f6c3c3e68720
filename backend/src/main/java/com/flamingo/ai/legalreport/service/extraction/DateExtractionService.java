package com.flamingo.ai.legalreport.service.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.agent.PrimaryDateAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.exception.StructuredOutputParseException;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds every date in a document and picks its primary date. The model's choice is accepted only
 * when it is one of the dates actually found; otherwise the earliest date is used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DateExtractionService {

  private static final int MAX_DATE_CONTEXT_CHARS = 8000;

  private final SpanishDateParser dateParser;
  private final PrimaryDateAgent primaryDateAgent;
  private final LlmJsonParser jsonParser;
  private final ExternalCallExecutor externalCallExecutor;
  private final LegalPipelineConfig config;

  public List<LocalDate> extractDates(String text) {
    return dateParser.parse(text);
  }

  /**
   * Picks the primary date among {@code candidates}.
   *
   * @return the primary date, or null when the document has no dates
   */
  public LocalDate choosePrimaryDate(LegalDocument document, List<LocalDate> candidates) {
    if (candidates.isEmpty()) {
      return null;
    }
    LocalDate earliest = Collections.min(candidates);
    if (candidates.size() == 1 || !config.getExtraction().isLlmPrimaryDate()) {
      return earliest;
    }

    String dates =
        candidates.stream().map(LocalDate::toString).collect(Collectors.joining(", "));
    String excerpt =
        document.rawText().length() > MAX_DATE_CONTEXT_CHARS
            ? document.rawText().substring(0, MAX_DATE_CONTEXT_CHARS)
            : document.rawText();
    try {
      ObjectNode answer =
          externalCallExecutor.call(
              ExternalCapability.LLM,
              document.filename(),
              () -> jsonParser.parseObject(primaryDateAgent.choosePrimaryDate(dates, excerpt)));
      String chosen = answer.path("fecha_principal").asText(null);
      if (chosen != null) {
        LocalDate date = LocalDate.parse(chosen.trim());
        if (candidates.contains(date)) {
          return date;
        }
        log.debug(
            "Model picked {} for {}, which is not a candidate date", date, document.filename());
      }
    } catch (StructuredOutputParseException | DateTimeParseException e) {
      log.warn(
          "Could not read primary date choice for {}, using earliest date: {}",
          document.filename(),
          e.getMessage());
    }
    return earliest;
  }
}
