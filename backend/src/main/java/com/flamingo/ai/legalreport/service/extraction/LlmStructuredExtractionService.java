package com.flamingo.ai.legalreport.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.agent.StructuredExtractionAgent;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.ValueKind;
import com.flamingo.ai.legalreport.service.resilience.ExternalCallExecutor;
import com.flamingo.ai.legalreport.service.resilience.ExternalCapability;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link StructuredExtractionService} backed by a LangChain4j AI service. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmStructuredExtractionService implements StructuredExtractionService {

  private final StructuredExtractionAgent extractionAgent;
  private final LlmJsonParser jsonParser;
  private final ObjectMapper objectMapper;
  private final ExternalCallExecutor externalCallExecutor;
  private final LegalPipelineConfig config;

  @Override
  public Map<String, Object> extractStructured(String text, ExtractionSchema schema) {
    if (text == null || text.isBlank()) {
      log.debug("Skipping structured extraction of empty text");
      return Map.of();
    }
    String input = truncate(text);
    ObjectNode answer =
        externalCallExecutor.call(
            ExternalCapability.LLM,
            schema.name(),
            () ->
                jsonParser.parseObject(
                    extractionAgent.extract(schema.name(), schema.describe(), input)));
    return toFieldMap(answer, schema);
  }

  private Map<String, Object> toFieldMap(ObjectNode answer, ExtractionSchema schema) {
    Map<String, Object> fields = new LinkedHashMap<>();
    for (ExtractionSchema.FieldSpec spec : schema.fields()) {
      fields.put(spec.key(), convert(answer.get(spec.key()), spec.kind()));
    }
    Map<String, Object> extra = new TreeMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = answer.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!fields.containsKey(entry.getKey())) {
        extra.put(entry.getKey(), convert(entry.getValue(), ValueKind.TEXT));
      }
    }
    if (!extra.isEmpty()) {
      log.debug("Model returned {} fields outside the schema: {}", extra.size(), extra.keySet());
      fields.putAll(extra);
    }
    return fields;
  }

  private Object convert(JsonNode node, ValueKind kind) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (kind == ValueKind.LIST) {
      List<Object> values = new ArrayList<>();
      if (node.isArray()) {
        node.forEach(element -> values.add(objectMapper.convertValue(element, Object.class)));
      } else if (!node.asText().isBlank()) {
        values.add(node.asText());
      }
      return values;
    }
    if (node.isValueNode()) {
      return node.asText();
    }
    return objectMapper.convertValue(node, Object.class);
  }

  private String truncate(String text) {
    int max = config.getExtraction().getMaxInputChars();
    if (text.length() <= max) {
      return text;
    }
    log.warn(
        "Document text too long for extraction, truncating from {} to {} chars",
        text.length(),
        max);
    return text.substring(0, max);
  }
}
