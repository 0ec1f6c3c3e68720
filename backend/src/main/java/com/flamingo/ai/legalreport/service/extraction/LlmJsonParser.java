package com.flamingo.ai.legalreport.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.exception.StructuredOutputParseException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Parses the JSON object a model was asked to return. Tolerates Markdown code fences and chatter
 * around the object; anything else is a {@link StructuredOutputParseException}.
 */
@Component
@RequiredArgsConstructor
public class LlmJsonParser {

  private final ObjectMapper objectMapper;

  public ObjectNode parseObject(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new StructuredOutputParseException("Model returned an empty response", raw);
    }
    String candidate = stripCodeFence(raw.strip());
    int start = candidate.indexOf('{');
    int end = candidate.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new StructuredOutputParseException("Model response contains no JSON object", raw);
    }
    try {
      JsonNode node = objectMapper.readTree(candidate.substring(start, end + 1));
      if (!(node instanceof ObjectNode objectNode)) {
        throw new StructuredOutputParseException("Model response is not a JSON object", raw);
      }
      return objectNode;
    } catch (JsonProcessingException e) {
      throw new StructuredOutputParseException(
          "Model response is not valid JSON: " + e.getOriginalMessage(), raw, e);
    }
  }

  private static String stripCodeFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    String body = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
    int closing = body.lastIndexOf("```");
    return closing >= 0 ? body.substring(0, closing) : body;
  }
}
