package com.flamingo.ai.legalreport.service.text;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping windows. A window ends at the last whitespace inside it when one
 * exists in its second half, so words are not cut.
 */
@Component
public class TextChunker {

  public List<String> split(String text, int size, int overlap) {
    Preconditions.checkArgument(size > 0, "size must be positive");
    Preconditions.checkArgument(overlap >= 0 && overlap < size, "overlap must be in [0, size)");
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }
    String source = text.strip();
    int start = 0;
    while (start < source.length()) {
      int end = Math.min(start + size, source.length());
      if (end < source.length()) {
        int lastSpace = source.lastIndexOf(' ', end);
        if (lastSpace > start + size / 2) {
          end = lastSpace;
        }
      }
      String chunk = source.substring(start, end).strip();
      if (!chunk.isEmpty()) {
        chunks.add(chunk);
      }
      if (end >= source.length()) {
        break;
      }
      start = Math.max(end - overlap, start + 1);
    }
    return chunks;
  }
}
