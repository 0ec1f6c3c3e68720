package com.flamingo.ai.legalreport.service.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * OCR results keyed by the SHA-256 of the source file bytes, stored as one JSON file per document.
 * An unchanged file is never sent to OCR twice. A cache that cannot be written only costs a repeat
 * OCR call on the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OcrCache {

  private final LegalPipelineConfig config;
  private final ObjectMapper objectMapper;

  public Optional<String> lookup(Path document) {
    if (!config.getStorage().isOcrCacheEnabled()) {
      return Optional.empty();
    }
    Path entry = entryFor(document);
    if (!Files.isRegularFile(entry)) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(entry.toFile());
      JsonNode text = node.get("text");
      if (text == null || !text.isTextual()) {
        log.warn("Ignoring malformed OCR cache entry {}", entry.getFileName());
        return Optional.empty();
      }
      log.debug("OCR cache hit for {}", document.getFileName());
      return Optional.of(text.asText());
    } catch (IOException e) {
      log.warn("Ignoring unreadable OCR cache entry {}: {}", entry.getFileName(), e.getMessage());
      return Optional.empty();
    }
  }

  public void store(Path document, String text) {
    if (!config.getStorage().isOcrCacheEnabled()) {
      return;
    }
    Path entry = entryFor(document);
    ObjectNode node = objectMapper.createObjectNode();
    node.put("filename", document.getFileName().toString());
    node.put("text", text);
    Path temp = null;
    try {
      Files.createDirectories(entry.getParent());
      temp = Files.createTempFile(entry.getParent(), "ocr-", ".tmp");
      Files.writeString(temp, objectMapper.writeValueAsString(node), StandardCharsets.UTF_8);
      Files.move(
          temp, entry, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      log.warn(
          "Could not cache OCR result for {} at {}: {}",
          document.getFileName(),
          entry,
          e.toString());
      discard(temp);
    }
  }

  private static void discard(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temporary OCR cache file {}: {}", temp, e.getMessage());
    }
  }

  private Path entryFor(Path document) {
    return Path.of(config.getStorage().getCacheDir()).resolve(sha256(document) + ".json");
  }

  private static String sha256(Path document) {
    try {
      HashCode hash = MoreFiles.asByteSource(document).hash(Hashing.sha256());
      return hash.toString();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to hash " + document, e);
    }
  }
}
