package com.flamingo.ai.legalreport.service.legalization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/** The catalogue of administration powers looked for in every document. */
@Component
@Slf4j
public class PowerCatalog {

  private final List<PowerDefinition> definitions;

  @Autowired
  public PowerCatalog(
      ResourceLoader resourceLoader, ObjectMapper objectMapper, LegalPipelineConfig config) {
    String location = config.getLegalization().getCatalogLocation();
    Resource resource = resourceLoader.getResource(location);
    try (InputStream input = resource.getInputStream()) {
      this.definitions =
          List.copyOf(objectMapper.readValue(input, new TypeReference<List<PowerDefinition>>() {}));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load powers catalog from " + location, e);
    }
    log.info("Loaded {} power definitions from {}", definitions.size(), location);
  }

  @VisibleForTesting
  PowerCatalog(List<PowerDefinition> definitions) {
    this.definitions = List.copyOf(definitions);
  }

  public List<PowerDefinition> definitions() {
    return definitions;
  }
}
