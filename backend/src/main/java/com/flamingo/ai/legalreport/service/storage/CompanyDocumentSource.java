package com.flamingo.ai.legalreport.service.storage;

import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Locates a company's input PDFs under {@code {dataDir}/{company}/}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompanyDocumentSource {

  private final LegalPipelineConfig config;

  public Path companyDirectory(String company) {
    return Path.of(config.getStorage().getDataDir()).resolve(company);
  }

  /**
   * Lists the company's PDF files sorted by file name. Files with other extensions are ignored.
   *
   * @throws InputDocumentException if the folder is missing or holds no PDF
   */
  public List<Path> listDocuments(String company) {
    Path directory = companyDirectory(company);
    if (!Files.isDirectory(directory)) {
      throw new InputDocumentException(
          company, null, "Company folder not found: " + directory.toAbsolutePath());
    }
    List<Path> documents;
    try (Stream<Path> files = Files.list(directory)) {
      documents =
          files
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
              .sorted(Comparator.comparing(p -> p.getFileName().toString()))
              .toList();
    } catch (IOException e) {
      throw new InputDocumentException(
          company, StageName.OCR, null, "Cannot list " + directory + ": " + e.getMessage(), e);
    }
    if (documents.isEmpty()) {
      throw new InputDocumentException(company, null, "No PDF documents in " + directory);
    }
    log.info("Found {} PDF documents for company={}", documents.size(), company);
    return documents;
  }
}
