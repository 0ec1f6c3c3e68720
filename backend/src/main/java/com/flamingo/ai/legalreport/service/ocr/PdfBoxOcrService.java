package com.flamingo.ai.legalreport.service.ocr;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link OcrService} backed by the PDF text layer, read with Apache PDFBox 3.x. Suited to scans
 * that were already OCR'd by the scanner; image-only pages yield no text.
 */
@Service
@Slf4j
@ConditionalOnProperty(
    name = "legal.extraction.ocr-backend",
    havingValue = "pdfbox",
    matchIfMissing = true)
public class PdfBoxOcrService implements OcrService {

  @Override
  public String extractText(Path document) {
    try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      String text = stripper.getText(pdf);
      log.debug(
          "PDFBox extracted {} chars from {} ({} pages)",
          text.length(),
          document.getFileName(),
          pdf.getNumberOfPages());
      return text;
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", document.getFileName(), e.getMessage());
      throw new InputDocumentException(
          null,
          StageName.OCR,
          document.getFileName().toString(),
          "Failed to read PDF: " + e.getMessage(),
          e);
    }
  }
}
