package com.flamingo.ai.legalreport.service.ocr;

import com.flamingo.ai.legalreport.domain.enums.StageName;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.pdf.PDFParserConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link OcrService} using Apache Tika's {@link AutoDetectParser}. PDF pages without a text layer
 * are sent to Tesseract when it is installed on the host.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "legal.extraction.ocr-backend", havingValue = "tika")
public class TikaOcrService implements OcrService {

  private final String ocrLanguage;

  public TikaOcrService(@Value("${legal.extraction.ocr-language:spa}") String ocrLanguage) {
    this.ocrLanguage = ocrLanguage;
  }

  @Override
  public String extractText(Path document) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, "application/pdf");

    PDFParserConfig pdfConfig = new PDFParserConfig();
    pdfConfig.setOcrStrategy(PDFParserConfig.OCR_STRATEGY.AUTO);
    TesseractOCRConfig ocrConfig = new TesseractOCRConfig();
    ocrConfig.setLanguage(ocrLanguage);

    ParseContext context = new ParseContext();
    context.set(Parser.class, parser);
    context.set(PDFParserConfig.class, pdfConfig);
    context.set(TesseractOCRConfig.class, ocrConfig);

    try (InputStream input = Files.newInputStream(document)) {
      parser.parse(input, handler, metadata, context);
      String text = handler.toString();
      log.debug("Tika extracted {} chars from {}", text.length(), document.getFileName());
      return text;
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika parsing failed for {}: {}", document.getFileName(), e.getMessage());
      throw new InputDocumentException(
          null,
          StageName.OCR,
          document.getFileName().toString(),
          "Failed to extract text: " + e.getMessage(),
          e);
    }
  }
}
