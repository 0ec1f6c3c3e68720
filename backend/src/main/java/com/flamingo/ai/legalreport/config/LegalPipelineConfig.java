package com.flamingo.ai.legalreport.config;

import com.flamingo.ai.legalreport.domain.enums.PipelineMode;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the legal report pipeline. */
@Configuration
@ConfigurationProperties(prefix = "legal")
@Getter
@Setter
public class LegalPipelineConfig {

  private Pipeline pipeline = new Pipeline();
  private Storage storage = new Storage();
  private Extraction extraction = new Extraction();
  private Comparison comparison = new Comparison();
  private Vectorization vectorization = new Vectorization();
  private Legalization legalization = new Legalization();
  private Execution execution = new Execution();

  @Getter
  @Setter
  public static class Pipeline {
    /** Read document facts straight from OCR text instead of a vector index. */
    private boolean extractFromOcr = true;

    /** Explicit mode override; when null the mode follows {@link #extractFromOcr}. */
    private PipelineMode mode;

    public PipelineMode resolveMode() {
      return PipelineMode.resolve(mode, extractFromOcr);
    }
  }

  @Getter
  @Setter
  public static class Storage {
    private String dataDir = "data";
    private String resultsDir = "results";
    private String cacheDir = "ocr_cache";
    private boolean ocrCacheEnabled = true;
  }

  @Getter
  @Setter
  public static class Extraction {
    private String ocrBackend = "pdfbox";

    /** Text sent to the extraction model is cut to this many characters. */
    private int maxInputChars = 24000;

    /** Ask the model for the classification; keyword rules still apply as fallback. */
    private boolean llmClassification = true;

    /** Ask the model to pick the primary date; otherwise the earliest date is used. */
    private boolean llmPrimaryDate = true;
  }

  @Getter
  @Setter
  public static class Comparison {
    /** Absolute difference under which two monetary amounts are considered equal. */
    private double monetaryTolerance = 1.0;
  }

  @Getter
  @Setter
  public static class Vectorization {
    private String indexName = "legal-document-chunks";
    private int chunkSize = 1200;
    private int chunkOverlap = 150;
    private int embeddingDimensions = 1536;
  }

  @Getter
  @Setter
  public static class Legalization {
    private String catalogLocation = "classpath:catalog/facultades.json";
    private boolean llmVerification = true;
    private int fragmentSize = 1000;
    private int fragmentOverlap = 120;
    private int maxCandidatesPerPower = 3;
    private double minConfidence = 0.5;
  }

  @Getter
  @Setter
  public static class Execution {
    private int maxConcurrentCompanies = 2;
    private int externalCallThreads = 4;
    private Duration runTimeout = Duration.ofHours(2);
  }
}
