package com.flamingo.ai.legalreport.pipeline;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.Comparison;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.FieldChange;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.pipeline.result.ClassificationResult;
import com.flamingo.ai.legalreport.pipeline.result.ComparisonResult;
import com.flamingo.ai.legalreport.pipeline.result.DateExtractionResult;
import com.flamingo.ai.legalreport.pipeline.result.LegalizationResult;
import com.flamingo.ai.legalreport.pipeline.result.OcrResult;
import com.flamingo.ai.legalreport.pipeline.result.ReportResult;
import com.flamingo.ai.legalreport.pipeline.result.StageResult;
import com.flamingo.ai.legalreport.pipeline.result.VectorizationResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts stage results into the JSON shapes written to {@code {company}_{stage}_results.json}.
 * Maps are insertion-ordered so that equal results serialize to identical bytes.
 */
@Component
public class StageSnapshotMapper {

  static final String UNCLASSIFIED_LABEL = "otros";

  public Object toSnapshot(StageResult result, DocumentArena arena) {
    if (result instanceof OcrResult ocr) {
      return ocrSnapshot(ocr.arena());
    } else if (result instanceof DateExtractionResult dates) {
      return dateSnapshot(dates.arena());
    } else if (result instanceof ClassificationResult classification) {
      return classificationSnapshot(classification.arena());
    } else if (result instanceof VectorizationResult vectorization) {
      return vectorizationSnapshot(vectorization);
    } else if (result instanceof VersioningResult versioning) {
      return versioningSnapshot(versioning, arena);
    } else if (result instanceof ComparisonResult comparison) {
      return comparisonSnapshot(comparison, arena);
    } else if (result instanceof LegalizationResult legalization) {
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("documentos_analizados", legalization.documentsAnalyzed());
      json.put("poderes", legalization.powers());
      return json;
    } else if (result instanceof ReportResult report) {
      return report.report();
    }
    throw new IllegalArgumentException("Unknown stage result " + result.getClass().getName());
  }

  private List<Map<String, Object>> ocrSnapshot(DocumentArena arena) {
    List<Map<String, Object>> json = new ArrayList<>();
    for (LegalDocument document : arena.documents()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("filename", document.filename());
      entry.put("path", document.sourcePath() != null ? document.sourcePath().toString() : null);
      entry.put("text", document.rawText());
      json.add(entry);
    }
    return json;
  }

  private List<Map<String, Object>> dateSnapshot(DocumentArena arena) {
    List<Map<String, Object>> json = new ArrayList<>();
    for (LegalDocument document : arena.documents()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("filename", document.filename());
      entry.put("fechas", document.extractedDates().stream().map(LocalDate::toString).toList());
      entry.put("fecha_principal", iso(document.primaryDate()));
      json.add(entry);
    }
    return json;
  }

  private List<Map<String, Object>> classificationSnapshot(DocumentArena arena) {
    List<Map<String, Object>> json = new ArrayList<>();
    for (LegalDocument document : arena.documents()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("filename", document.filename());
      entry.put("fecha", iso(document.primaryDate()));
      entry.put(
          "clasificacion",
          document.isClassified() ? document.classification().label() : UNCLASSIFIED_LABEL);
      entry.put("es_modificacion", document.modification());
      entry.put("campos", document.structuredFields());
      json.add(entry);
    }
    return json;
  }

  private Map<String, Object> vectorizationSnapshot(VectorizationResult result) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("collection", result.collection());
    json.put("documentos_procesados", result.documentsProcessed());
    json.put("total_chunks", result.totalChunks());
    json.put("chunks_existentes", result.duplicateChunks());
    json.put("modo", result.mode().label());
    json.put("mensaje", result.message());
    return json;
  }

  private Map<String, Object> versioningSnapshot(VersioningResult result, DocumentArena arena) {
    Map<String, Object> json = new LinkedHashMap<>();
    for (DocumentClassification group : DocumentClassification.values()) {
      List<Map<String, Object>> versions = new ArrayList<>();
      for (VersionedDocument version : result.group(group)) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("filename", arena.get(version.documentIndex()).filename());
        entry.put("fecha", iso(version.primaryDate()));
        entry.put("version", version.versionNumber());
        entry.put("clasificacion", group.label());
        entry.put("base", version.base());
        versions.add(entry);
      }
      json.put(group.label(), versions);
    }
    return json;
  }

  private Map<String, Object> comparisonSnapshot(ComparisonResult result, DocumentArena arena) {
    Map<String, Object> json = new LinkedHashMap<>();
    for (DocumentClassification group : DocumentClassification.values()) {
      List<Map<String, Object>> pairs = new ArrayList<>();
      for (Comparison comparison : result.group(group)) {
        LegalDocument older = arena.get(comparison.sourceDocA());
        LegalDocument newer = arena.get(comparison.sourceDocB());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("de", comparison.fromVersion());
        entry.put("a", comparison.toVersion());
        entry.put("archivo_v1", older.filename());
        entry.put("archivo_vn", newer.filename());
        entry.put("fecha_v1", iso(older.primaryDate()));
        entry.put("fecha_vn", iso(newer.primaryDate()));
        entry.put("cambios", comparison.narrative());
        entry.put("campos", fieldChanges(comparison.changes()));
        entry.put("resumen", comparison.summary());
        pairs.add(entry);
      }
      json.put(group.label(), pairs);
    }
    return json;
  }

  private List<Map<String, Object>> fieldChanges(List<FieldChange> changes) {
    List<Map<String, Object>> json = new ArrayList<>();
    for (FieldChange change : changes) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("campo", change.field());
      entry.put("valor_anterior", change.oldValue());
      entry.put("valor_nuevo", change.newValue());
      json.add(entry);
    }
    return json;
  }

  private static String iso(LocalDate date) {
    return date != null ? date.toString() : null;
  }
}
