package com.flamingo.ai.legalreport.service.report;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.enums.FieldResolution;
import com.flamingo.ai.legalreport.domain.enums.LegalField;
import com.flamingo.ai.legalreport.domain.enums.ReportSection;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.LegalReport;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import com.flamingo.ai.legalreport.domain.model.PowerGrant;
import com.flamingo.ai.legalreport.domain.model.ResolvedValue;
import com.flamingo.ai.legalreport.domain.model.RestrictionEntry;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.pipeline.result.LegalizationResult;
import com.flamingo.ai.legalreport.pipeline.result.ReportResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves field values across versions and groups into the seven-section report.
 *
 * <ul>
 *   <li>{@link FieldResolution#LATEST}: per group the highest version with a non-blank value;
 *       across groups escritura publica, then inscripcion, then publicacion.
 *   <li>{@link FieldResolution#EARLIEST}: as LATEST but the lowest version wins.
 *   <li>{@link FieldResolution#BASE_ONLY}: only the version-1 escritura publica.
 *   <li>{@link FieldResolution#CUMULATIVE}: every entry of every version, deduplicated on
 *       identical entry and document.
 * </ul>
 *
 * <p>A required field nobody provides gets a null placeholder and a {@code REPORT_ERROR} warning;
 * generation always completes.
 */
@Service
@Slf4j
public class ReportAggregator {

  private static final Comparator<PowerGrant> POWER_ORDER =
      Comparator.comparingInt((PowerGrant p) -> p.classification().priority())
          .thenComparingInt(PowerGrant::version)
          .thenComparing(PowerGrant::document)
          .thenComparing(PowerGrant::code);

  public ReportResult aggregate(
      DocumentArena arena, VersioningResult versioning, LegalizationResult legalization) {
    Map<ReportSection, Map<String, ResolvedValue>> sections = new EnumMap<>(ReportSection.class);
    List<PipelineWarning> warnings = new ArrayList<>();

    for (ReportSection section : ReportSection.values()) {
      Map<String, ResolvedValue> fields = new LinkedHashMap<>();
      for (LegalField field : LegalField.inSection(section)) {
        ResolvedValue value = resolve(field, arena, versioning, legalization);
        if (value.isMissing() && field.required()) {
          log.warn("Required field {} not found in any document", field.key());
          warnings.add(
              PipelineWarning.reportError(
                  field.key(), "Required field " + field.key() + " not found in any document"));
        }
        fields.put(field.key(), value);
      }
      sections.put(section, fields);
    }
    log.info("Report assembled with {} missing required fields", warnings.size());
    return new ReportResult(new LegalReport(sections), warnings);
  }

  private ResolvedValue resolve(
      LegalField field,
      DocumentArena arena,
      VersioningResult versioning,
      LegalizationResult legalization) {
    return switch (field.resolution()) {
      case LATEST -> firstNonBlank(field, arena, versioning, true);
      case EARLIEST -> firstNonBlank(field, arena, versioning, false);
      case BASE_ONLY -> fromBaseDeed(field, arena, versioning);
      case CUMULATIVE -> field == LegalField.FACULTADES_ENCONTRADAS
          ? new ResolvedValue(collectPowers(legalization), null, null, null)
          : new ResolvedValue(collectRestrictions(field, arena, versioning), null, null, null);
    };
  }

  private ResolvedValue firstNonBlank(
      LegalField field, DocumentArena arena, VersioningResult versioning, boolean latest) {
    for (DocumentClassification group : DocumentClassification.values()) {
      List<VersionedDocument> lineage = new ArrayList<>(versioning.group(group));
      if (latest) {
        lineage.sort(Comparator.comparingInt(VersionedDocument::versionNumber).reversed());
      }
      for (VersionedDocument version : lineage) {
        Optional<ResolvedValue> value = valueOf(field, arena, version);
        if (value.isPresent()) {
          return value.get();
        }
      }
    }
    return ResolvedValue.missing();
  }

  private ResolvedValue fromBaseDeed(
      LegalField field, DocumentArena arena, VersioningResult versioning) {
    return versioning.group(DocumentClassification.ESCRITURA_PUBLICA).stream()
        .filter(VersionedDocument::base)
        .findFirst()
        .flatMap(base -> valueOf(field, arena, base))
        .orElse(ResolvedValue.missing());
  }

  private Optional<ResolvedValue> valueOf(
      LegalField field, DocumentArena arena, VersionedDocument version) {
    LegalDocument document = arena.get(version.documentIndex());
    Object value = document.field(field.key());
    if (TextNormalizer.isBlank(value)) {
      return Optional.empty();
    }
    return Optional.of(
        new ResolvedValue(value, document.filename(), version.group(), version.versionNumber()));
  }

  private List<PowerGrant> collectPowers(LegalizationResult legalization) {
    List<PowerGrant> ordered = new ArrayList<>(legalization.powers());
    ordered.sort(POWER_ORDER);
    Set<String> seen = new HashSet<>();
    List<PowerGrant> unique = new ArrayList<>();
    for (PowerGrant grant : ordered) {
      if (seen.add(grant.code() + "\u0000" + grant.document())) {
        unique.add(grant);
      }
    }
    return unique;
  }

  private List<RestrictionEntry> collectRestrictions(
      LegalField field, DocumentArena arena, VersioningResult versioning) {
    Set<String> seen = new HashSet<>();
    List<RestrictionEntry> entries = new ArrayList<>();
    for (VersionedDocument version : versioning.all()) {
      LegalDocument document = arena.get(version.documentIndex());
      for (String description : asStrings(document.field(field.key()))) {
        if (seen.add(description + "\u0000" + document.filename())) {
          entries.add(
              new RestrictionEntry(
                  description, document.filename(), version.versionNumber(), version.group()));
        }
      }
    }
    return entries;
  }

  private static List<String> asStrings(Object value) {
    if (TextNormalizer.isBlank(value)) {
      return List.of();
    }
    Collection<?> elements = value instanceof Collection<?> c ? c : List.of(value);
    return elements.stream()
        .filter(e -> !TextNormalizer.isBlank(e))
        .map(e -> String.valueOf(e).strip())
        .toList();
  }
}
