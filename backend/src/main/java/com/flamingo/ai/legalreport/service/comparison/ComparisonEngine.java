package com.flamingo.ai.legalreport.service.comparison;

import com.flamingo.ai.legalreport.domain.enums.ChangeCategory;
import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.enums.LegalField;
import com.flamingo.ai.legalreport.domain.model.Comparison;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.FieldChange;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.PipelineWarning;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.pipeline.result.ComparisonResult;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Diffs every consecutive version pair of every group, field by field.
 *
 * <p>A pair where either document has no structured fields is skipped with a {@code
 * COMPARISON_ERROR} warning; the other pairs are still compared.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComparisonEngine {

  /** Report schema order first, then unknown fields alphabetically. */
  private static final Comparator<String> FIELD_ORDER =
      Comparator.<String>comparingInt(
              key -> LegalField.fromKey(key).map(Enum::ordinal).orElse(Integer.MAX_VALUE))
          .thenComparing(Comparator.naturalOrder());

  private final FieldValueNormalizer normalizer;
  private final ChangeSummarizer summarizer;

  public ComparisonResult compareAll(DocumentArena arena, VersioningResult versioning) {
    Map<DocumentClassification, List<Comparison>> comparisons =
        new EnumMap<>(DocumentClassification.class);
    List<PipelineWarning> warnings = new ArrayList<>();

    for (DocumentClassification group : DocumentClassification.values()) {
      List<VersionedDocument> lineage = versioning.group(group);
      List<Comparison> groupComparisons = new ArrayList<>();
      for (int i = 0; i + 1 < lineage.size(); i++) {
        VersionedDocument older = lineage.get(i);
        VersionedDocument newer = lineage.get(i + 1);
        LegalDocument olderDocument = arena.get(older.documentIndex());
        LegalDocument newerDocument = arena.get(newer.documentIndex());

        Optional<LegalDocument> missing = firstWithoutFields(olderDocument, newerDocument);
        if (missing.isPresent()) {
          String pair = pairLabel(group, older, newer);
          String message =
              "Document " + missing.get().filename() + " has no structured fields; pair skipped";
          log.warn("Comparison {} skipped: {}", pair, message);
          warnings.add(PipelineWarning.comparisonError(pair, message));
          continue;
        }
        groupComparisons.add(compare(older, newer, olderDocument, newerDocument));
      }
      comparisons.put(group, groupComparisons);
    }
    return new ComparisonResult(comparisons, warnings);
  }

  /** Compares one consecutive pair of the same group. */
  public Comparison compare(
      VersionedDocument older,
      VersionedDocument newer,
      LegalDocument olderDocument,
      LegalDocument newerDocument) {
    if (older.group() != newer.group() || newer.versionNumber() != older.versionNumber() + 1) {
      throw new IllegalArgumentException(
          "Only consecutive versions of one group can be compared: "
              + pairLabel(older.group(), older, newer));
    }

    Set<String> fieldNames = new LinkedHashSet<>(olderDocument.structuredFields().keySet());
    fieldNames.addAll(newerDocument.structuredFields().keySet());
    List<String> orderedFields = new ArrayList<>(fieldNames);
    orderedFields.sort(FIELD_ORDER);

    List<FieldChange> changes = new ArrayList<>();
    for (String field : orderedFields) {
      Object oldValue = olderDocument.field(field);
      Object newValue = newerDocument.field(field);
      if (normalizer.equivalent(field, oldValue, newValue)) {
        continue;
      }
      Optional<LegalField> known = LegalField.fromKey(field);
      ChangeCategory category = known.map(LegalField::category).orElse(ChangeCategory.OTHER);
      String label = known.map(LegalField::changeLabel).orElse("Modificación de " + field);
      String statement = summarizer.statement(label, oldValue, newValue);
      changes.add(new FieldChange(field, oldValue, newValue, category, statement));
    }

    List<String> narrative = changes.stream().map(FieldChange::statement).toList();
    String summary = summarizer.summarize(older.versionNumber(), changes);
    log.debug(
        "Compared {}: {} changes", pairLabel(older.group(), older, newer), changes.size());
    return new Comparison(
        older.group(),
        older.versionNumber(),
        newer.versionNumber(),
        older.documentIndex(),
        newer.documentIndex(),
        changes,
        narrative,
        summary);
  }

  private static Optional<LegalDocument> firstWithoutFields(LegalDocument a, LegalDocument b) {
    if (!a.hasStructuredFields()) {
      return Optional.of(a);
    }
    if (!b.hasStructuredFields()) {
      return Optional.of(b);
    }
    return Optional.empty();
  }

  private static String pairLabel(
      DocumentClassification group, VersionedDocument older, VersionedDocument newer) {
    return group.label() + " v" + older.versionNumber() + "-v" + newer.versionNumber();
  }
}
