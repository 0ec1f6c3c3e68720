package com.flamingo.ai.legalreport.service.versioning;

import com.flamingo.ai.legalreport.domain.enums.DocumentClassification;
import com.flamingo.ai.legalreport.domain.model.DocumentArena;
import com.flamingo.ai.legalreport.domain.model.LegalDocument;
import com.flamingo.ai.legalreport.domain.model.VersionedDocument;
import com.flamingo.ai.legalreport.exception.VersioningException;
import com.flamingo.ai.legalreport.pipeline.result.VersioningResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orders classified documents into version lineages, one per classification group.
 *
 * <p>Inside a group documents are sorted by primary date, ties by file name; the version is the
 * 1-based rank and version 1 is the base document. Unclassified documents take no part.
 */
@Service
@Slf4j
public class VersioningEngine {

  private static final Comparator<LegalDocument> LINEAGE_ORDER =
      Comparator.comparing(LegalDocument::primaryDate).thenComparing(LegalDocument::filename);

  /**
   * Builds the version lineage of every group.
   *
   * @throws VersioningException if a classified document has no primary date
   */
  public VersioningResult version(DocumentArena arena) {
    Map<DocumentClassification, List<LegalDocument>> byGroup =
        new EnumMap<>(DocumentClassification.class);
    for (DocumentClassification group : DocumentClassification.values()) {
      byGroup.put(group, new ArrayList<>());
    }

    for (LegalDocument document : arena.documents()) {
      if (!document.isClassified()) {
        log.debug("Document {} is unclassified, not versioned", document.filename());
        continue;
      }
      if (document.primaryDate() == null) {
        throw new VersioningException(
            document.filename(),
            "Document " + document.filename() + " has no primary date and cannot be versioned");
      }
      byGroup.get(document.classification()).add(document);
    }

    Map<DocumentClassification, List<VersionedDocument>> lineages =
        new EnumMap<>(DocumentClassification.class);
    byGroup.forEach((group, documents) -> lineages.put(group, lineage(group, documents)));
    return new VersioningResult(lineages);
  }

  private List<VersionedDocument> lineage(
      DocumentClassification group, List<LegalDocument> documents) {
    List<LegalDocument> ordered = new ArrayList<>(documents);
    ordered.sort(LINEAGE_ORDER);
    List<VersionedDocument> versions = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      LegalDocument document = ordered.get(i);
      int version = i + 1;
      versions.add(
          new VersionedDocument(
              document.index(), group, version, document.primaryDate(), version == 1));
    }
    log.info("Group {} has {} versions", group.label(), versions.size());
    return versions;
  }
}
