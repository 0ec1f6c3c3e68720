package com.flamingo.ai.legalreport.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable, index-addressed store of a company's documents. A document's index equals its
 * position and never changes between stages.
 */
public final class DocumentArena {

  private static final DocumentArena EMPTY = new DocumentArena(List.of());

  private final List<LegalDocument> documents;

  private DocumentArena(List<LegalDocument> documents) {
    this.documents = documents;
  }

  public static DocumentArena empty() {
    return EMPTY;
  }

  public static DocumentArena of(List<LegalDocument> documents) {
    for (int i = 0; i < documents.size(); i++) {
      if (documents.get(i).index() != i) {
        throw new IllegalArgumentException(
            "Document "
                + documents.get(i).filename()
                + " has index "
                + documents.get(i).index()
                + " but sits at position "
                + i);
      }
    }
    return new DocumentArena(List.copyOf(documents));
  }

  public LegalDocument get(int index) {
    return documents.get(index);
  }

  public int size() {
    return documents.size();
  }

  public boolean isEmpty() {
    return documents.isEmpty();
  }

  public List<LegalDocument> documents() {
    return documents;
  }

  /** Returns a new arena with every document passed through {@code transform}. */
  public DocumentArena map(UnaryOperator<LegalDocument> transform) {
    List<LegalDocument> updated = new ArrayList<>(documents.size());
    for (LegalDocument document : documents) {
      updated.add(transform.apply(document));
    }
    return of(updated);
  }

  /** Returns a new arena with the document at {@code document.index()} replaced. */
  public DocumentArena with(LegalDocument document) {
    List<LegalDocument> updated = new ArrayList<>(documents);
    updated.set(document.index(), document);
    return new DocumentArena(List.copyOf(updated));
  }
}
