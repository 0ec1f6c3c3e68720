package com.flamingo.ai.legalreport.service.vector;

import com.flamingo.ai.legalreport.domain.model.TextChunk;
import java.util.List;

/** Shared index of embedded document chunks. */
public interface VectorStoreService {

  /**
   * Embeds and stores chunks. A chunk whose id is already indexed is left untouched.
   *
   * @return the number of chunks newly written
   */
  int upsertEmbeddings(List<TextChunk> chunks);
}
