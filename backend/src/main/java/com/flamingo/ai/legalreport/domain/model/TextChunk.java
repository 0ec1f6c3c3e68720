package com.flamingo.ai.legalreport.domain.model;

/**
 * A slice of document text destined for the vector index.
 *
 * @param id stable identifier derived from company, document and content
 */
public record TextChunk(String id, String company, String document, int chunkIndex, String text) {}
