package com.flamingo.ai.knowledgedesk.service.rag.model;

import java.util.List;

/**
 * A chunk produced by the chunker, before embedding.
 *
 * @param content chunk text
 * @param sectionBreadcrumb heading path of the section the chunk came from
 * @param chunkIndex position within the document, 0-based
 */
public record RawDocumentChunk(String content, List<String> sectionBreadcrumb, int chunkIndex) {

  /** Rough token count: four characters per token. */
  public int estimatedTokens() {
    return content.length() / 4;
  }
}
