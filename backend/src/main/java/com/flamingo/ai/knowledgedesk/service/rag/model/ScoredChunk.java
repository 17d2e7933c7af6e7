package com.flamingo.ai.knowledgedesk.service.rag.model;

import com.flamingo.ai.knowledgedesk.elasticsearch.DocumentChunk;
import java.util.Comparator;

/**
 * A chunk returned by a similarity query.
 *
 * @param chunk the stored chunk (embedding not loaded)
 * @param score cosine similarity to the query vector, higher is closer
 */
public record ScoredChunk(DocumentChunk chunk, double score) {

  /** Highest score first; ties broken by collection, path and chunk position. */
  public static final Comparator<ScoredChunk> BY_SCORE_DESC =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparing(s -> s.chunk().getCollection())
          .thenComparing(s -> s.chunk().getPath())
          .thenComparingInt(s -> s.chunk().getChunkIndex());
}
