package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import java.util.List;

/** Chunks retrieved for a query, highest score first. May be empty. */
public record RetrievalResult(List<ScoredChunk> chunks) {

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of());
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
