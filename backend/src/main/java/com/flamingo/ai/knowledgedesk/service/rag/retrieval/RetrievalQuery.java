package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import java.util.List;

/**
 * A question to answer from one or more collections.
 *
 * <p>Null retrieval parameters fall back to the {@code rag.retrieval} defaults.
 *
 * @param text the user's question
 * @param collections collections to search, at least one
 * @param topK maximum chunks kept after merging
 * @param minScore chunks scoring below this are discarded
 * @param tokenBudget maximum estimated tokens of context sent to the model
 */
public record RetrievalQuery(
    String text, List<String> collections, Integer topK, Double minScore, Integer tokenBudget) {

  public RetrievalQuery {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Query text must not be blank");
    }
    if (collections == null || collections.isEmpty()) {
      throw new IllegalArgumentException("At least one collection is required");
    }
    collections = List.copyOf(collections);
  }

  public static RetrievalQuery of(String text, List<String> collections) {
    return new RetrievalQuery(text, collections, null, null, null);
  }
}
