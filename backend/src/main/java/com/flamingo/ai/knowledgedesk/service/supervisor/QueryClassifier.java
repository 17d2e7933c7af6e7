package com.flamingo.ai.knowledgedesk.service.supervisor;

/** Maps a query to per-specialist confidences. */
public interface QueryClassifier {

  Classification classify(String query);
}
