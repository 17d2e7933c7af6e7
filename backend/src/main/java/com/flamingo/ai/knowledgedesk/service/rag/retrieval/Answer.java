package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import java.util.List;

/**
 * A synthesized answer.
 *
 * @param text answer text
 * @param citations documents the answer drew on, in order of relevance
 * @param grounded false when nothing relevant was retrieved and the text is the fixed
 *     no-answer message
 */
public record Answer(String text, List<Citation> citations, boolean grounded) {

  public static final String NO_GROUNDED_ANSWER =
      "No results in the docs. I could not find anything relevant to your question.";

  public static Answer noGroundedAnswer() {
    return new Answer(NO_GROUNDED_ANSWER, List.of(), false);
  }
}
