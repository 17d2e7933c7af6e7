package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.RouteState;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import java.util.List;

/**
 * Outcome of routing one query.
 *
 * @param finalState {@link RouteState#RESPONDED} or {@link RouteState#AWAITING_USER}
 * @param trace every state the query passed through
 * @param classification the scores the decision was based on
 * @param answer the synthesized answer, null while awaiting the user
 * @param answeredBy specialists whose answers were merged, best first
 * @param clarification what to ask the user, null unless awaiting the user
 * @param failed true when every dispatched specialist failed; the answer then says so
 */
public record RoutedAnswer(
    RouteState finalState,
    List<RouteState> trace,
    Classification classification,
    Answer answer,
    List<SpecialistTag> answeredBy,
    Clarification clarification,
    boolean failed) {

  public boolean awaitingUser() {
    return finalState == RouteState.AWAITING_USER;
  }
}
