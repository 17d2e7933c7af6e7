package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.RouteState;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import java.util.List;

/**
 * Streaming counterpart of {@link RoutedAnswer}. Routing and retrieval are done when this is
 * returned; the fragments of {@code answer} are produced on subscription.
 */
public record RoutedStreamingAnswer(
    RouteState finalState,
    List<RouteState> trace,
    Classification classification,
    StreamingAnswer answer,
    List<SpecialistTag> answeredBy,
    Clarification clarification,
    boolean failed) {

  public boolean awaitingUser() {
    return finalState == RouteState.AWAITING_USER;
  }
}
