package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;

/**
 * A query for the supervisor.
 *
 * @param query the user's question
 * @param chosenSpecialist the user's answer to a clarification request, null on first ask
 * @param conversationId correlates a clarification with the reply, may be null
 */
public record RouteRequest(String query, SpecialistTag chosenSpecialist, String conversationId) {

  public RouteRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
  }

  public static RouteRequest of(String query) {
    return new RouteRequest(query, null, null);
  }

  /** Re-submits the original query with the specialist the user picked. */
  public RouteRequest clarified(SpecialistTag choice) {
    return new RouteRequest(query, choice, conversationId);
  }
}
